package com.walletpnl.config;

import com.walletpnl.common.BaseAssetRegistry;
import com.walletpnl.ingestion.classifier.BalanceDeltaExtractor;
import com.walletpnl.ingestion.classifier.ClassifierSettings;
import com.walletpnl.ingestion.classifier.SwapClassifier;
import com.walletpnl.ledger.engine.DirectionResolver;
import com.walletpnl.ledger.engine.LedgerSettings;
import com.walletpnl.ledger.engine.PerformanceAggregator;
import com.walletpnl.ledger.engine.PositionLedger;
import com.walletpnl.ledger.query.PerformanceQueryService;
import com.walletpnl.ledger.store.InMemoryLedgerStore;
import com.walletpnl.ledger.store.LedgerStore;
import com.walletpnl.pricing.TokenPricer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Classifier and ledger wiring from walletpnl.tracker settings.
 */
@Configuration
@EnableConfigurationProperties(TrackerProperties.class)
public class TrackerConfig {

    @Bean
    public BaseAssetRegistry baseAssetRegistry(TrackerProperties properties) {
        return new BaseAssetRegistry(properties.getBaseMints());
    }

    @Bean
    public SwapClassifier swapClassifier(TrackerProperties properties, TokenPricer tokenPricer) {
        BalanceDeltaExtractor extractor = new BalanceDeltaExtractor(new ClassifierSettings(properties.getNoiseFloor()));
        return new SwapClassifier(extractor, tokenPricer);
    }

    @Bean
    public DirectionResolver directionResolver(BaseAssetRegistry baseAssetRegistry) {
        return new DirectionResolver(baseAssetRegistry);
    }

    @Bean
    public LedgerStore ledgerStore() {
        return new InMemoryLedgerStore();
    }

    @Bean
    public PositionLedger positionLedger(LedgerStore ledgerStore, TokenPricer tokenPricer,
                                         TrackerProperties properties) {
        LedgerSettings settings = new LedgerSettings(properties.getDustThreshold(), properties.getMinMeaningfulPnlUsd());
        return new PositionLedger(ledgerStore, tokenPricer, settings);
    }

    @Bean
    public PerformanceAggregator performanceAggregator() {
        return new PerformanceAggregator();
    }

    @Bean
    public PerformanceQueryService performanceQueryService(LedgerStore ledgerStore) {
        return new PerformanceQueryService(ledgerStore);
    }
}
