package com.walletpnl.tracker;

import com.walletpnl.common.BaseAssetRegistry;
import com.walletpnl.config.TrackerProperties;
import com.walletpnl.domain.RawSwapTransaction;
import com.walletpnl.domain.Trade;
import com.walletpnl.domain.TradeDirection;
import com.walletpnl.domain.TradeRecordedEvent;
import com.walletpnl.domain.TradeType;
import com.walletpnl.domain.WalletPerformance;
import com.walletpnl.ingestion.classifier.SwapClassifier;
import com.walletpnl.ledger.engine.DirectionResolver;
import com.walletpnl.ledger.engine.LedgerSettings;
import com.walletpnl.ledger.engine.PerformanceAggregator;
import com.walletpnl.ledger.engine.PositionLedger;
import com.walletpnl.ledger.store.InMemoryLedgerStore;
import com.walletpnl.pricing.FixedTokenPricer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.Optional;

import static com.walletpnl.domain.TestSwaps.SOL;
import static com.walletpnl.domain.TestSwaps.TOKEN_A;
import static com.walletpnl.domain.TestSwaps.TOKEN_B;
import static com.walletpnl.domain.TestSwaps.USDC;
import static com.walletpnl.domain.TestSwaps.WALLET;
import static com.walletpnl.domain.TestSwaps.buy;
import static com.walletpnl.domain.TestSwaps.leg;
import static com.walletpnl.domain.TestSwaps.sell;
import static com.walletpnl.domain.TestSwaps.swap;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SwapProcessingServiceTest {

    private final RawSwapTransaction tx = new RawSwapTransaction("sig", WALLET, null,
            List.of(), List.of(), List.of(), List.of(), List.of());

    @Mock
    private SwapClassifier classifier;
    @Mock
    private ApplicationEventPublisher publisher;

    private InMemoryLedgerStore store;
    private SwapProcessingService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryLedgerStore();
        service = new SwapProcessingService(
                classifier,
                new DirectionResolver(BaseAssetRegistry.defaults()),
                new PositionLedger(store, new FixedTokenPricer(), LedgerSettings.defaults()),
                new PerformanceAggregator(),
                store,
                new WalletWorkQueue(Runnable::run),
                publisher,
                new TrackerProperties());
    }

    @Test
    @DisplayName("buy is applied, aggregated and published")
    void buy_appliedAndPublished() {
        when(classifier.classify(tx)).thenReturn(Optional.of(buy("sig-1", 0, TOKEN_A, "100", "10")));

        List<Trade> trades = service.process(tx).join();

        assertThat(trades).singleElement().extracting(Trade::type).isEqualTo(TradeType.BUY);
        WalletPerformance performance = store.find(WALLET).orElseThrow();
        assertThat(performance.getPositions()).containsKey(TOKEN_A);
        assertThat(performance.getTotalInvested()).isEqualByComparingTo("10");
        ArgumentCaptor<TradeRecordedEvent> event = ArgumentCaptor.forClass(TradeRecordedEvent.class);
        verify(publisher).publishEvent(event.capture());
        assertThat(event.getValue().direction()).isEqualTo(TradeDirection.BUY);
        assertThat(event.getValue().walletAddress()).isEqualTo(WALLET);
    }

    @Test
    @DisplayName("token-to-token swap publishes one event per recorded trade")
    void tokenToToken_publishesSellAndBuy() {
        when(classifier.classify(tx))
                .thenReturn(Optional.of(buy("sig-1", 0, TOKEN_A, "100", "10")))
                .thenReturn(Optional.of(swap("sig-2", 1, leg(TOKEN_A, "AAA", "100", "20"),
                        leg(TOKEN_B, "BBB", "5", "20"))));

        service.process(tx).join();
        List<Trade> trades = service.process(tx).join();

        assertThat(trades).extracting(Trade::type).containsExactly(TradeType.SELL, TradeType.BUY);
        verify(publisher, times(3)).publishEvent(any(TradeRecordedEvent.class));
    }

    @Test
    @DisplayName("swaps worth less than the minimum are dropped before the ledger")
    void belowMinimum_skipped() {
        when(classifier.classify(tx)).thenReturn(Optional.of(buy("sig-1", 0, TOKEN_A, "100", "0.4")));

        assertThat(service.process(tx).join()).isEmpty();
        assertThat(store.wallets()).isEmpty();
        verifyNoInteractions(publisher);
    }

    @Test
    @DisplayName("swap with no known USD value on either side is not filtered")
    void unpricedSwap_notFiltered() {
        assertThat(service.belowMinimumValue(swap("sig-1", 0, leg(TOKEN_A, "AAA", "1", null),
                leg(TOKEN_B, "BBB", "1", null)))).isFalse();
        assertThat(service.belowMinimumValue(sell("sig-2", 0, TOKEN_A, "1", "0.99"))).isTrue();
        assertThat(service.belowMinimumValue(sell("sig-3", 0, TOKEN_A, "1", "1"))).isFalse();
    }

    @Test
    @DisplayName("base-to-base swap is ignored")
    void baseToBase_ignored() {
        when(classifier.classify(tx)).thenReturn(Optional.of(
                swap("sig-1", 0, leg(USDC, "USDC", "5", "5"), leg(SOL, "SOL", "0.03", "5"))));

        assertThat(service.process(tx).join()).isEmpty();
        verifyNoInteractions(publisher);
    }

    @Test
    @DisplayName("unclassifiable transaction yields no trades")
    void notASwap_empty() {
        when(classifier.classify(tx)).thenReturn(Optional.empty());

        assertThat(service.process(tx).join()).isEmpty();
        verifyNoInteractions(publisher);
    }
}
