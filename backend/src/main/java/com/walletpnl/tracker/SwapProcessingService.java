package com.walletpnl.tracker;

import com.walletpnl.config.TrackerProperties;
import com.walletpnl.domain.RawSwapTransaction;
import com.walletpnl.domain.SwapEvent;
import com.walletpnl.domain.TokenLeg;
import com.walletpnl.domain.Trade;
import com.walletpnl.domain.TradeDirection;
import com.walletpnl.domain.TradeRecordedEvent;
import com.walletpnl.ingestion.classifier.SwapClassifier;
import com.walletpnl.ledger.engine.DirectionResolver;
import com.walletpnl.ledger.engine.PerformanceAggregator;
import com.walletpnl.ledger.engine.PositionLedger;
import com.walletpnl.ledger.store.LedgerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Raw transaction to ledger: classify, drop swaps below the minimum value, then on the wallet's work queue
 * resolve direction, apply, recompute and publish one {@link TradeRecordedEvent} per recorded trade.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SwapProcessingService {

    private final SwapClassifier swapClassifier;
    private final DirectionResolver directionResolver;
    private final PositionLedger positionLedger;
    private final PerformanceAggregator performanceAggregator;
    private final LedgerStore ledgerStore;
    private final WalletWorkQueue walletWorkQueue;
    private final ApplicationEventPublisher eventPublisher;
    private final TrackerProperties trackerProperties;

    public CompletableFuture<List<Trade>> process(RawSwapTransaction tx) {
        Optional<SwapEvent> swap = swapClassifier.classify(tx);
        if (swap.isEmpty()) {
            log.debug("Transaction {} is not a swap for wallet {}", tx.signature(), tx.walletAddress());
            return CompletableFuture.completedFuture(List.of());
        }
        SwapEvent event = swap.get();
        if (belowMinimumValue(event)) {
            log.debug("Swap {} for wallet {} below minimum value {} USD; skipped",
                    event.signature(), event.wallet(), trackerProperties.getMinSwapValueUsd());
            return CompletableFuture.completedFuture(List.of());
        }
        return walletWorkQueue.submit(event.wallet(), () -> applySwap(event));
    }

    List<Trade> applySwap(SwapEvent event) {
        TradeDirection direction = directionResolver.resolve(event);
        if (direction == TradeDirection.IGNORED) {
            log.debug("Swap {} between base assets {} -> {}; ignored",
                    event.signature(), event.inputLeg().symbol(), event.outputLeg().symbol());
            return List.of();
        }
        List<Trade> trades = positionLedger.apply(event, direction);
        if (trades.isEmpty()) {
            return trades;
        }
        performanceAggregator.recompute(ledgerStore.getOrCreate(event.wallet()));
        for (Trade trade : trades) {
            eventPublisher.publishEvent(new TradeRecordedEvent(event.wallet(), direction, event, trade));
        }
        return trades;
    }

    /**
     * True when the known USD values of both legs add up to less than the configured minimum.
     * A swap with no known USD value on either side is never filtered.
     */
    boolean belowMinimumValue(SwapEvent event) {
        TokenLeg in = event.inputLeg();
        TokenLeg out = event.outputLeg();
        if (!in.hasUsdValue() && !out.hasUsdValue()) {
            return false;
        }
        BigDecimal total = in.knownUsdValue().orElse(BigDecimal.ZERO)
                .add(out.knownUsdValue().orElse(BigDecimal.ZERO));
        return total.compareTo(trackerProperties.getMinSwapValueUsd()) < 0;
    }
}
