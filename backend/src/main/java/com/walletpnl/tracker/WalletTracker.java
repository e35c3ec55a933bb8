package com.walletpnl.tracker;

import com.walletpnl.common.SolanaAddress;
import com.walletpnl.config.TrackerProperties;
import com.walletpnl.domain.RawSwapTransaction;
import com.walletpnl.ingestion.adapter.solana.SolanaTransactionFetcher;
import com.walletpnl.ingestion.config.SolanaProperties;
import com.walletpnl.ingestion.stream.SolanaLogsSubscriber;
import com.walletpnl.ledger.store.LedgerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;

/**
 * Process lifecycle: validates the watched wallets, creates their ledger entries, and feeds every notified
 * signature (after the confirmation delay) through fetch and {@link SwapProcessingService}.
 * Fails startup when no wallet, or an invalid one, is configured.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WalletTracker implements SmartLifecycle {

    private final TrackerProperties trackerProperties;
    private final SolanaProperties solanaProperties;
    private final LedgerStore ledgerStore;
    private final SolanaLogsSubscriber logsSubscriber;
    private final SolanaTransactionFetcher transactionFetcher;
    private final SwapProcessingService swapProcessingService;

    private volatile boolean running;

    @Override
    public void start() {
        List<String> wallets = configuredWallets();
        wallets.forEach(ledgerStore::getOrCreate);
        log.info("Tracking {} wallet(s): {}", wallets.size(), wallets);
        if (solanaProperties.isEnabled()) {
            logsSubscriber.start(wallets, this::onSignature);
        } else {
            log.info("Solana ingestion disabled; serving existing ledger state only");
        }
        running = true;
    }

    @Override
    public void stop() {
        logsSubscriber.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    List<String> configuredWallets() {
        List<String> wallets = trackerProperties.getWallets() == null ? List.of()
                : trackerProperties.getWallets().stream()
                        .filter(w -> w != null && !w.isBlank())
                        .map(String::trim)
                        .distinct()
                        .toList();
        if (wallets.isEmpty()) {
            throw new IllegalStateException("No wallets configured; set walletpnl.tracker.wallets");
        }
        for (String wallet : wallets) {
            if (!SolanaAddress.isValid(wallet)) {
                throw new IllegalStateException("Invalid wallet address in walletpnl.tracker.wallets: " + wallet);
            }
        }
        return wallets;
    }

    void onSignature(String walletAddress, String signature) {
        Mono.delay(Duration.ofMillis(trackerProperties.getConfirmationDelayMs()))
                .publishOn(Schedulers.boundedElastic())
                .map(tick -> transactionFetcher.fetch(signature, walletAddress))
                .subscribe(
                        tx -> tx.ifPresentOrElse(this::process,
                                () -> log.debug("Transaction {} unavailable or failed; skipped", signature)),
                        error -> log.warn("Could not fetch transaction {} for wallet {}: {}",
                                signature, walletAddress, error.getMessage()));
    }

    private void process(RawSwapTransaction tx) {
        swapProcessingService.process(tx).whenComplete((trades, error) -> {
            if (error != null) {
                log.error("Processing {} for wallet {} failed", tx.signature(), tx.walletAddress(), error);
            }
        });
    }
}
