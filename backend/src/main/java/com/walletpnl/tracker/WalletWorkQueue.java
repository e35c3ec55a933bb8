package com.walletpnl.tracker;

import com.walletpnl.config.AsyncConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Runs tasks one at a time per wallet, in submission order, on the shared ledger executor. Different wallets
 * proceed in parallel. A failed task does not block the tasks queued behind it.
 */
@Component
public class WalletWorkQueue {

    private final Executor executor;
    private final ConcurrentMap<String, CompletableFuture<?>> tails = new ConcurrentHashMap<>();

    public WalletWorkQueue(@Qualifier(AsyncConfig.LEDGER_EXECUTOR) Executor executor) {
        this.executor = executor;
    }

    public <T> CompletableFuture<T> submit(String walletAddress, Supplier<T> task) {
        AtomicReference<CompletableFuture<T>> submitted = new AtomicReference<>();
        tails.compute(walletAddress, (wallet, tail) -> {
            CompletableFuture<?> previous = tail != null ? tail : CompletableFuture.completedFuture(null);
            CompletableFuture<T> next = previous
                    .handle((ignored, error) -> null)
                    .thenApplyAsync(ignored -> task.get(), executor);
            submitted.set(next);
            return next;
        });
        CompletableFuture<T> future = submitted.get();
        future.whenComplete((result, error) -> tails.remove(walletAddress, future));
        return future;
    }

    int pendingWallets() {
        return tails.size();
    }
}
