package com.walletpnl.ledger.query;

import com.walletpnl.domain.Trade;
import com.walletpnl.domain.WalletPerformance;
import com.walletpnl.ledger.store.LedgerStore;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Read side of the ledger. Every result is a copy; nothing returned here aliases live ledger state.
 */
public class PerformanceQueryService {

    public static final int DEFAULT_TOP_POSITIONS = 5;
    public static final int DEFAULT_RECENT_TRADES = 10;

    private static final Comparator<PositionSnapshot> BY_UNREALIZED_DESC = Comparator.comparing(
            PositionSnapshot::unrealizedPnl, Comparator.nullsLast(Comparator.<BigDecimal>reverseOrder()));

    private final LedgerStore store;

    public PerformanceQueryService(LedgerStore store) {
        this.store = store;
    }

    public Optional<WalletPerformanceSnapshot> getPerformance(String walletAddress) {
        return store.find(walletAddress).map(PerformanceQueryService::snapshot);
    }

    public List<WalletPerformanceSnapshot> getAllPerformances() {
        return store.findAll().stream()
                .map(PerformanceQueryService::snapshot)
                .sorted(Comparator.comparing(WalletPerformanceSnapshot::walletAddress))
                .toList();
    }

    public List<PositionSnapshot> getTopPositions(String walletAddress) {
        return getTopPositions(walletAddress, DEFAULT_TOP_POSITIONS);
    }

    /**
     * Open positions by unrealized P&amp;L, highest first; positions without a valuation come last.
     */
    public List<PositionSnapshot> getTopPositions(String walletAddress, int limit) {
        return getPerformance(walletAddress)
                .map(snapshot -> snapshot.positions().stream()
                        .sorted(BY_UNREALIZED_DESC)
                        .limit(Math.max(0, limit))
                        .toList())
                .orElse(List.of());
    }

    public List<Trade> getRecentTrades(String walletAddress) {
        return getRecentTrades(walletAddress, DEFAULT_RECENT_TRADES);
    }

    /**
     * Most recent trades first.
     */
    public List<Trade> getRecentTrades(String walletAddress, int limit) {
        Optional<WalletPerformance> performance = store.find(walletAddress);
        if (performance.isEmpty()) {
            return List.of();
        }
        List<Trade> trades;
        synchronized (performance.get()) {
            List<Trade> all = performance.get().getTrades();
            int from = Math.max(0, all.size() - Math.max(0, limit));
            trades = new ArrayList<>(all.subList(from, all.size()));
        }
        Collections.reverse(trades);
        return List.copyOf(trades);
    }

    private static WalletPerformanceSnapshot snapshot(WalletPerformance performance) {
        synchronized (performance) {
            return new WalletPerformanceSnapshot(
                    performance.getWalletAddress(),
                    performance.getTotalTrades(),
                    performance.getWinningTrades(),
                    performance.getLosingTrades(),
                    performance.getWinRate(),
                    performance.getTotalRealizedPnl(),
                    performance.getTotalUnrealizedPnl(),
                    performance.getTotalPnl(),
                    performance.getTotalInvested(),
                    performance.getRoi(),
                    performance.getLastUpdatedAt(),
                    performance.getPositions().values().stream().map(PositionSnapshot::of).toList());
        }
    }
}
