package com.walletpnl.ledger.query;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Read-only copy of one wallet's summary and open positions, taken under the wallet's monitor.
 */
public record WalletPerformanceSnapshot(
        String walletAddress,
        int totalTrades,
        int winningTrades,
        int losingTrades,
        BigDecimal winRate,
        BigDecimal totalRealizedPnl,
        BigDecimal totalUnrealizedPnl,
        BigDecimal totalPnl,
        BigDecimal totalInvested,
        BigDecimal roi,
        Instant lastUpdatedAt,
        List<PositionSnapshot> positions
) {

    public WalletPerformanceSnapshot {
        positions = List.copyOf(positions);
    }
}
