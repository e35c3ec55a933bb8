package com.walletpnl.api.dto;

import com.walletpnl.ledger.query.WalletPerformanceSnapshot;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Wallet summary for GET /wallets and GET /wallets/{address}/performance.
 */
public record WalletPerformanceResponse(
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
        int openPositions,
        Instant lastUpdatedAt
) {

    public static WalletPerformanceResponse from(WalletPerformanceSnapshot s) {
        return new WalletPerformanceResponse(
                s.walletAddress(),
                s.totalTrades(),
                s.winningTrades(),
                s.losingTrades(),
                s.winRate(),
                s.totalRealizedPnl(),
                s.totalUnrealizedPnl(),
                s.totalPnl(),
                s.totalInvested(),
                s.roi(),
                s.positions().size(),
                s.lastUpdatedAt());
    }
}
