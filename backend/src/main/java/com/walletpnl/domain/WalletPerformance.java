package com.walletpnl.domain;

import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Aggregate ledger state for one tracked wallet. One writer at a time: the position ledger and the
 * performance aggregator synchronize on this instance, as do readers taking snapshots.
 */
@Getter
@Setter
public class WalletPerformance {

    private final String walletAddress;
    private int totalTrades;
    private int winningTrades;
    private int losingTrades;
    private BigDecimal winRate = BigDecimal.ZERO;
    private BigDecimal totalRealizedPnl = BigDecimal.ZERO;
    private BigDecimal totalUnrealizedPnl = BigDecimal.ZERO;
    private BigDecimal totalPnl = BigDecimal.ZERO;
    private BigDecimal totalInvested = BigDecimal.ZERO;
    private BigDecimal roi = BigDecimal.ZERO;
    private Instant lastUpdatedAt;
    private final Map<String, Position> positions = new LinkedHashMap<>();
    private final List<Trade> trades = new ArrayList<>();
    private final Set<String> processedSignatures = new HashSet<>();

    public WalletPerformance(String walletAddress) {
        this.walletAddress = walletAddress;
    }

    public void recordTrade(Trade trade) {
        trades.add(trade);
        totalTrades++;
    }

    /**
     * Marks the signature processed; false when it had already been applied.
     */
    public boolean markProcessed(String signature) {
        return processedSignatures.add(signature);
    }
}
