package com.walletpnl.ledger.engine;

import java.math.BigDecimal;

/**
 * Ledger thresholds. A position whose balance drops to dustThreshold or below is closed; a realized P&amp;L
 * within ±minMeaningfulPnl counts as neither a win nor a loss.
 */
public record LedgerSettings(BigDecimal dustThreshold, BigDecimal minMeaningfulPnl) {

    public static final BigDecimal DEFAULT_DUST_THRESHOLD = new BigDecimal("0.001");
    public static final BigDecimal DEFAULT_MIN_MEANINGFUL_PNL = new BigDecimal("0.01");

    public LedgerSettings {
        if (dustThreshold == null || dustThreshold.signum() < 0) {
            throw new IllegalArgumentException("dustThreshold must be non-negative");
        }
        if (minMeaningfulPnl == null || minMeaningfulPnl.signum() < 0) {
            throw new IllegalArgumentException("minMeaningfulPnl must be non-negative");
        }
    }

    public static LedgerSettings defaults() {
        return new LedgerSettings(DEFAULT_DUST_THRESHOLD, DEFAULT_MIN_MEANINGFUL_PNL);
    }
}
