package com.walletpnl.ingestion.classifier;

import java.math.BigDecimal;

/**
 * Balance deltas with an absolute UI amount at or below noiseFloor are treated as dust and ignored.
 */
public record ClassifierSettings(BigDecimal noiseFloor) {

    public static final BigDecimal DEFAULT_NOISE_FLOOR = new BigDecimal("0.0001");

    public ClassifierSettings {
        if (noiseFloor == null || noiseFloor.signum() < 0) {
            throw new IllegalArgumentException("noiseFloor must be non-negative");
        }
    }

    public static ClassifierSettings defaults() {
        return new ClassifierSettings(DEFAULT_NOISE_FLOOR);
    }
}
