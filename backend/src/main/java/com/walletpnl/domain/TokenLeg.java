package com.walletpnl.domain;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.Optional;

/**
 * One side of a swap. Immutable. usdValue is null when the price of the mint was unavailable;
 * callers must not read a missing value as zero.
 */
public record TokenLeg(
        String mint,
        String symbol,
        String name,
        BigInteger rawAmount,
        BigDecimal uiAmount,
        int decimals,
        BigDecimal usdValue
) {

    public TokenLeg {
        Objects.requireNonNull(mint, "mint must not be null");
        Objects.requireNonNull(rawAmount, "rawAmount must not be null");
        Objects.requireNonNull(uiAmount, "uiAmount must not be null");
        if (decimals < 0) {
            throw new IllegalArgumentException("decimals must be non-negative, got " + decimals);
        }
        if (rawAmount.signum() < 0 || uiAmount.signum() < 0) {
            throw new IllegalArgumentException("leg amounts are magnitudes, got " + rawAmount);
        }
    }

    /**
     * Leg from a raw (smallest-unit) amount; uiAmount = rawAmount / 10^decimals.
     */
    public static TokenLeg ofRaw(String mint, String symbol, String name, BigInteger rawAmount, int decimals,
                                 BigDecimal priceUsd) {
        BigDecimal ui = new BigDecimal(rawAmount).movePointLeft(decimals);
        BigDecimal usd = priceUsd != null ? ui.multiply(priceUsd) : null;
        return new TokenLeg(mint, symbol, name, rawAmount, ui, decimals, usd);
    }

    public Optional<BigDecimal> knownUsdValue() {
        return Optional.ofNullable(usdValue);
    }

    public boolean hasUsdValue() {
        return usdValue != null;
    }

    /**
     * USD per unit implied by this leg's own valuation; empty when unpriced or zero-sized.
     */
    public Optional<BigDecimal> impliedUnitPrice(int scale) {
        if (usdValue == null || uiAmount.signum() == 0) {
            return Optional.empty();
        }
        return Optional.of(usdValue.divide(uiAmount, scale, RoundingMode.HALF_UP));
    }
}
