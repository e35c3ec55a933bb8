package com.walletpnl.common;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Configured set of base (quote) asset mints: the native coin's wrapped mint plus major stable tokens.
 * A swap between two base assets carries no position signal.
 */
public class BaseAssetRegistry {

    public static final String WRAPPED_SOL_MINT = "So11111111111111111111111111111111111111112";
    public static final String USDC_MINT = "EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v";
    public static final String USDT_MINT = "Es9vMFrzaCERmJfrF4H2FYD4KCoNkY11McCe8BenwNYB";

    public static final Set<String> DEFAULT_BASE_MINTS = Set.of(WRAPPED_SOL_MINT, USDC_MINT, USDT_MINT);

    private final Set<String> baseMints;

    public BaseAssetRegistry(Collection<String> baseMints) {
        if (baseMints == null || baseMints.isEmpty()) {
            throw new IllegalArgumentException("At least one base mint required");
        }
        // Solana mints are case-sensitive base58, so only surrounding whitespace is normalised.
        this.baseMints = baseMints.stream()
                .filter(m -> m != null && !m.isBlank())
                .map(String::strip)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public static BaseAssetRegistry defaults() {
        return new BaseAssetRegistry(DEFAULT_BASE_MINTS);
    }

    public boolean isBaseAsset(String mint) {
        if (mint == null || mint.isBlank()) {
            return false;
        }
        return baseMints.contains(mint.strip());
    }

    public Set<String> getBaseMints() {
        return Set.copyOf(baseMints);
    }
}
