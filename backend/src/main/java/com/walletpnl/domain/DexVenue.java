package com.walletpnl.domain;

import java.util.Collection;

/**
 * Known swap venues, tagged by on-chain program id. Detection order is declaration order;
 * UNKNOWN is the fallback when no listed program appears in the transaction.
 */
public enum DexVenue {

    PUMP_FUN("6EF8rrecthR5Dkzon8Nwu78hRvfCKubJ14M5uBEwF6P"),
    RAYDIUM_V4("675kPX9MHTjS2zt1qfr1NYHuzeLXfQM9H24wFSUt1Mp8"),
    RAYDIUM_CLMM("CAMMCzo5YL8w4VFF8KVHrK22GGUsp5VTaW7grrKgrWqK"),
    ORCA_WHIRLPOOL("whirLbMiicVdio4qvUfM5KAg6Ct8VwpYzGff3uctyCc"),
    JUPITER_V6("JUP6LkbZbjS1jKKwapdHNy74zcZ3tLUZoi5QNyVTaV4"),
    METEORA("Eo7WjKq67rjJQSZxS6z3YkapzY3eMj6Xy8X5EQVn5UaB"),
    UNKNOWN(null);

    private final String programId;

    DexVenue(String programId) {
        this.programId = programId;
    }

    public String getProgramId() {
        return programId;
    }

    public static DexVenue detect(Collection<String> accountKeys) {
        if (accountKeys == null || accountKeys.isEmpty()) {
            return UNKNOWN;
        }
        for (DexVenue venue : values()) {
            if (venue.programId != null && accountKeys.contains(venue.programId)) {
                return venue;
            }
        }
        return UNKNOWN;
    }
}
