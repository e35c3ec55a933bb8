package com.walletpnl.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

/**
 * Immutable record of one applied ledger mutation.
 * usdValue, realizedPnl and realizedPnlPercent are null when the USD side of the swap was unknown;
 * realizedPnl fields are always null on BUY.
 */
public record Trade(
        String signature,
        Instant timestamp,
        TradeType type,
        String tokenMint,
        String tokenSymbol,
        BigDecimal tokenAmount,
        BigDecimal pricePerToken,
        BigDecimal usdValue,
        BigDecimal realizedPnl,
        BigDecimal realizedPnlPercent,
        boolean partialTracking
) {

    public static Trade buy(String signature, Instant timestamp, String mint, String symbol,
                            BigDecimal amount, BigDecimal pricePerToken, BigDecimal usdValue) {
        return new Trade(signature, timestamp, TradeType.BUY, mint, symbol, amount, pricePerToken, usdValue,
                null, null, false);
    }

    public Optional<BigDecimal> knownRealizedPnl() {
        return Optional.ofNullable(realizedPnl);
    }
}
