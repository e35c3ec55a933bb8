package com.walletpnl.api.dto;

import com.walletpnl.domain.Trade;

import java.math.BigDecimal;
import java.time.Instant;

public record TradeResponse(
        String signature,
        Instant timestamp,
        String type,
        String tokenMint,
        String tokenSymbol,
        BigDecimal tokenAmount,
        BigDecimal pricePerToken,
        BigDecimal usdValue,
        BigDecimal realizedPnl,
        BigDecimal realizedPnlPercent,
        boolean partialTracking
) {

    public static TradeResponse from(Trade t) {
        return new TradeResponse(t.signature(), t.timestamp(), t.type().name(), t.tokenMint(), t.tokenSymbol(),
                t.tokenAmount(), t.pricePerToken(), t.usdValue(), t.realizedPnl(), t.realizedPnlPercent(),
                t.partialTracking());
    }
}
