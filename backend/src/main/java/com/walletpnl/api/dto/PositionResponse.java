package com.walletpnl.api.dto;

import com.walletpnl.ledger.query.PositionSnapshot;

import java.math.BigDecimal;

/**
 * Open position. currentValue and unrealized fields are null when the token has no known price.
 */
public record PositionResponse(
        String mint,
        String symbol,
        String name,
        BigDecimal balance,
        BigDecimal avgBuyPrice,
        BigDecimal totalInvested,
        BigDecimal currentValue,
        BigDecimal unrealizedPnl,
        BigDecimal unrealizedPnlPercent,
        int tradeCount
) {

    public static PositionResponse from(PositionSnapshot p) {
        return new PositionResponse(p.mint(), p.symbol(), p.name(), p.balance(), p.avgBuyPrice(),
                p.totalInvested(), p.currentValue(), p.unrealizedPnl(), p.unrealizedPnlPercent(), p.tradeCount());
    }
}
