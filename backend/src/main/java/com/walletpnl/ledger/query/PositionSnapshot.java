package com.walletpnl.ledger.query;

import com.walletpnl.domain.Position;

import java.math.BigDecimal;

/**
 * Read-only copy of an open position. Valuation fields are null when no price for the mint is known.
 */
public record PositionSnapshot(
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

    static PositionSnapshot of(Position position) {
        return new PositionSnapshot(
                position.getMint(),
                position.getSymbol(),
                position.getName(),
                position.getBalance(),
                position.getAvgBuyPrice(),
                position.getTotalInvested(),
                position.getCurrentValue(),
                position.getUnrealizedPnl(),
                position.getUnrealizedPnlPercent(),
                position.getTrades().size());
    }
}
