package com.walletpnl.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Open holding of one non-base token for one wallet. Mutated only by the position ledger.
 * currentValue, unrealizedPnl and unrealizedPnlPercent stay null until a price for the mint has been seen.
 */
@NoArgsConstructor
@Getter
@Setter
public class Position {

    private String mint;
    private String symbol;
    private String name;
    private BigDecimal balance = BigDecimal.ZERO;
    private BigDecimal avgBuyPrice = BigDecimal.ZERO;
    private BigDecimal totalInvested = BigDecimal.ZERO;
    /** Last USD unit price observed for the mint; used to revalue when no fresh price is available. */
    private BigDecimal lastPriceUsd;
    private BigDecimal currentValue;
    private BigDecimal unrealizedPnl;
    private BigDecimal unrealizedPnlPercent;
    private final List<Trade> trades = new ArrayList<>();

    public Position(String mint, String symbol, String name) {
        this.mint = mint;
        this.symbol = symbol;
        this.name = name;
    }

    public void addTrade(Trade trade) {
        trades.add(trade);
    }
}
