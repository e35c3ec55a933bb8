package com.walletpnl.domain;

public enum TradeType {
    BUY,
    SELL
}
