package com.walletpnl.domain;

/**
 * Category of a swap relative to the configured base assets.
 */
public enum TradeDirection {
    /** Base asset in, non-base token out. */
    BUY,
    /** Non-base token in, base asset out. */
    SELL,
    /** Neither leg is a base asset. */
    TOKEN_TO_TOKEN,
    /** Both legs are base assets; no position signal. */
    IGNORED
}
