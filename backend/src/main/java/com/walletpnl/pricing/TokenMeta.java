package com.walletpnl.pricing;

/**
 * Token registry entry for a mint.
 */
public record TokenMeta(String mint, String symbol, String name, int decimals) {
}
