package com.walletpnl.domain;

/**
 * Application event: a trade was appended to a wallet's ledger. Published by the tracker pipeline;
 * consumed by reporting.
 */
public record TradeRecordedEvent(String walletAddress, TradeDirection direction, SwapEvent swap, Trade trade) {
}
