package com.walletpnl.ingestion.classifier;

/**
 * The two balance deltas a parser picked as the swap's input (negative) and output (positive).
 */
public record LegSelection(BalanceDelta input, BalanceDelta output) {
}
