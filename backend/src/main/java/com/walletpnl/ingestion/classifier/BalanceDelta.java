package com.walletpnl.ingestion.classifier;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Net change of one mint for the watched wallet within a transaction. Signed: negative left the wallet.
 * includesNative marks the wrapped-SOL entry that also carries the wallet's lamport delta.
 */
public record BalanceDelta(String mint, BigInteger rawDelta, int decimals, boolean includesNative) {

    public BigDecimal uiDelta() {
        return new BigDecimal(rawDelta).movePointLeft(decimals);
    }

    public BigDecimal magnitude() {
        return uiDelta().abs();
    }

    public int signum() {
        return rawDelta.signum();
    }
}
