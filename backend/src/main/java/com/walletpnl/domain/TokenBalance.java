package com.walletpnl.domain;

import java.math.BigInteger;

/**
 * One entry of a transaction's pre/post token balance list: the SPL token account at accountIndex,
 * its mint, the owning wallet, and the raw amount in the mint's smallest unit.
 */
public record TokenBalance(int accountIndex, String mint, String owner, BigInteger rawAmount, int decimals) {
}
