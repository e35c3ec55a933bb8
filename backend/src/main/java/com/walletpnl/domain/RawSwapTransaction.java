package com.walletpnl.domain;

import java.time.Instant;
import java.util.List;

/**
 * Per-transaction balance-delta record as delivered by the transport, viewed from one watched wallet.
 * preBalances/postBalances are native lamport balances indexed like accountKeys.
 */
public record RawSwapTransaction(
        String signature,
        String walletAddress,
        Instant blockTime,
        List<String> accountKeys,
        List<Long> preBalances,
        List<Long> postBalances,
        List<TokenBalance> preTokenBalances,
        List<TokenBalance> postTokenBalances
) {

    public RawSwapTransaction {
        accountKeys = accountKeys != null ? List.copyOf(accountKeys) : List.of();
        preBalances = preBalances != null ? List.copyOf(preBalances) : List.of();
        postBalances = postBalances != null ? List.copyOf(postBalances) : List.of();
        preTokenBalances = preTokenBalances != null ? List.copyOf(preTokenBalances) : List.of();
        postTokenBalances = postTokenBalances != null ? List.copyOf(postTokenBalances) : List.of();
    }
}
