package com.walletpnl.ledger.store;

import com.walletpnl.domain.WalletPerformance;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryLedgerStore implements LedgerStore {

    private final ConcurrentMap<String, WalletPerformance> byWallet = new ConcurrentHashMap<>();

    @Override
    public WalletPerformance getOrCreate(String walletAddress) {
        if (walletAddress == null || walletAddress.isBlank()) {
            throw new IllegalArgumentException("walletAddress must not be blank");
        }
        return byWallet.computeIfAbsent(walletAddress, WalletPerformance::new);
    }

    @Override
    public Optional<WalletPerformance> find(String walletAddress) {
        return walletAddress == null ? Optional.empty() : Optional.ofNullable(byWallet.get(walletAddress));
    }

    @Override
    public Collection<WalletPerformance> findAll() {
        return new ArrayList<>(byWallet.values());
    }

    @Override
    public Set<String> wallets() {
        return Set.copyOf(byWallet.keySet());
    }
}
