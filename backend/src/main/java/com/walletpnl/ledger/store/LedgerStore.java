package com.walletpnl.ledger.store;

import com.walletpnl.domain.WalletPerformance;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * Owner of every wallet's ledger state for the process lifetime. Entries are created lazily and never removed.
 */
public interface LedgerStore {

    /**
     * Returns the wallet's state, creating an empty one on first use. Idempotent.
     */
    WalletPerformance getOrCreate(String walletAddress);

    Optional<WalletPerformance> find(String walletAddress);

    Collection<WalletPerformance> findAll();

    Set<String> wallets();
}
