package com.walletpnl.ingestion.classifier;

import com.walletpnl.common.BaseAssetRegistry;
import com.walletpnl.domain.RawSwapTransaction;
import com.walletpnl.domain.TokenBalance;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Net per-mint balance changes of the watched wallet, in first-seen order.
 * Token accounts are matched by account index across pre/post (a missing side counts as zero); the wallet's
 * lamport change is merged into the wrapped-SOL entry. Deltas inside the noise floor are dropped.
 */
public class BalanceDeltaExtractor {

    static final int NATIVE_DECIMALS = 9;

    private final ClassifierSettings settings;

    public BalanceDeltaExtractor(ClassifierSettings settings) {
        this.settings = settings;
    }

    public List<BalanceDelta> extract(RawSwapTransaction tx) {
        String wallet = tx.walletAddress();
        Map<Integer, TokenBalance> pre = ownedBy(tx.preTokenBalances(), wallet);
        Map<Integer, TokenBalance> post = ownedBy(tx.postTokenBalances(), wallet);

        Set<Integer> accountIndexes = new LinkedHashSet<>(pre.keySet());
        accountIndexes.addAll(post.keySet());

        Map<String, Accumulator> byMint = new LinkedHashMap<>();
        for (Integer index : accountIndexes) {
            TokenBalance before = pre.get(index);
            TokenBalance after = post.get(index);
            TokenBalance reference = after != null ? after : before;
            BigInteger delta = amount(after).subtract(amount(before));
            if (delta.signum() == 0) {
                continue;
            }
            byMint.computeIfAbsent(reference.mint(), m -> new Accumulator(reference.decimals())).add(delta);
        }

        BigInteger lamports = nativeDelta(tx);
        if (lamports.signum() != 0) {
            Accumulator sol = byMint.computeIfAbsent(BaseAssetRegistry.WRAPPED_SOL_MINT,
                    m -> new Accumulator(NATIVE_DECIMALS));
            sol.add(lamports);
            sol.includesNative = true;
        }

        List<BalanceDelta> out = new ArrayList<>();
        byMint.forEach((mint, acc) -> {
            BalanceDelta delta = new BalanceDelta(mint, acc.raw, acc.decimals, acc.includesNative);
            if (delta.magnitude().compareTo(settings.noiseFloor()) > 0) {
                out.add(delta);
            }
        });
        return out;
    }

    private static Map<Integer, TokenBalance> ownedBy(List<TokenBalance> balances, String wallet) {
        Map<Integer, TokenBalance> out = new LinkedHashMap<>();
        for (TokenBalance balance : balances) {
            if (wallet.equals(balance.owner())) {
                out.put(balance.accountIndex(), balance);
            }
        }
        return out;
    }

    private static BigInteger amount(TokenBalance balance) {
        return balance == null || balance.rawAmount() == null ? BigInteger.ZERO : balance.rawAmount();
    }

    private static BigInteger nativeDelta(RawSwapTransaction tx) {
        int index = tx.accountKeys().indexOf(tx.walletAddress());
        if (index < 0 || index >= tx.preBalances().size() || index >= tx.postBalances().size()) {
            return BigInteger.ZERO;
        }
        return BigInteger.valueOf(tx.postBalances().get(index) - tx.preBalances().get(index));
    }

    private static final class Accumulator {
        private final int decimals;
        private BigInteger raw = BigInteger.ZERO;
        private boolean includesNative;

        private Accumulator(int decimals) {
            this.decimals = decimals;
        }

        private void add(BigInteger delta) {
            raw = raw.add(delta);
        }
    }
}
