package com.walletpnl.common;

import java.util.regex.Pattern;

/**
 * Solana account addresses: Base58, 32-44 chars.
 */
public final class SolanaAddress {

    private static final Pattern PATTERN = Pattern.compile("^[1-9A-HJ-NP-Za-km-z]{32,44}$");

    private SolanaAddress() {
    }

    public static boolean isValid(String address) {
        return address != null && PATTERN.matcher(address.trim()).matches();
    }
}
