package com.walletpnl.api.validation;

import com.walletpnl.common.SolanaAddress;
import org.springframework.stereotype.Component;

/**
 * Validates path wallet addresses and list limits for the performance endpoints.
 */
@Component
public class AddressValidator {

    public static final int MAX_LIMIT = 100;

    public boolean isValidAddress(String address) {
        if (address == null || address.isBlank()) return false;
        return SolanaAddress.isValid(address);
    }

    /**
     * Null = valid (endpoint default applies).
     */
    public boolean isValidLimit(Integer limit) {
        return limit == null || (limit >= 1 && limit <= MAX_LIMIT);
    }
}
