package com.walletpnl.pricing;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Resolves token metadata and current USD prices by mint.
 * Implementations never throw for unknown mints or upstream failures; they return empty instead.
 */
public interface TokenPricer {

    Optional<TokenMeta> getTokenMeta(String mint);

    /**
     * Current USD price per whole unit (uiAmount) of the mint.
     */
    Optional<BigDecimal> getPrice(String mint);
}
