package com.walletpnl.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * A classified swap for one wallet: inputLeg left the wallet, outputLeg arrived.
 * Legs with the same mint are a transfer, not a swap, and are rejected.
 */
public record SwapEvent(
        String signature,
        Instant timestamp,
        String wallet,
        TokenLeg inputLeg,
        TokenLeg outputLeg,
        DexVenue venue
) {

    public SwapEvent {
        Objects.requireNonNull(signature, "signature must not be null");
        Objects.requireNonNull(wallet, "wallet must not be null");
        Objects.requireNonNull(inputLeg, "inputLeg must not be null");
        Objects.requireNonNull(outputLeg, "outputLeg must not be null");
        if (inputLeg.mint().equals(outputLeg.mint())) {
            throw new IllegalArgumentException("Swap legs share mint " + inputLeg.mint() + " in " + signature);
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
        if (venue == null) {
            venue = DexVenue.UNKNOWN;
        }
    }
}
