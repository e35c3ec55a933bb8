package com.walletpnl.ingestion.classifier;

import java.util.List;
import java.util.Optional;

/**
 * Venue-agnostic parser: largest outflow is the input, largest inflow the output; ties keep the first seen.
 */
public class GenericBalanceDeltaParser implements VenueSwapParser {

    @Override
    public Optional<LegSelection> select(List<BalanceDelta> deltas) {
        if (deltas == null || deltas.size() < 2) {
            return Optional.empty();
        }
        BalanceDelta input = null;
        BalanceDelta output = null;
        for (BalanceDelta delta : deltas) {
            if (delta.signum() < 0) {
                if (input == null || delta.magnitude().compareTo(input.magnitude()) > 0) {
                    input = delta;
                }
            } else if (delta.signum() > 0) {
                if (output == null || delta.magnitude().compareTo(output.magnitude()) > 0) {
                    output = delta;
                }
            }
        }
        if (input == null || output == null || input.mint().equals(output.mint())) {
            return Optional.empty();
        }
        return Optional.of(new LegSelection(input, output));
    }
}
