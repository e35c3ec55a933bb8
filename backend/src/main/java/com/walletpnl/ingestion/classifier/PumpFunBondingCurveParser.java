package com.walletpnl.ingestion.classifier;

import com.walletpnl.common.BaseAssetRegistry;

import java.util.List;
import java.util.Optional;

/**
 * Pump.fun bonding curve trades are always token against native SOL. Pairs the wallet's largest token delta
 * with its SOL delta: token up means SOL in, token down means token in.
 */
public class PumpFunBondingCurveParser implements VenueSwapParser {

    @Override
    public Optional<LegSelection> select(List<BalanceDelta> deltas) {
        if (deltas == null) {
            return Optional.empty();
        }
        BalanceDelta sol = null;
        BalanceDelta token = null;
        for (BalanceDelta delta : deltas) {
            if (BaseAssetRegistry.WRAPPED_SOL_MINT.equals(delta.mint())) {
                sol = delta;
            } else if (token == null || delta.magnitude().compareTo(token.magnitude()) > 0) {
                token = delta;
            }
        }
        if (sol == null || token == null || sol.signum() == token.signum()) {
            return Optional.empty();
        }
        return Optional.of(token.signum() > 0
                ? new LegSelection(sol, token)
                : new LegSelection(token, sol));
    }
}
