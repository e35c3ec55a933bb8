package com.walletpnl.ingestion.classifier;

import java.util.List;
import java.util.Optional;

/**
 * Venue-specific choice of input and output among a transaction's qualifying balance deltas.
 */
public interface VenueSwapParser {

    Optional<LegSelection> select(List<BalanceDelta> deltas);
}
