package net;

import state.PairSnapshot;

import java.util.List;
import java.util.Optional;

public interface MarketDataSource {

    /** All pairs the source reports for a chain; empty on any failure. */
    List<PairSnapshot> fetchPairs(String chain);

    Optional<PairSnapshot> fetchPair(String chain, String pairAddress);
}
