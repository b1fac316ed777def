package state;

import java.time.Instant;

public record PriceHistoryRecord(
        String pairAddress,
        double priceUsd,
        double volume24h,
        double liquidityUsd,
        double priceChange24h,
        Instant timestamp
) {
    public static PriceHistoryRecord of(PairSnapshot s, Instant at) {
        return new PriceHistoryRecord(
                s.pairAddress(),
                s.priceUsd(),
                s.volume24h(),
                s.liquidityUsd(),
                s.priceChange24h(),
                at
        );
    }
}
