package state;

import java.time.Duration;
import java.time.Instant;

/**
 * One poll of one pair. Required identity fields are validated on construction,
 * numeric fields are taken as delivered (NaN when the source sent garbage).
 */
public record PairSnapshot(
        String chainId,
        String pairAddress,
        String baseSymbol,
        String quoteSymbol,
        String creatorWallet,
        double priceUsd,
        double volume24h,
        double liquidityUsd,
        double priceChange24h,
        Instant createdAt
) {
    public static final String UNKNOWN_WALLET = "unknown";

    public PairSnapshot {
        requireText(chainId, "chainId");
        requireText(pairAddress, "pairAddress");
        requireText(baseSymbol, "baseToken.symbol");
        requireText(quoteSymbol, "quoteToken.symbol");
        if (creatorWallet == null || creatorWallet.isBlank()) creatorWallet = UNKNOWN_WALLET;
        if (createdAt == null) createdAt = Instant.EPOCH;
    }

    public Duration ageAt(Instant now) {
        return Duration.between(createdAt, now);
    }

    private static void requireText(String v, String field) {
        if (v == null || v.isBlank()) {
            throw new MalformedSnapshotException("missing " + field);
        }
    }

    @Override
    public String toString() {
        return "PairSnapshot{" + chainId + ":" + pairAddress
                + " " + baseSymbol + "/" + quoteSymbol
                + " price=" + priceUsd + " vol=" + volume24h
                + " liq=" + liquidityUsd + " chg=" + priceChange24h + "}";
    }
}
