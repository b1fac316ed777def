package net;

import com.fasterxml.jackson.databind.JsonNode;
import state.MalformedSnapshotException;
import state.PairSnapshot;

import java.time.Instant;

/**
 * DexScreener pair JSON → {@link PairSnapshot}.
 *
 * Identity keys are mandatory. Missing numeric keys count as 0, numbers sent as
 * unparseable text become NaN and are rejected later by the numeric guards.
 */
public final class PairSnapshotParser {

    private PairSnapshotParser() {}

    public static PairSnapshot parse(JsonNode pair) {
        if (pair == null || !pair.isObject()) {
            throw new MalformedSnapshotException("pair is not an object");
        }
        long createdMs = pair.path("pairCreatedAt").asLong(0L);
        return new PairSnapshot(
                text(pair.get("chainId")),
                text(pair.get("pairAddress")),
                text(pair.path("baseToken").get("symbol")),
                text(pair.path("quoteToken").get("symbol")),
                text(pair.get("pairCreatedBy")),
                number(pair.get("priceUsd")),
                number(pair.path("volume").get("h24")),
                number(pair.path("liquidity").get("usd")),
                number(pair.path("priceChange").get("h24")),
                Instant.ofEpochMilli(Math.max(0L, createdMs))
        );
    }

    private static String text(JsonNode n) {
        if (n == null || n.isNull() || !n.isValueNode()) return null;
        return n.asText();
    }

    static double number(JsonNode n) {
        if (n == null || n.isNull() || n.isMissingNode()) return 0.0;
        if (n.isNumber()) return n.asDouble();
        if (n.isTextual()) {
            try {
                return Double.parseDouble(n.asText().trim());
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }
        return Double.NaN;
    }
}
