package net;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import log.EngineLog;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import state.MalformedSnapshotException;
import state.PairSnapshot;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * DexScreener REST:
 *   GET {base}/{chain}           → {"pairs":[...]}
 *   GET {base}/{chain}/{address} → {"pairs":[...]} or {"pair":{...}}
 * Malformed pairs are skipped one by one, transport errors give an empty result.
 */
public class DexScreenerClient implements MarketDataSource {

    private static final String SRC = "DexScreener";

    private final OkHttpClient http;
    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpUrl baseUrl;

    public DexScreenerClient(OkHttpClient http, String baseUrl) {
        this.http = http;
        this.baseUrl = HttpUrl.get(baseUrl);
    }

    @Override
    public List<PairSnapshot> fetchPairs(String chain) {
        HttpUrl url = baseUrl.newBuilder().addPathSegment(chain).build();
        JsonNode root = get(url);
        if (root == null) return List.of();

        JsonNode list = root.path("pairs");
        if (!list.isArray()) {
            EngineLog.warn(SRC, "no pairs array for " + chain);
            return List.of();
        }

        List<PairSnapshot> out = new ArrayList<>();
        for (JsonNode n : list) {
            try {
                out.add(PairSnapshotParser.parse(n));
            } catch (MalformedSnapshotException e) {
                EngineLog.warn(SRC, "skip malformed pair on " + chain + ": " + e.getMessage());
            }
        }
        return out;
    }

    @Override
    public Optional<PairSnapshot> fetchPair(String chain, String pairAddress) {
        HttpUrl url = baseUrl.newBuilder()
                .addPathSegment(chain)
                .addPathSegment(pairAddress)
                .build();
        JsonNode root = get(url);
        if (root == null) return Optional.empty();

        JsonNode pair = root.path("pairs").path(0);
        if (pair.isMissingNode()) {
            pair = root.path("pair");
        }
        if (pair.isMissingNode() || pair.isNull()) {
            EngineLog.warn(SRC, "pair not found: " + chain + "/" + pairAddress);
            return Optional.empty();
        }
        try {
            return Optional.of(PairSnapshotParser.parse(pair));
        } catch (MalformedSnapshotException e) {
            EngineLog.warn(SRC, "skip malformed pair " + chain + "/" + pairAddress + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    private JsonNode get(HttpUrl url) {
        Request req = new Request.Builder().url(url).build();
        try (Response res = http.newCall(req).execute()) {
            int code = res.code();
            if (code == 429) {
                EngineLog.warn(SRC, "HTTP 429 for " + url.encodedPath());
                return null;
            }
            ResponseBody body = res.body();
            if (!res.isSuccessful() || body == null) {
                EngineLog.warn(SRC, "HTTP " + code + " for " + url.encodedPath());
                return null;
            }
            return mapper.readTree(body.string());
        } catch (IOException e) {
            EngineLog.error(SRC, "failed to fetch " + url.encodedPath(), e);
            return null;
        }
    }
}
