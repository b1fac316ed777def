package net;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;

/**
 * POST {url} {"chain","pair_address","volume_24h","liquidity_usd"}
 *   → {"is_fake_volume": bool, "reason": "..."}
 */
public class FakeVolumeClient implements FakeVolumeOracle {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient http;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String url;

    public FakeVolumeClient(OkHttpClient http, String url) {
        this.http = http;
        this.url = url;
    }

    @Override
    public Verdict check(String chain, String pairAddress, double volume24h, double liquidityUsd) throws IOException {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("chain", chain);
        payload.put("pair_address", pairAddress);
        payload.put("volume_24h", volume24h);
        payload.put("liquidity_usd", liquidityUsd);

        Request req = new Request.Builder()
                .url(url)
                .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
                .build();

        try (Response res = http.newCall(req).execute()) {
            ResponseBody body = res.body();
            if (!res.isSuccessful() || body == null) {
                throw new IOException("fake-volume HTTP " + res.code());
            }
            JsonNode root = mapper.readTree(body.string());
            boolean fake = root.path("is_fake_volume").asBoolean(false);
            JsonNode reason = root.get("reason");
            return new Verdict(fake, reason != null && reason.isTextual() ? reason.asText() : null);
        }
    }
}
