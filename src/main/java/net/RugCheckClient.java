package net;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;

/** GET {base}/api/check?token_address=... → {"rating":"Good"} */
public class RugCheckClient implements ReputationOracle {

    private final OkHttpClient http;
    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpUrl checkUrl;

    public RugCheckClient(OkHttpClient http, String baseUrl) {
        this.http = http;
        this.checkUrl = HttpUrl.get(baseUrl).newBuilder()
                .addPathSegment("api")
                .addPathSegment("check")
                .build();
    }

    @Override
    public String rating(String pairAddress) throws IOException {
        HttpUrl url = checkUrl.newBuilder()
                .addQueryParameter("token_address", pairAddress)
                .build();
        Request req = new Request.Builder().url(url).build();

        try (Response res = http.newCall(req).execute()) {
            ResponseBody body = res.body();
            if (!res.isSuccessful() || body == null) {
                throw new IOException("RugCheck HTTP " + res.code());
            }
            JsonNode root = mapper.readTree(body.string());
            return root.path("rating").asText("");
        }
    }
}
