package net;

import okhttp3.OkHttpClient;

import java.time.Duration;

public final class HttpClients {

    private HttpClients() {}

    /** Every external call is bounded by {@code timeoutMs}, including body reads. */
    public static OkHttpClient withTimeout(long timeoutMs) {
        Duration t = Duration.ofMillis(timeoutMs);
        return new OkHttpClient.Builder()
                .connectTimeout(t)
                .readTimeout(t)
                .writeTimeout(t)
                .callTimeout(t)
                .build();
    }
}
