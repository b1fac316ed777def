package net;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import support.StubHttp;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class OracleClientsTest {

    @Test
    void rugCheckReadsRating() throws Exception {
        AtomicReference<String> query = new AtomicReference<>();
        try (StubHttp server = StubHttp.start(ex -> {
            query.set(ex.getRequestURI().getPath() + "?" + ex.getRequestURI().getQuery());
            StubHttp.respond(ex, 200, "{\"rating\":\"Good\",\"score\":91}");
        })) {
            RugCheckClient client = new RugCheckClient(HttpClients.withTimeout(2_000), server.url());

            String rating = client.rating("0xabc");

            assertEquals("Good", rating);
            assertTrue(ReputationOracle.isGood(rating));
            assertEquals("/api/check?token_address=0xabc", query.get());
        }
    }

    @Test
    void rugCheckErrorStatusThrows() throws Exception {
        try (StubHttp server = StubHttp.start(ex -> StubHttp.respond(ex, 503, "{}"))) {
            RugCheckClient client = new RugCheckClient(HttpClients.withTimeout(2_000), server.url());
            assertThrows(IOException.class, () -> client.rating("0xabc"));
        }
    }

    @Test
    void onlyGoodIsGood() {
        assertTrue(ReputationOracle.isGood("good"));
        assertTrue(ReputationOracle.isGood(" GOOD"));
        assertFalse(ReputationOracle.isGood("goodish"));
        assertFalse(ReputationOracle.isGood(""));
        assertFalse(ReputationOracle.isGood(null));
    }

    @Test
    void fakeVolumePostsPairAndParsesVerdict() throws Exception {
        AtomicReference<String> body = new AtomicReference<>();
        AtomicReference<String> method = new AtomicReference<>();
        try (StubHttp server = StubHttp.start(ex -> {
            method.set(ex.getRequestMethod());
            body.set(StubHttp.body(ex));
            StubHttp.respond(ex, 200, "{\"is_fake_volume\":true,\"reason\":\"circular trades\"}");
        })) {
            FakeVolumeClient client = new FakeVolumeClient(HttpClients.withTimeout(2_000), server.url() + "/v1/check_volume");

            FakeVolumeOracle.Verdict v = client.check("ethereum", "0xabc", 150_000, 2_500);

            assertTrue(v.fakeVolume());
            assertEquals("circular trades", v.reason());
            assertEquals("POST", method.get());
            JsonNode sent = new ObjectMapper().readTree(body.get());
            assertEquals("ethereum", sent.path("chain").asText());
            assertEquals("0xabc", sent.path("pair_address").asText());
            assertEquals(150_000, sent.path("volume_24h").asDouble());
            assertEquals(2_500, sent.path("liquidity_usd").asDouble());
        }
    }

    @Test
    void fakeVolumeCleanWithoutReason() throws Exception {
        try (StubHttp server = StubHttp.start(ex -> StubHttp.respond(ex, 200, "{\"is_fake_volume\":false}"))) {
            FakeVolumeOracle.Verdict v = new FakeVolumeClient(HttpClients.withTimeout(2_000), server.url())
                    .check("bsc", "0xp", 1, 1);
            assertFalse(v.fakeVolume());
            assertNull(v.reason());
        }
    }

    @Test
    void fakeVolumeErrorStatusThrows() throws Exception {
        try (StubHttp server = StubHttp.start(ex -> StubHttp.respond(ex, 502, "bad gateway"))) {
            FakeVolumeClient client = new FakeVolumeClient(HttpClients.withTimeout(2_000), server.url());
            assertThrows(IOException.class, () -> client.check("bsc", "0xp", 1, 1));
        }
    }
}
