package core;

import app.Settings;
import config.ConfigStore;
import filters.Blacklist;
import filters.FilterConfig;
import net.FakeVolumeOracle;
import net.MarketDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import signal.EventType;
import signal.TradeAction;
import signal.TradeSignal;
import state.PairSnapshot;
import state.PriceHistoryRecord;
import support.InMemoryAnalysisStore;
import support.MutableClock;
import support.RecordingSink;
import support.Snapshots;
import tuning.AdaptiveThresholdTracker;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static support.Snapshots.NOW;

public class AnalysisEngineTest {

    @TempDir
    Path dir;

    private InMemoryAnalysisStore store;
    private MutableClock clock;
    private EngineState state;
    private StubSource source;
    private RecordingSink sink;
    private Set<String> fakePairs;

    @BeforeEach
    void setUp() {
        Settings.RUNNING = true;
        store = new InMemoryAnalysisStore();
        clock = new MutableClock(NOW);
        state = new EngineState(FilterConfig.defaults(), new Blacklist(),
                new AdaptiveThresholdTracker(100, -50, 50));
        source = new StubSource();
        sink = new RecordingSink();
        fakePairs = new HashSet<>();
    }

    private AnalysisEngine engine(ConfigStore configStore) {
        AnomalyClassifier classifier = new AnomalyClassifier(
                pair -> "good",
                (chain, pair, vol, liq) -> fakePairs.contains(pair)
                        ? new FakeVolumeOracle.Verdict(true, "wash")
                        : FakeVolumeOracle.Verdict.CLEAN,
                store,
                new RiskSizer(0.10, 10_000),
                clock,
                Duration.ofHours(24),
                0.0);
        return new AnalysisEngine(state, classifier, store, source, sink, configStore, clock,
                new AnalysisEngine.Options(0, Duration.ofHours(6), 51, 0.003));
    }

    @Test
    void cycleCoversEveryChainAndCountsVerdicts() {
        source.add("ethereum", Snapshots.pair("0xpump").change(150).volume(150_000).liquidity(5_000).build());
        source.add("ethereum", Snapshots.pair("0xquiet").build());
        source.add("bsc", Snapshots.pair("0xdip").chain("bsc").change(-30).build());

        CycleReport r = engine(null).runCycle(List.of("ethereum", "bsc", "polygon"), List.of());

        assertEquals(3, r.pairsSeen());
        assertEquals(1, r.count(Verdict.PUMP));
        assertEquals(1, r.count(Verdict.NORMAL));
        assertEquals(1, r.count(Verdict.DIP));
        assertEquals(2, r.signals());
        assertEquals(1, r.events());
        assertEquals(0, r.failures());
        assertFalse(r.interrupted());
        assertEquals(List.of("ethereum", "bsc", "polygon"), source.chainsPolled);
    }

    @Test
    void signalsReachSinkAndAreBookedWithFee() {
        source.add("ethereum", Snapshots.pair("0xpump").change(150).volume(150_000).liquidity(5_000).build());

        engine(null).runCycle(List.of("ethereum"), List.of());

        assertEquals(1, sink.signals.size());
        assertEquals(TradeAction.BUY, sink.signals.get(0).action());
        assertEquals(1, sink.events.size());
        assertEquals(EventType.PUMP, sink.events.get(0).type());

        assertEquals(1, store.trades.size());
        InMemoryAnalysisStore.Trade t = store.trades.get(0);
        assertEquals(50.0, t.signal().amount(), 1e-9);
        assertEquals(0.15, t.fee(), 1e-9);
        assertEquals(NOW, t.at());
    }

    @Test
    void thresholdsAreRecomputedOncePerCycleFromWindow() {
        store.history.add(new PriceHistoryRecord("0xa", 1, 1, 1, -20, NOW.minus(Duration.ofHours(1))));
        store.history.add(new PriceHistoryRecord("0xb", 1, 1, 1, 20, NOW.minus(Duration.ofHours(2))));
        store.history.add(new PriceHistoryRecord("0xc", 1, 1, 1, Double.NaN, NOW.minus(Duration.ofHours(2))));
        store.history.add(new PriceHistoryRecord("0xd", 1, 1, 1, 900, NOW.minus(Duration.ofHours(7))));
        for (int i = 0; i < 4; i++) {
            source.add("ethereum", Snapshots.pair("0xp" + i).build());
        }

        CycleReport r = engine(null).runCycle(List.of("ethereum"), List.of());

        assertEquals(1, store.priceChangeReads);
        assertEquals(20.0, r.thresholds().volatility(), 1e-9);
        assertEquals(1.4, state.thresholds().adjustment(), 1e-9);
    }

    @Test
    void thresholdReadFailureKeepsPreviousState() {
        state.thresholds().update(List.of(-20.0, 20.0));
        store.failOn = "recentPriceChanges";

        engine(null).beginCycle();

        assertEquals(1.4, state.thresholds().adjustment(), 1e-9);
    }

    @Test
    void failingPairDoesNotStopCycle() {
        source.add("ethereum", Snapshots.pair("0xboom").change(150).volume(150_000).liquidity(5_000).build());
        source.add("ethereum", Snapshots.pair("0xfine").build());
        RecordingSink throwing = new RecordingSink() {
            @Override
            public void submit(TradeSignal signal) {
                throw new IllegalStateException("sink closed");
            }
        };
        sink = throwing;

        CycleReport r = engine(null).runCycle(List.of("ethereum"), List.of());

        assertEquals(2, r.pairsSeen());
        assertEquals(1, r.failures());
        assertEquals(1, r.count(Verdict.NORMAL));
    }

    @Test
    void droppedWritesSkipTradeBooking() {
        store.failOn = "upsertPair";
        source.add("ethereum", Snapshots.pair("0xpump").change(150).volume(150_000).liquidity(5_000).build());

        engine(null).runCycle(List.of("ethereum"), List.of());

        assertEquals(1, sink.signals.size());
        assertTrue(store.trades.isEmpty());
    }

    @Test
    void fakeVolumeBlacklistIsPersisted() throws IOException {
        Path file = dir.resolve("config.json");
        Files.writeString(file, "{\"filters\": {\"min_liquidity\": 500}, \"blacklisted_coins\": []}");
        ConfigStore cs = new ConfigStore(file);
        AnalysisEngine engine = engine(cs);
        engine.apply(cs.load());

        fakePairs.add("0xwash");
        source.add("ethereum", Snapshots.pair("0xwash").base("WASH").build());
        engine.runCycle(List.of("ethereum"), List.of());

        String json = Files.readString(file);
        assertTrue(json.contains("\"0xwash\""), json);
        assertTrue(json.contains("\"WASH\""), json);
        assertTrue(json.contains("min_liquidity"), json);
        assertTrue(cs.reloadIfChanged().isEmpty());
    }

    @Test
    void staleConfigIsAppliedAtCycleStart() throws IOException {
        Path file = dir.resolve("config.json");
        Files.writeString(file, "{}");
        ConfigStore cs = new ConfigStore(file);
        AnalysisEngine engine = engine(cs);
        engine.apply(cs.load());

        Files.writeString(file, "{\"filters\": {\"min_volume_24h\": 0}, \"blacklisted_devs\": [\"0xbad\"]}");
        cs.markStale();
        engine.beginCycle();

        assertTrue(state.blacklist().containsDev("0xbad"));
        assertEquals(0.0, state.filters().minVolume24h());
    }

    @Test
    void corruptConfigMidRunKeepsFiltersAndFile() throws IOException {
        Path file = dir.resolve("config.json");
        Files.writeString(file, "{\"filters\": {\"min_liquidity\": 0}, \"blacklisted_coins\": []}");
        Files.setLastModifiedTime(file, FileTime.from(Instant.parse("2026-01-01T00:00:00Z")));
        ConfigStore cs = new ConfigStore(file);
        AnalysisEngine engine = engine(cs);
        engine.apply(cs.load());

        String halfWritten = "{\"filters\":{\"min_liquidity\":0,";
        Files.writeString(file, halfWritten);
        Files.setLastModifiedTime(file, FileTime.from(Instant.parse("2026-01-01T00:05:00Z")));
        engine.beginCycle();
        assertEquals(0.0, state.filters().minLiquidity());

        fakePairs.add("0xwash");
        engine.process(Snapshots.pair("0xwash").base("WASH").build());
        assertTrue(state.blacklist().containsCoin("0xwash"));
        assertEquals(halfWritten, Files.readString(file));

        // once the file is valid again the pending blacklist is written
        Files.writeString(file, "{\"filters\": {\"min_liquidity\": 0}}");
        Files.setLastModifiedTime(file, FileTime.from(Instant.parse("2026-01-01T00:10:00Z")));
        engine.beginCycle();

        String json = Files.readString(file);
        assertTrue(json.contains("\"0xwash\""), json);
        assertTrue(json.contains("min_liquidity"), json);
        assertEquals(0.0, state.filters().minLiquidity());
    }

    @Test
    void watchPairsArePolledIndividually() {
        source.single.put("bsc:0xwatch", Snapshots.pair("0xwatch").chain("bsc").build());

        CycleReport r = engine(null).runCycle(List.of(), List.of("bsc:0xwatch", "garbage", "bsc:0xmissing"));

        assertEquals(1, r.pairsSeen());
        assertEquals(List.of("bsc:0xwatch", "bsc:0xmissing"), source.singlePolled);
    }

    @Test
    void stopFlagEndsCycleEarly() {
        source.add("ethereum", Snapshots.pair("0xa").build());
        Settings.RUNNING = false;
        try {
            CycleReport r = engine(null).runCycle(List.of("ethereum"), List.of());
            assertTrue(r.interrupted());
            assertEquals(0, r.pairsSeen());
        } finally {
            Settings.RUNNING = true;
        }
    }

    @Test
    void stopDuringPairFinishesThatPairOnly() {
        source.add("ethereum", Snapshots.pair("0xfirst").change(-30).build());
        source.add("ethereum", Snapshots.pair("0xsecond").build());
        AnomalyClassifier classifier = new AnomalyClassifier(
                pair -> {
                    Settings.RUNNING = false; // stop typed while this pair is being rated
                    return "good";
                },
                (chain, pair, vol, liq) -> FakeVolumeOracle.Verdict.CLEAN,
                store, new RiskSizer(0.10, 10_000), clock, Duration.ofHours(24), 0.0);
        AnalysisEngine engine = new AnalysisEngine(state, classifier, store, source, sink, null, clock,
                new AnalysisEngine.Options(0, Duration.ofHours(6), 51, 0.003));
        try {
            CycleReport r = engine.runCycle(List.of("ethereum"), List.of());

            assertEquals(1, r.pairsSeen());
            assertEquals(1, r.count(Verdict.DIP));
            assertTrue(r.interrupted());
            assertEquals(1, sink.signals.size());
        } finally {
            Settings.RUNNING = true;
        }
    }

    @Test
    void processReturnsClassification() {
        Optional<Classification> c = engine(null).process(Snapshots.pair("0xa").change(-30).build());
        assertEquals(Verdict.DIP, c.orElseThrow().verdict());
        assertEquals(1, store.trades.size());
    }

    private static final class StubSource implements MarketDataSource {
        final Map<String, List<PairSnapshot>> byChain = new HashMap<>();
        final Map<String, PairSnapshot> single = new HashMap<>();
        final List<String> chainsPolled = new ArrayList<>();
        final List<String> singlePolled = new ArrayList<>();

        void add(String chain, PairSnapshot s) {
            byChain.computeIfAbsent(chain, k -> new ArrayList<>()).add(s);
        }

        @Override
        public List<PairSnapshot> fetchPairs(String chain) {
            chainsPolled.add(chain);
            return byChain.getOrDefault(chain, List.of());
        }

        @Override
        public Optional<PairSnapshot> fetchPair(String chain, String pairAddress) {
            singlePolled.add(chain + ":" + pairAddress);
            return Optional.ofNullable(single.get(chain + ":" + pairAddress));
        }
    }
}
