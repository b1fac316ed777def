package core;

import app.Settings;
import config.BotConfig;
import config.ConfigStore;
import log.EngineLog;
import net.MarketDataSource;
import org.jetbrains.annotations.Nullable;
import output.SignalSink;
import signal.AnalysisEvent;
import signal.TradeSignal;
import state.PairSnapshot;
import state.PriceHistoryRecord;
import store.AnalysisStore;
import store.StoreException;
import tuning.ThresholdState;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Poll cycle driver. Single-threaded: one snapshot is fully classified before
 * the next one is looked at; the only mutator of {@link EngineState}.
 */
public class AnalysisEngine {

    private static final String SRC = "Engine";

    /** Knobs of the cycle, taken from {@link Settings} in production. */
    public record Options(long requestDelayMs, Duration volatilityWindow, int historyLimit, double feeRate) {

        public static Options fromSettings() {
            return new Options(
                    Settings.REQUEST_DELAY_MS,
                    Duration.ofHours(Settings.VOLATILITY_WINDOW_HOURS),
                    Settings.SHARPE_WINDOW + 1,
                    Settings.TRADE_FEE_RATE
            );
        }
    }

    private final EngineState state;
    private final AnomalyClassifier classifier;
    private final AnalysisStore store;
    private final MarketDataSource source;
    private final SignalSink sink;
    @Nullable
    private final ConfigStore configStore;
    private final Clock clock;
    private final Options options;

    // blacklist additions that could not be written to the config file yet
    private boolean blacklistUnsaved;

    public AnalysisEngine(EngineState state,
                          AnomalyClassifier classifier,
                          AnalysisStore store,
                          MarketDataSource source,
                          SignalSink sink,
                          @Nullable ConfigStore configStore,
                          Clock clock,
                          Options options) {
        this.state = state;
        this.classifier = classifier;
        this.store = store;
        this.source = source;
        this.sink = sink;
        this.configStore = configStore;
        this.clock = clock;
        this.options = options;
    }

    public EngineState state() {
        return state;
    }

    // ===== cycle =====

    /** Config hot-reload and one threshold recomputation for the whole cycle. */
    public ThresholdState beginCycle() {
        if (configStore != null) {
            configStore.reloadIfChanged().ifPresent(this::apply);
            if (blacklistUnsaved) persistBlacklist();
        }

        Instant since = clock.instant().minus(options.volatilityWindow());
        try {
            List<Double> changes = new ArrayList<>();
            for (Double c : store.recentPriceChanges(since)) {
                if (c != null && Double.isFinite(c)) changes.add(c);
            }
            state.thresholds().update(changes);
            EngineLog.info(SRC, state.thresholds() + " samples=" + changes.size());
        } catch (StoreException e) {
            EngineLog.error(SRC, "threshold update skipped, keeping previous state", e);
        }
        return state.thresholds().state();
    }

    public CycleReport runCycle(List<String> chains, List<String> watchPairs) {
        Counters c = new Counters();
        ThresholdState thresholds = beginCycle();

        outer:
        for (String chain : chains) {
            if (stopRequested()) break;
            List<PairSnapshot> pairs = source.fetchPairs(chain);
            EngineLog.info(SRC, chain + ": " + pairs.size() + " pairs");
            for (PairSnapshot s : pairs) {
                if (!processAndPause(s, c)) break outer;
            }
        }

        for (String entry : watchPairs) {
            if (stopRequested() || c.interrupted) break;
            int idx = entry.indexOf(':');
            if (idx <= 0 || idx == entry.length() - 1) {
                EngineLog.warn(SRC, "bad watch pair '" + entry + "', expected chain:address");
                continue;
            }
            Optional<PairSnapshot> s = source.fetchPair(entry.substring(0, idx), entry.substring(idx + 1));
            if (s.isPresent() && !processAndPause(s.get(), c)) break;
        }

        if (stopRequested()) c.interrupted = true;
        CycleReport report = new CycleReport(c.pairs, c.verdicts, c.signals, c.events,
                c.failures, c.interrupted, thresholds);
        EngineLog.info(SRC, "cycle done: " + report.summary());
        return report;
    }

    /** @return false when the cycle must stop */
    private boolean processAndPause(PairSnapshot s, Counters c) {
        if (stopRequested()) {
            c.interrupted = true;
            return false;
        }
        c.pairs++;
        Optional<Classification> r = process(s);
        if (r.isEmpty()) {
            c.failures++;
        } else {
            Classification cl = r.get();
            c.verdicts.merge(cl.verdict(), 1, Integer::sum);
            c.events += cl.events().size();
            if (cl.signal() != null) c.signals++;
        }

        if (options.requestDelayMs() > 0) {
            try {
                Thread.sleep(options.requestDelayMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                c.interrupted = true;
                return false;
            }
        }
        return true;
    }

    // ===== one snapshot =====

    /**
     * Classifies one snapshot and pushes its side effects out. Never throws;
     * empty when the pair could not be processed at all.
     */
    public Optional<Classification> process(PairSnapshot s) {
        try {
            List<PriceHistoryRecord> history = readHistory(s.pairAddress());
            Classification cl = classifier.classify(s, history, state);

            for (AnalysisEvent e : cl.events()) {
                sink.submit(e);
            }

            TradeSignal signal = cl.signal();
            if (signal != null) {
                sink.submit(signal);
                if (!cl.writesDropped()) {
                    recordTrade(signal);
                }
            }

            if (!cl.blacklistAdditions().isEmpty()) {
                persistBlacklist();
            }
            return Optional.of(cl);
        } catch (RuntimeException e) {
            EngineLog.error(SRC, "pair " + s.pairAddress() + " failed", e);
            return Optional.empty();
        }
    }

    private List<PriceHistoryRecord> readHistory(String pair) {
        try {
            return store.recentHistory(pair, options.historyLimit());
        } catch (StoreException e) {
            EngineLog.error(SRC, "history read failed for " + pair, e);
            return List.of();
        }
    }

    private void recordTrade(TradeSignal signal) {
        try {
            store.recordTrade(signal, signal.amount() * options.feeRate(), clock.instant());
        } catch (StoreException e) {
            EngineLog.error(SRC, "trade not recorded for " + signal.pairAddress(), e);
        }
    }

    private void persistBlacklist() {
        if (configStore == null) return;
        try {
            configStore.saveBlacklist(state.blacklist());
            blacklistUnsaved = false;
        } catch (IOException e) {
            blacklistUnsaved = true;
            EngineLog.error(SRC, "blacklist not saved to " + configStore.file() + ", retrying next cycle", e);
        }
    }

    // ===== config =====

    /** New filters replace the old ones; blacklist entries from the file are added. */
    public void apply(BotConfig cfg) {
        state.setFilters(cfg.filters());
        state.blacklist().merge(cfg.blacklist());
        EngineLog.info(SRC, "config applied: " + cfg.filters() + " " + state.blacklist());
    }

    private static boolean stopRequested() {
        return !Settings.RUNNING || Thread.currentThread().isInterrupted();
    }

    private static final class Counters {
        int pairs;
        int signals;
        int events;
        int failures;
        boolean interrupted;
        final Map<Verdict, Integer> verdicts = new EnumMap<>(Verdict.class);
    }
}
