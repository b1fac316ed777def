package core;

import filters.Blacklist;
import filters.FilterConfig;
import log.EngineLog;
import net.FakeVolumeOracle;
import net.ReputationOracle;
import signal.AnalysisEvent;
import signal.EventType;
import signal.TradeAction;
import signal.TradeSignal;
import state.PairSnapshot;
import state.PriceHistoryRecord;
import stats.ReturnStats;
import store.AnalysisStore;
import store.StoreException;
import tuning.AdaptiveThresholdTracker;
import tuning.ThresholdState;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

import static app.Settings.*;

/**
 * Decision core: one snapshot in, one {@link Classification} out.
 *
 * Gates run in a fixed order and the first one that fires ends the pipeline:
 * reputation (fail-closed) → fake volume (fail-open) → blacklist →
 * new-pair bookkeeping → admission filter → history → rug / pump / dip.
 */
public class AnomalyClassifier {

    private final ReputationOracle reputation;
    private final FakeVolumeOracle fakeVolume;
    private final AnalysisStore store;
    private final RiskSizer sizer;
    private final Clock clock;
    private final Duration newPairAge;
    private final double riskFreeRate;

    public AnomalyClassifier(ReputationOracle reputation,
                             FakeVolumeOracle fakeVolume,
                             AnalysisStore store,
                             RiskSizer sizer,
                             Clock clock,
                             Duration newPairAge,
                             double riskFreeRate) {
        this.reputation = reputation;
        this.fakeVolume = fakeVolume;
        this.store = store;
        this.sizer = sizer;
        this.clock = clock;
        this.newPairAge = newPairAge;
        this.riskFreeRate = riskFreeRate;
    }

    public Classification classify(PairSnapshot s, List<PriceHistoryRecord> history, EngineState st) {
        String pair = s.pairAddress();
        ThresholdState thresholds = st.thresholds().state();

        // =========================
        // 1. Reputation
        // =========================
        if (!ratedGood(pair)) {
            EngineLog.logSkip(pair, "not rated 'good' by RugCheck");
            return Classification.skipped(pair, Verdict.SKIPPED_UNRATED, List.of(), thresholds);
        }

        // =========================
        // 2. Fake volume
        // =========================
        FakeVolumeOracle.Verdict fake = checkFakeVolume(s);
        if (fake.fakeVolume()) {
            Blacklist bl = st.blacklist();
            List<String> added = new ArrayList<>();
            if (bl.addCoin(pair)) added.add(pair);
            if (bl.addCoin(s.baseSymbol())) added.add(s.baseSymbol());
            if (!added.isEmpty()) {
                EngineLog.log("BLACKLIST", pair, "added " + added + " due to fake volume: "
                        + (fake.reason() != null ? fake.reason() : "no reason"));
            }
            return Classification.skipped(pair, Verdict.SKIPPED_FAKE_VOLUME, added, thresholds);
        }

        // =========================
        // 3. Blacklist
        // =========================
        if (isBlacklisted(s, st.blacklist())) {
            EngineLog.logSkip(pair, String.format("blacklisted (coin: %s/%s, dev: %s)",
                    s.baseSymbol(), s.quoteSymbol(), s.creatorWallet()));
            return Classification.skipped(pair, Verdict.SKIPPED_BLACKLISTED, List.of(), thresholds);
        }

        Instant now = clock.instant();
        PairWrites writes = new PairWrites(pair);
        List<AnalysisEvent> events = new ArrayList<>();

        // =========================
        // 4. New pair
        // =========================
        Boolean inserted = writes.call("upsertPair", () -> store.upsertPair(s, now));
        if (Boolean.TRUE.equals(inserted) && s.ageAt(now).compareTo(newPairAge) < 0) {
            Map<String, Object> d = new LinkedHashMap<>();
            d.put("age_hours", round2(s.ageAt(now).toMinutes() / 60.0));
            d.put("chain", s.chainId());
            d.put("base_token", s.baseSymbol());
            d.put("quote_token", s.quoteSymbol());
            AnalysisEvent e = new AnalysisEvent(pair, EventType.NEW, now, d);
            writes.run("appendEvent", () -> store.appendEvent(e));
            events.add(e);
            EngineLog.log("NEW", pair, "new pair detected " + s.baseSymbol() + "/" + s.quoteSymbol());
        }

        // =========================
        // 5. Admission filter
        // =========================
        FilterConfig filters = st.filters();
        if (!filters.passes(s.liquidityUsd(), s.volume24h(), s.priceChange24h())) {
            EngineLog.log("FILTER", pair, String.format(Locale.US,
                    "filtered out: liquidity=%.2f volume=%.2f change=%.2f",
                    s.liquidityUsd(), s.volume24h(), s.priceChange24h()));
            return new Classification(pair, Verdict.FILTERED, events, null, 0.0,
                    List.of(), thresholds, writes.dropped);
        }

        // =========================
        // 6. History
        // =========================
        writes.run("appendHistory", () -> store.appendHistory(PriceHistoryRecord.of(s, now)));

        double sharpe = sharpeLike(history);

        // =========================
        // 7. Detection
        // =========================
        AdaptiveThresholdTracker t = st.thresholds();
        double rugThreshold = thresholds.scale(t.baseRugThreshold());
        double pumpThreshold = thresholds.scale(t.basePumpThreshold());
        double change = s.priceChange24h();

        Verdict verdict = Verdict.NORMAL;
        TradeSignal signal = null;

        if (change < rugThreshold && s.liquidityUsd() < RUG_MAX_LIQUIDITY) {
            Map<String, Object> d = new LinkedHashMap<>();
            d.put("price_change_24h", change);
            d.put("liquidity_usd", s.liquidityUsd());
            d.put("rug_threshold", rugThreshold);
            d.put("adjustment", thresholds.adjustment());
            AnalysisEvent e = new AnalysisEvent(pair, EventType.RUG, now, d);
            writes.run("appendEvent", () -> store.appendEvent(e));
            events.add(e);
            verdict = Verdict.RUG;
            EngineLog.log("RUG", pair, String.format(Locale.US,
                    "rug pull detected: change=%.2f%% (< %.2f) liquidity=%.2f", change, rugThreshold, s.liquidityUsd()));

        } else if (change > pumpThreshold && s.volume24h() > PUMP_MIN_VOLUME) {
            Map<String, Object> d = new LinkedHashMap<>();
            d.put("price_change_24h", change);
            d.put("volume_24h", s.volume24h());
            d.put("pump_threshold", pumpThreshold);
            d.put("adjustment", thresholds.adjustment());
            d.put("sharpe_like", sharpe);
            AnalysisEvent e = new AnalysisEvent(pair, EventType.PUMP, now, d);
            writes.run("appendEvent", () -> store.appendEvent(e));
            events.add(e);
            verdict = Verdict.PUMP;
            signal = new TradeSignal(pair, s.chainId(), s.baseSymbol(), TradeAction.BUY,
                    sizer.size(s.liquidityUsd()), s.priceUsd(),
                    String.format(Locale.US, "pump: change=%.2f%% volume=%.0f", change, s.volume24h()));
            EngineLog.log("PUMP", pair, String.format(Locale.US,
                    "pump detected: change=%.2f%% (> %.2f) volume=%.0f size=%.2f",
                    change, pumpThreshold, s.volume24h(), signal.amount()));

        } else if (change < DIP_THRESHOLD) {
            // fixed size, not risk-sized
            verdict = Verdict.DIP;
            signal = new TradeSignal(pair, s.chainId(), s.baseSymbol(), TradeAction.SELL,
                    DIP_SELL_AMOUNT, s.priceUsd(),
                    String.format(Locale.US, "dip: change=%.2f%%", change));
            EngineLog.log("DIP", pair, String.format(Locale.US, "dip: change=%.2f%%", change));
        }

        return new Classification(pair, verdict, events, signal, sharpe,
                List.of(), thresholds, writes.dropped);
    }

    /** Informational (mean - rf) / (stddev + eps) over the last returns of the pair. */
    public double sharpeLike(List<PriceHistoryRecord> history) {
        return ReturnStats.sharpeLike(ReturnStats.returns(history),
                SHARPE_WINDOW, SHARPE_MIN_RETURNS, riskFreeRate, SHARPE_EPSILON);
    }

    private boolean ratedGood(String pair) {
        try {
            String rating = reputation.rating(pair);
            EngineLog.debug(pair, "RugCheck rating: " + rating);
            return ReputationOracle.isGood(rating);
        } catch (Exception e) {
            EngineLog.error("RugCheck", "check failed for " + pair, e);
            return false;
        }
    }

    private FakeVolumeOracle.Verdict checkFakeVolume(PairSnapshot s) {
        try {
            FakeVolumeOracle.Verdict v = fakeVolume.check(
                    s.chainId(), s.pairAddress(), s.volume24h(), s.liquidityUsd());
            return v != null ? v : FakeVolumeOracle.Verdict.CLEAN;
        } catch (Exception e) {
            EngineLog.error("FakeVolume", "check failed for " + s.pairAddress() + ", treating as clean", e);
            return FakeVolumeOracle.Verdict.CLEAN;
        }
    }

    private static boolean isBlacklisted(PairSnapshot s, Blacklist bl) {
        return bl.containsCoin(s.baseSymbol())
                || bl.containsCoin(s.quoteSymbol())
                || bl.containsCoin(s.pairAddress())
                || bl.containsDev(s.creatorWallet());
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }

    /** After the first failed write of a pair the rest are skipped for this snapshot. */
    private static final class PairWrites {
        private final String pair;
        private boolean dropped;

        PairWrites(String pair) {
            this.pair = pair;
        }

        void run(String what, Runnable op) {
            call(what, () -> {
                op.run();
                return Boolean.TRUE;
            });
        }

        <T> T call(String what, Supplier<T> op) {
            if (dropped) return null;
            try {
                return op.get();
            } catch (StoreException e) {
                dropped = true;
                EngineLog.error("Store", what + " failed for " + pair + ", dropping remaining writes", e);
                return null;
            }
        }
    }
}
