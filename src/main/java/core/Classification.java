package core;

import org.jetbrains.annotations.Nullable;
import signal.AnalysisEvent;
import signal.TradeSignal;
import tuning.ThresholdState;

import java.util.List;
import java.util.Optional;

/**
 * Result of one snapshot.
 *
 * @param blacklistAdditions entries that were not blacklisted before this call;
 *                           the caller persists them
 * @param writesDropped      a store write failed and the remaining writes for
 *                           this pair were skipped
 */
public record Classification(
        String pairAddress,
        Verdict verdict,
        List<AnalysisEvent> events,
        @Nullable TradeSignal signal,
        double sharpeLike,
        List<String> blacklistAdditions,
        ThresholdState thresholds,
        boolean writesDropped
) {
    public Classification {
        events = List.copyOf(events);
        blacklistAdditions = List.copyOf(blacklistAdditions);
    }

    static Classification skipped(String pair, Verdict verdict, List<String> additions, ThresholdState t) {
        return new Classification(pair, verdict, List.of(), null, 0.0, additions, t, false);
    }

    public Optional<TradeSignal> tradeSignal() {
        return Optional.ofNullable(signal);
    }
}
