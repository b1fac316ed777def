package core;

import tuning.ThresholdState;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** Counters of one poll cycle over all chains. */
public record CycleReport(
        int pairsSeen,
        Map<Verdict, Integer> verdicts,
        int signals,
        int events,
        int failures,
        boolean interrupted,
        ThresholdState thresholds
) {
    public CycleReport {
        EnumMap<Verdict, Integer> copy = new EnumMap<>(Verdict.class);
        copy.putAll(verdicts);
        verdicts = Collections.unmodifiableMap(copy);
    }

    public int count(Verdict v) {
        return verdicts.getOrDefault(v, 0);
    }

    public String summary() {
        return String.format("pairs=%d signals=%d events=%d failures=%d %s%s",
                pairsSeen, signals, events, failures, verdicts,
                interrupted ? " (interrupted)" : "");
    }
}
