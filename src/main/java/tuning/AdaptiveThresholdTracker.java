package tuning;

import stats.ReturnStats;

import java.util.List;

/**
 * Rolling market volatility → multiplier for the pump/rug thresholds.
 *
 * Recomputed once per cycle from the recent 24h price-change samples of all
 * tracked pairs. A calm market keeps the base thresholds, a volatile one widens
 * them: adjustment = 1 + volatility / 50.
 *
 * Input is expected to be clean (finite numbers only); the caller filters.
 */
public final class AdaptiveThresholdTracker {

    private final double basePumpThreshold;
    private final double baseRugThreshold;
    private final double divisor;

    private volatile ThresholdState state = ThresholdState.COLD_START;

    public AdaptiveThresholdTracker(double basePumpThreshold, double baseRugThreshold, double divisor) {
        this.basePumpThreshold = basePumpThreshold;
        this.baseRugThreshold = baseRugThreshold;
        this.divisor = divisor;
    }

    /** Fewer than 2 samples: keeps the previous state. */
    public void update(List<Double> recentPriceChanges) {
        if (recentPriceChanges.size() < 2) return;
        double volatility = ReturnStats.stddev(recentPriceChanges);
        state = new ThresholdState(volatility, 1.0 + volatility / divisor);
    }

    public ThresholdState state() {
        return state;
    }

    public double volatility() {
        return state.volatility();
    }

    public double adjustment() {
        return state.adjustment();
    }

    public double pumpThreshold() {
        return state.scale(basePumpThreshold);
    }

    public double rugThreshold() {
        return state.scale(baseRugThreshold);
    }

    public double basePumpThreshold() {
        return basePumpThreshold;
    }

    public double baseRugThreshold() {
        return baseRugThreshold;
    }

    public void reset() {
        state = ThresholdState.COLD_START;
    }

    @Override
    public String toString() {
        return String.format("[Thresholds] volatility=%.4f adj=%.4f pump>%.2f rug<%.2f",
                state.volatility(), state.adjustment(), pumpThreshold(), rugThreshold());
    }
}
