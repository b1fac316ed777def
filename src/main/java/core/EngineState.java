package core;

import filters.Blacklist;
import filters.FilterConfig;
import tuning.AdaptiveThresholdTracker;

/**
 * Everything the classifier reads or mutates between snapshots.
 * Owned by {@link AnalysisEngine}; passed by reference into every classification.
 */
public final class EngineState {

    private volatile FilterConfig filters;
    private final Blacklist blacklist;
    private final AdaptiveThresholdTracker thresholds;

    public EngineState(FilterConfig filters, Blacklist blacklist, AdaptiveThresholdTracker thresholds) {
        this.filters = filters;
        this.blacklist = blacklist;
        this.thresholds = thresholds;
    }

    public FilterConfig filters() {
        return filters;
    }

    public void setFilters(FilterConfig filters) {
        this.filters = filters;
    }

    public Blacklist blacklist() {
        return blacklist;
    }

    public AdaptiveThresholdTracker thresholds() {
        return thresholds;
    }
}
