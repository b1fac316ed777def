package tuning;

/** Market volatility and the multiplier applied to the base pump/rug thresholds. */
public record ThresholdState(double volatility, double adjustment) {

    public static final ThresholdState COLD_START = new ThresholdState(0.0, 1.0);

    public double scale(double baseThreshold) {
        return baseThreshold * adjustment;
    }
}
