package filters;

/**
 * Static admission thresholds. A pair is analysed only when all three bounds hold.
 */
public record FilterConfig(double minLiquidity, double minVolume24h, double minPriceChange) {

    public static final double DEFAULT_MIN_LIQUIDITY    = 1_000;
    public static final double DEFAULT_MIN_VOLUME_24H   = 10_000;
    public static final double DEFAULT_MIN_PRICE_CHANGE = -1_000;

    public FilterConfig {
        if (!Double.isFinite(minLiquidity) || minLiquidity < 0) {
            throw new IllegalArgumentException("min_liquidity must be finite and >= 0: " + minLiquidity);
        }
        if (!Double.isFinite(minVolume24h) || minVolume24h < 0) {
            throw new IllegalArgumentException("min_volume_24h must be finite and >= 0: " + minVolume24h);
        }
        if (!Double.isFinite(minPriceChange)) {
            throw new IllegalArgumentException("min_price_change must be finite: " + minPriceChange);
        }
    }

    public static FilterConfig defaults() {
        return new FilterConfig(DEFAULT_MIN_LIQUIDITY, DEFAULT_MIN_VOLUME_24H, DEFAULT_MIN_PRICE_CHANGE);
    }

    /** NaN inputs never pass. */
    public boolean passes(double liquidity, double volume24h, double priceChange) {
        return liquidity >= minLiquidity
                && volume24h >= minVolume24h
                && priceChange >= minPriceChange;
    }
}
