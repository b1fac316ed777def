package core;

/**
 * Position size from pool liquidity: never more than 1% of the pool,
 * never more than the configured share of the portfolio.
 */
public final class RiskSizer {

    private final double positionFraction;
    private final double portfolioValue;
    private final double minLiquidity;
    private final double maxLiquidityShare;

    public RiskSizer(double positionFraction, double portfolioValue,
                     double minLiquidity, double maxLiquidityShare) {
        this.positionFraction = positionFraction;
        this.portfolioValue = portfolioValue;
        this.minLiquidity = minLiquidity;
        this.maxLiquidityShare = maxLiquidityShare;
    }

    public RiskSizer(double positionFraction, double portfolioValue) {
        this(positionFraction, portfolioValue, 100, 0.01);
    }

    public double size(double liquidityUsd) {
        if (!Double.isFinite(liquidityUsd) || liquidityUsd <= minLiquidity) {
            return 0.0;
        }
        return Math.min(positionFraction * portfolioValue, liquidityUsd * maxLiquidityShare);
    }

    public double positionFraction() {
        return positionFraction;
    }

    public double portfolioValue() {
        return portfolioValue;
    }
}
