package stats;

import state.PriceHistoryRecord;

import java.util.ArrayList;
import java.util.List;

public final class ReturnStats {

    private ReturnStats() {}

    public static double mean(List<Double> xs) {
        if (xs.isEmpty()) return 0.0;
        double sum = 0.0;
        for (double x : xs) sum += x;
        return sum / xs.size();
    }

    /** Population standard deviation (divides by n). */
    public static double stddev(List<Double> xs) {
        if (xs.size() < 2) return 0.0;
        double m = mean(xs);
        double acc = 0.0;
        for (double x : xs) {
            double d = x - m;
            acc += d * d;
        }
        return Math.sqrt(acc / xs.size());
    }

    /**
     * Simple returns of consecutive prices, oldest first.
     * A return is skipped when the previous price is not a positive finite number.
     */
    public static List<Double> returns(List<PriceHistoryRecord> history) {
        List<Double> out = new ArrayList<>();
        for (int i = 1; i < history.size(); i++) {
            double prev = history.get(i - 1).priceUsd();
            double curr = history.get(i).priceUsd();
            if (!(prev > 0) || !Double.isFinite(prev) || !Double.isFinite(curr)) continue;
            out.add((curr - prev) / prev);
        }
        return out;
    }

    /**
     * (mean - riskFree) / (stddev + epsilon) over the last {@code window} returns.
     * 0 when fewer than {@code minReturns} returns are available.
     */
    public static double sharpeLike(List<Double> returns, int window, int minReturns,
                                    double riskFreeRate, double epsilon) {
        List<Double> tail = returns.size() > window
                ? returns.subList(returns.size() - window, returns.size())
                : returns;
        if (tail.size() < minReturns) return 0.0;
        return (mean(tail) - riskFreeRate) / (stddev(tail) + epsilon);
    }
}
