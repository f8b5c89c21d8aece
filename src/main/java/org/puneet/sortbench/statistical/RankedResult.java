package org.puneet.sortbench.statistical;

/**
 * One entry of a performance report: a strategy's metrics, its position when
 * ordered by mean time and its slowdown relative to the optimal strategy.
 */
public final class RankedResult {

    private final PerformanceMetrics metrics;
    private final int rank;
    private final double ratio;
    private final boolean optimal;

    RankedResult(PerformanceMetrics metrics, int rank, double ratio, boolean optimal) {
        this.metrics = metrics;
        this.rank = rank;
        this.ratio = ratio;
        this.optimal = optimal;
    }

    public PerformanceMetrics getMetrics() {
        return metrics;
    }

    /**
     * 1-based position by mean time; ties keep evaluation order.
     */
    public int getRank() {
        return rank;
    }

    /**
     * Mean time divided by the optimal mean time. Exactly 1.0 for the optimal
     * strategy, at least 1.0 for every other one. Positive infinity when the
     * optimal mean is 0 ms and this one is not.
     */
    public double getRatio() {
        return ratio;
    }

    public boolean hasFiniteRatio() {
        return Double.isFinite(ratio);
    }

    public boolean isOptimal() {
        return optimal;
    }

    @Override
    public String toString() {
        return String.format(java.util.Locale.ROOT, "#%d %s (%.2fx)", rank, metrics.getStrategyName(), ratio);
    }
}
