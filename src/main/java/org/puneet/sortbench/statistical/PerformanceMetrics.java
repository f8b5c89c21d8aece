package org.puneet.sortbench.statistical;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Aggregated timing and correctness result for one sorting strategy.
 * Created once by the trial runner and read-only afterwards.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-07-22
 */
public final class PerformanceMetrics {

    private final String strategyName;
    private final TrialStatistics statistics;
    private final boolean correct;
    private final int datasetSize;

    /**
     * Creates a new metrics record.
     *
     * @param strategyName strategy display name
     * @param statistics timing statistics over all measured trials
     * @param correct true iff every trial's output validated as sorted
     * @param datasetSize elements per trial dataset
     */
    public PerformanceMetrics(String strategyName, TrialStatistics statistics,
                              boolean correct, int datasetSize) {
        this.strategyName = Objects.requireNonNull(strategyName, "Strategy name cannot be null");
        this.statistics = Objects.requireNonNull(statistics, "Statistics cannot be null");
        this.correct = correct;
        this.datasetSize = datasetSize;
    }

    public String getStrategyName() {
        return strategyName;
    }

    /** Mean trial duration in milliseconds. */
    public double getMeanMillis() {
        return statistics.getMean();
    }

    public double getMinMillis() {
        return statistics.getMin();
    }

    public double getMaxMillis() {
        return statistics.getMax();
    }

    public double getStandardDeviationMillis() {
        return statistics.getStandardDeviation();
    }

    /**
     * Whether every trial produced sorted output.
     */
    public boolean isCorrect() {
        return correct;
    }

    public int getIterations() {
        return statistics.getCount();
    }

    public int getDatasetSize() {
        return datasetSize;
    }

    public List<Double> getTrialDurations() {
        return statistics.getDurations();
    }

    public TrialStatistics getStatistics() {
        return statistics;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
                "PerformanceMetrics[%s: mean=%.3fms, min=%.3fms, max=%.3fms, correct=%s, trials=%d, size=%d]",
                strategyName, getMeanMillis(), getMinMillis(), getMaxMillis(),
                correct, getIterations(), datasetSize);
    }
}
