package org.puneet.sortbench.statistical;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.*;

/**
 * Immutable summary of the durations observed over a series of trials.
 * Built in one pass from the recorded durations instead of being accumulated
 * by the caller.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-07-22
 */
public final class TrialStatistics {

    private final List<Double> durations;
    private final double mean;
    private final double min;
    private final double max;
    private final double standardDeviation;

    private TrialStatistics(List<Double> durations, double mean, double min,
                            double max, double standardDeviation) {
        this.durations = durations;
        this.mean = mean;
        this.min = min;
        this.max = max;
        this.standardDeviation = standardDeviation;
    }

    /**
     * Summarizes the given durations.
     *
     * @param durationsMillis per-trial durations in milliseconds, in trial order
     * @return statistics over the durations
     * @throws IllegalArgumentException if no duration is given or any is negative or NaN
     */
    public static TrialStatistics of(double[] durationsMillis) {
        if (durationsMillis == null || durationsMillis.length == 0) {
            throw new IllegalArgumentException("At least one trial duration is required");
        }

        DescriptiveStatistics stats = new DescriptiveStatistics();
        List<Double> recorded = new ArrayList<>(durationsMillis.length);
        for (double duration : durationsMillis) {
            if (Double.isNaN(duration) || duration < 0) {
                throw new IllegalArgumentException("Invalid trial duration: " + duration);
            }
            stats.addValue(duration);
            recorded.add(duration);
        }

        double min = stats.getMin();
        double max = stats.getMax();
        // rounding can leave the mean one ulp outside [min, max] when all values are equal
        double mean = Math.min(max, Math.max(min, stats.getSum() / stats.getN()));

        return new TrialStatistics(Collections.unmodifiableList(recorded), mean, min, max,
                stats.getStandardDeviation());
    }

    public List<Double> getDurations() {
        return durations;
    }

    public int getCount() {
        return durations.size();
    }

    public double getMean() {
        return mean;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    /**
     * Sample standard deviation; 0 for a single trial.
     */
    public double getStandardDeviation() {
        return standardDeviation;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "TrialStatistics[n=%d, mean=%.3f, min=%.3f, max=%.3f, sd=%.3f]",
                durations.size(), mean, min, max, standardDeviation);
    }
}
