package org.puneet.sortbench.simulation;

import org.puneet.sortbench.algorithm.SortingStrategy;
import org.puneet.sortbench.exceptions.ValidationException;
import org.puneet.sortbench.statistical.PerformanceMetrics;
import org.puneet.sortbench.statistical.TrialStatistics;
import org.puneet.sortbench.util.ProgressTracker;
import org.puneet.sortbench.util.SortValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Runs repeated timed trials of one sorting strategy and aggregates them into
 * a {@link PerformanceMetrics} record.
 *
 * <p>Each trial sorts a freshly generated dataset that no other trial sees.
 * A trial whose output fails validation does not abort the run; it only
 * clears the record's correctness flag.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-07-20
 */
public class TrialRunner {
    private static final Logger logger = LoggerFactory.getLogger(TrialRunner.class);

    private static final double NANOS_PER_MILLI = 1_000_000.0;

    private final DatasetGenerator generator;
    private final ProgressTracker progressTracker;
    private final int warmupIterations;

    /**
     * Creates a runner without warm-up trials.
     *
     * @param generator dataset source
     * @param progressTracker receives a progress update after every measured trial
     */
    public TrialRunner(DatasetGenerator generator, ProgressTracker progressTracker) {
        this(generator, progressTracker, 0);
    }

    /**
     * Creates a runner.
     *
     * @param generator dataset source
     * @param progressTracker receives a progress update after every measured trial
     * @param warmupIterations untimed trials to run before measuring
     * @throws IllegalArgumentException if warmupIterations is negative
     */
    public TrialRunner(DatasetGenerator generator, ProgressTracker progressTracker, int warmupIterations) {
        this.generator = Objects.requireNonNull(generator, "Dataset generator cannot be null");
        this.progressTracker = Objects.requireNonNull(progressTracker, "Progress tracker cannot be null");
        if (warmupIterations < 0) {
            throw new IllegalArgumentException("Warm-up iterations must be non-negative: " + warmupIterations);
        }
        this.warmupIterations = warmupIterations;
    }

    /**
     * Measures a strategy over {@code iterations} trials.
     *
     * @param strategy the strategy to measure
     * @param iterations number of measured trials, at least 1
     * @param datasetSize elements per dataset, at least 0
     * @return the aggregated metrics
     * @throws ValidationException if any argument is invalid; nothing is timed in that case
     */
    public PerformanceMetrics measure(SortingStrategy strategy, int iterations, int datasetSize)
            throws ValidationException {
        if (strategy == null) {
            throw ValidationException.nullValue("strategy");
        }
        if (iterations < 1) {
            throw ValidationException.outOfRange("iterations", iterations, 1, Integer.MAX_VALUE);
        }
        if (datasetSize < 0) {
            throw ValidationException.invalidSize("datasetSize", datasetSize, 0, "MIN");
        }

        String name = strategy.getName();
        logger.info("Measuring {}: {} iterations with {} elements (warm-up: {})",
                name, iterations, datasetSize, warmupIterations);
        progressTracker.startStrategy(name, iterations, datasetSize);

        for (int i = 0; i < warmupIterations; i++) {
            strategy.sort(generator.generate(datasetSize));
        }

        double[] durations = new double[iterations];
        boolean allCorrect = true;

        for (int trial = 0; trial < iterations; trial++) {
            int[] dataset = generator.generate(datasetSize);

            long start = System.nanoTime();
            strategy.sort(dataset);
            long end = System.nanoTime();

            durations[trial] = (end - start) / NANOS_PER_MILLI;

            int violation = SortValidator.findFirstViolation(dataset);
            if (violation >= 0) {
                allCorrect = false;
                logger.warn("Sort contract violated by {} in trial {}: element {} at index {} is less than its predecessor {}",
                        name, trial + 1, dataset[violation], violation, dataset[violation - 1]);
            }

            logger.debug("{} trial {}/{}: {} ms", name, trial + 1, iterations, durations[trial]);
            progressTracker.reportProgress(name, trial + 1, iterations);
        }

        TrialStatistics statistics = TrialStatistics.of(durations);
        PerformanceMetrics metrics = new PerformanceMetrics(name, statistics, allCorrect, datasetSize);

        progressTracker.completeStrategy(name);
        logger.info("Completed {}", metrics);
        return metrics;
    }

    public int getWarmupIterations() {
        return warmupIterations;
    }
}
