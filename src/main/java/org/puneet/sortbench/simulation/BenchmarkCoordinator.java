package org.puneet.sortbench.simulation;

import org.puneet.sortbench.algorithm.SortingStrategies;
import org.puneet.sortbench.algorithm.SortingStrategy;
import org.puneet.sortbench.exceptions.ValidationException;
import org.puneet.sortbench.statistical.PerformanceMetrics;
import org.puneet.sortbench.statistical.PerformanceRanker;
import org.puneet.sortbench.statistical.PerformanceReport;
import org.puneet.sortbench.util.BenchmarkConfig;
import org.puneet.sortbench.util.ProgressTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Coordinates a complete benchmark run: measures every enabled strategy in
 * order, one after another, and ranks the collected metrics.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-07-22
 */
public class BenchmarkCoordinator {
    private static final Logger logger = LoggerFactory.getLogger(BenchmarkCoordinator.class);

    public static final String RUN_NAME = "Sorting Algorithm Performance Analysis";

    private final BenchmarkConfig config;
    private final List<SortingStrategy> strategies;
    private final PerformanceRanker ranker;
    private final List<PerformanceMetrics> collectedMetrics;

    /**
     * Creates a coordinator for the strategies enabled in the configuration.
     *
     * @param config run configuration
     * @throws ValidationException if the configuration is invalid
     */
    public BenchmarkCoordinator(BenchmarkConfig config) throws ValidationException {
        this(SortingStrategies.create(validated(config).getEnabledAlgorithms()), config);
    }

    /**
     * Creates a coordinator for an explicit list of strategies.
     *
     * @param config run configuration
     * @param strategies strategies in evaluation order
     * @throws ValidationException if the configuration is invalid or no strategy is given
     */
    public BenchmarkCoordinator(BenchmarkConfig config, List<SortingStrategy> strategies)
            throws ValidationException {
        this(strategies, validated(config));
    }

    // config must already be validated
    private BenchmarkCoordinator(List<SortingStrategy> strategies, BenchmarkConfig config)
            throws ValidationException {
        if (strategies == null || strategies.isEmpty()) {
            throw ValidationException.emptyCollection("strategies");
        }
        this.config = config;
        this.strategies = List.copyOf(strategies);
        this.ranker = new PerformanceRanker();
        this.collectedMetrics = new ArrayList<>();
    }

    private static BenchmarkConfig validated(BenchmarkConfig config) throws ValidationException {
        if (config == null) {
            throw ValidationException.nullValue("config");
        }
        config.validate();
        return config;
    }

    /**
     * Runs all strategies and builds the report.
     *
     * @return the comparative report
     * @throws ValidationException if a trial or the ranking rejects its input
     */
    public PerformanceReport runBenchmark() throws ValidationException {
        logger.info("Starting benchmark with {}", config);
        collectedMetrics.clear();

        DatasetGenerator generator = createGenerator();
        ProgressTracker progressTracker = new ProgressTracker(config.getProgressBarWidth());
        TrialRunner runner = new TrialRunner(generator, progressTracker, config.getWarmupIterations());

        progressTracker.initializeRun(RUN_NAME, strategies.size() * config.getIterations());

        for (SortingStrategy strategy : strategies) {
            PerformanceMetrics metrics = runner.measure(strategy, config.getIterations(), config.getDatasetSize());
            collectedMetrics.add(metrics);
            if (!metrics.isCorrect()) {
                logger.warn("{} produced unsorted output in at least one trial", metrics.getStrategyName());
            }
        }

        PerformanceReport report = ranker.rank(collectedMetrics);
        progressTracker.logCompletion();
        logger.info("Benchmark finished: {} strategies evaluated, all correct: {}",
                report.size(), report.isAllCorrect());
        return report;
    }

    private DatasetGenerator createGenerator() {
        Optional<Long> seed = config.getRandomSeed();
        if (seed.isPresent()) {
            logger.info("Using fixed random seed {}", seed.get());
            return new DatasetGenerator(config.getValueRange(), new Random(seed.get()));
        }
        return new DatasetGenerator(config.getValueRange());
    }

    /**
     * Gets the metrics collected by the last run, in evaluation order.
     *
     * @return unmodifiable list of metrics
     */
    public List<PerformanceMetrics> getCollectedMetrics() {
        return Collections.unmodifiableList(collectedMetrics);
    }

    public List<SortingStrategy> getStrategies() {
        return strategies;
    }

    public BenchmarkConfig getConfig() {
        return config;
    }
}
