package org.puneet.sortbench.util;

import org.puneet.sortbench.algorithm.SortingStrategies;
import org.puneet.sortbench.exceptions.ValidationException;
import org.puneet.sortbench.report.ReportFormat;
import org.puneet.sortbench.simulation.ValueRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

/**
 * Configuration for a benchmark run.
 *
 * <p>Values come from the classpath resource {@value #CONFIG_RESOURCE}; any key
 * may be overridden with a system property carrying the {@value #SYSTEM_PROPERTY_PREFIX}
 * prefix, e.g. {@code -Dsortbench.dataset.size=5000}. Tests build instances
 * directly through {@link #builder()}.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-07-15
 */
public final class BenchmarkConfig {

    private static final Logger logger = LoggerFactory.getLogger(BenchmarkConfig.class);

    // ===================================================================================
    // PROPERTY KEYS
    // ===================================================================================

    public static final String CONFIG_RESOURCE = "benchmark.properties";
    public static final String SYSTEM_PROPERTY_PREFIX = "sortbench.";

    public static final String KEY_DATASET_SIZE = "dataset.size";
    public static final String KEY_ITERATIONS = "iterations";
    public static final String KEY_WARMUP_ITERATIONS = "warmup.iterations";
    public static final String KEY_VALUE_MIN = "value.min";
    public static final String KEY_VALUE_MAX = "value.max";
    public static final String KEY_PROGRESS_BAR_WIDTH = "progress.bar.width";
    public static final String KEY_REPORT_FORMAT = "report.format";
    public static final String KEY_ALGORITHMS_ENABLED = "algorithms.enabled";
    public static final String KEY_RANDOM_SEED = "random.seed";

    // ===================================================================================
    // DEFAULTS
    // ===================================================================================

    /** Elements per generated dataset */
    public static final int DEFAULT_DATASET_SIZE = 1000;

    /** Measured trials per strategy */
    public static final int DEFAULT_ITERATIONS = 5;

    /** Untimed trials per strategy before measuring */
    public static final int DEFAULT_WARMUP_ITERATIONS = 0;

    public static final int DEFAULT_VALUE_MIN = 1;
    public static final int DEFAULT_VALUE_MAX = 10000;

    /** Width of console progress bars, in cells */
    public static final int DEFAULT_PROGRESS_BAR_WIDTH = 50;

    public static final String DEFAULT_REPORT_FORMAT = "text";

    private final int datasetSize;
    private final int iterations;
    private final int warmupIterations;
    private final int valueMin;
    private final int valueMax;
    private final int progressBarWidth;
    private final String reportFormat;
    private final List<String> enabledAlgorithms;
    private final Long randomSeed;

    private BenchmarkConfig(Builder builder) {
        this.datasetSize = builder.datasetSize;
        this.iterations = builder.iterations;
        this.warmupIterations = builder.warmupIterations;
        this.valueMin = builder.valueMin;
        this.valueMax = builder.valueMax;
        this.progressBarWidth = builder.progressBarWidth;
        this.reportFormat = builder.reportFormat;
        this.enabledAlgorithms = List.copyOf(builder.enabledAlgorithms);
        this.randomSeed = builder.randomSeed;
    }

    // ===================================================================================
    // LOADING
    // ===================================================================================

    /**
     * Gets a configuration holding only the documented defaults.
     *
     * @return default configuration
     */
    public static BenchmarkConfig defaults() {
        return builder().build();
    }

    /**
     * Loads {@value #CONFIG_RESOURCE} from the classpath and applies system
     * property overrides.
     *
     * @return loaded configuration
     * @throws IllegalStateException if the resource is missing or unreadable
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static BenchmarkConfig load() {
        return load(CONFIG_RESOURCE, System.getProperties());
    }

    /**
     * Loads a configuration resource from the classpath and applies overrides.
     *
     * @param resource classpath resource name
     * @param overrides properties whose {@value #SYSTEM_PROPERTY_PREFIX}-prefixed
     *                  keys take precedence over the resource
     * @return loaded configuration
     * @throws IllegalStateException if the resource is missing or unreadable
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static BenchmarkConfig load(String resource, Properties overrides) {
        Properties properties = new Properties();
        try (InputStream input = BenchmarkConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (input == null) {
                throw new IllegalStateException(resource + " not found in classpath");
            }
            properties.load(input);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + resource, e);
        }

        if (overrides != null) {
            for (String name : overrides.stringPropertyNames()) {
                if (name.startsWith(SYSTEM_PROPERTY_PREFIX)) {
                    String key = name.substring(SYSTEM_PROPERTY_PREFIX.length());
                    properties.setProperty(key, overrides.getProperty(name));
                    logger.debug("Configuration override {}={}", key, overrides.getProperty(name));
                }
            }
        }

        BenchmarkConfig config = fromProperties(properties);
        logger.info("Loaded configuration from {}: {}", resource, config);
        return config;
    }

    /**
     * Builds a configuration from plain properties, falling back to defaults
     * for missing keys.
     *
     * @param properties property source
     * @return configuration
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static BenchmarkConfig fromProperties(Properties properties) {
        Builder builder = builder()
            .datasetSize(getIntProperty(properties, KEY_DATASET_SIZE, DEFAULT_DATASET_SIZE))
            .iterations(getIntProperty(properties, KEY_ITERATIONS, DEFAULT_ITERATIONS))
            .warmupIterations(getIntProperty(properties, KEY_WARMUP_ITERATIONS, DEFAULT_WARMUP_ITERATIONS))
            .valueMin(getIntProperty(properties, KEY_VALUE_MIN, DEFAULT_VALUE_MIN))
            .valueMax(getIntProperty(properties, KEY_VALUE_MAX, DEFAULT_VALUE_MAX))
            .progressBarWidth(getIntProperty(properties, KEY_PROGRESS_BAR_WIDTH, DEFAULT_PROGRESS_BAR_WIDTH))
            .reportFormat(properties.getProperty(KEY_REPORT_FORMAT, DEFAULT_REPORT_FORMAT).trim());

        String algorithms = properties.getProperty(KEY_ALGORITHMS_ENABLED);
        if (algorithms != null) {
            List<String> keys = new ArrayList<>();
            for (String s : algorithms.split(",")) {
                if (!s.isBlank()) keys.add(s.trim());
            }
            builder.enabledAlgorithms(keys);
        }

        String seed = properties.getProperty(KEY_RANDOM_SEED);
        if (seed != null && !seed.isBlank()) {
            try {
                builder.randomSeed(Long.parseLong(seed.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for '" + KEY_RANDOM_SEED + "': " + seed, e);
            }
        }
        return builder.build();
    }

    private static int getIntProperty(Properties properties, String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for '" + key + "': " + value, e);
        }
    }

    // ===================================================================================
    // VALIDATION
    // ===================================================================================

    /**
     * Validates the configuration before any trial starts.
     *
     * @throws ValidationException if any value is unusable
     */
    public void validate() throws ValidationException {
        if (datasetSize < 0) {
            throw ValidationException.invalidConfiguration(KEY_DATASET_SIZE,
                "dataset size must be non-negative", Map.of("value", datasetSize));
        }
        if (iterations <= 0) {
            throw ValidationException.invalidConfiguration(KEY_ITERATIONS,
                "iteration count must be positive", Map.of("value", iterations));
        }
        if (warmupIterations < 0) {
            throw ValidationException.invalidConfiguration(KEY_WARMUP_ITERATIONS,
                "warm-up iteration count must be non-negative", Map.of("value", warmupIterations));
        }
        if (valueMin > valueMax) {
            throw ValidationException.invalidConfiguration(KEY_VALUE_MIN,
                "lower bound exceeds upper bound", Map.of("min", valueMin, "max", valueMax));
        }
        if (progressBarWidth <= 0) {
            throw ValidationException.invalidConfiguration(KEY_PROGRESS_BAR_WIDTH,
                "progress bar width must be positive", Map.of("value", progressBarWidth));
        }
        try {
            ReportFormat.parse(reportFormat);
        } catch (IllegalArgumentException e) {
            throw ValidationException.invalidConfiguration(KEY_REPORT_FORMAT,
                e.getMessage(), Map.of("value", String.valueOf(reportFormat)));
        }
        if (enabledAlgorithms.isEmpty()) {
            throw ValidationException.emptyCollection(KEY_ALGORITHMS_ENABLED);
        }
        for (String key : enabledAlgorithms) {
            if (!SortingStrategies.isKnown(key)) {
                throw ValidationException.invalidConfiguration(KEY_ALGORITHMS_ENABLED,
                    "unknown sorting strategy '" + key + "'",
                    Map.of("known", SortingStrategies.getKeys()));
            }
        }

        if (iterations < 3) {
            logger.warn("Iteration count is low for meaningful statistics: {}", iterations);
        }
        logger.debug("Configuration validation completed successfully");
    }

    // ===================================================================================
    // ACCESSORS
    // ===================================================================================

    public int getDatasetSize() {
        return datasetSize;
    }

    public int getIterations() {
        return iterations;
    }

    public int getWarmupIterations() {
        return warmupIterations;
    }

    public int getValueMin() {
        return valueMin;
    }

    public int getValueMax() {
        return valueMax;
    }

    /**
     * @throws IllegalArgumentException if the bounds are inverted
     */
    public ValueRange getValueRange() {
        return new ValueRange(valueMin, valueMax);
    }

    public int getProgressBarWidth() {
        return progressBarWidth;
    }

    /**
     * @throws IllegalArgumentException if the configured format is unknown
     */
    public ReportFormat getReportFormat() {
        return ReportFormat.parse(reportFormat);
    }

    public List<String> getEnabledAlgorithms() {
        return enabledAlgorithms;
    }

    /**
     * Gets the fixed random seed, if one was configured.
     *
     * @return seed, or empty for non-deterministic datasets
     */
    public Optional<Long> getRandomSeed() {
        return Optional.ofNullable(randomSeed);
    }

    public Builder toBuilder() {
        return new Builder()
            .datasetSize(datasetSize)
            .iterations(iterations)
            .warmupIterations(warmupIterations)
            .valueMin(valueMin)
            .valueMax(valueMax)
            .progressBarWidth(progressBarWidth)
            .reportFormat(reportFormat)
            .enabledAlgorithms(enabledAlgorithms)
            .randomSeed(randomSeed);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return String.format(
            "BenchmarkConfig[datasetSize=%d, iterations=%d, warmup=%d, range=[%d, %d], format=%s, algorithms=%s, seed=%s]",
            datasetSize, iterations, warmupIterations, valueMin, valueMax,
            reportFormat, enabledAlgorithms, randomSeed == null ? "random" : randomSeed);
    }

    /**
     * Builder for {@link BenchmarkConfig}, pre-populated with the defaults.
     */
    public static final class Builder {
        private int datasetSize = DEFAULT_DATASET_SIZE;
        private int iterations = DEFAULT_ITERATIONS;
        private int warmupIterations = DEFAULT_WARMUP_ITERATIONS;
        private int valueMin = DEFAULT_VALUE_MIN;
        private int valueMax = DEFAULT_VALUE_MAX;
        private int progressBarWidth = DEFAULT_PROGRESS_BAR_WIDTH;
        private String reportFormat = DEFAULT_REPORT_FORMAT;
        private List<String> enabledAlgorithms = SortingStrategies.getKeys();
        private Long randomSeed;

        private Builder() {
        }

        public Builder datasetSize(int datasetSize) {
            this.datasetSize = datasetSize;
            return this;
        }

        public Builder iterations(int iterations) {
            this.iterations = iterations;
            return this;
        }

        public Builder warmupIterations(int warmupIterations) {
            this.warmupIterations = warmupIterations;
            return this;
        }

        public Builder valueMin(int valueMin) {
            this.valueMin = valueMin;
            return this;
        }

        public Builder valueMax(int valueMax) {
            this.valueMax = valueMax;
            return this;
        }

        public Builder progressBarWidth(int progressBarWidth) {
            this.progressBarWidth = progressBarWidth;
            return this;
        }

        public Builder reportFormat(String reportFormat) {
            this.reportFormat = reportFormat;
            return this;
        }

        public Builder enabledAlgorithms(List<String> enabledAlgorithms) {
            this.enabledAlgorithms = Objects.requireNonNull(enabledAlgorithms, "Enabled algorithms cannot be null");
            return this;
        }

        public Builder randomSeed(Long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        public BenchmarkConfig build() {
            return new BenchmarkConfig(this);
        }
    }
}
