package org.puneet.sortbench.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks and displays progress of a benchmark run.
 * Every line is logged with the {@code PROGRESS} marker so the console
 * appender can render it without the usual logger prefix.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-01-26
 */
public class ProgressTracker {
    private static final Logger logger = LoggerFactory.getLogger(ProgressTracker.class);
    private static final Marker PROGRESS_MARKER = MarkerFactory.getMarker("PROGRESS");

    private final int barWidth;
    private final AtomicInteger totalTrials;
    private final AtomicInteger completedTrials;
    private final AtomicLong startTime;

    private String currentStrategy;

    /**
     * Creates a tracker rendering bars of the given width.
     *
     * @param barWidth number of cells in a progress bar
     * @throws IllegalArgumentException if barWidth is not positive
     */
    public ProgressTracker(int barWidth) {
        if (barWidth <= 0) {
            throw new IllegalArgumentException("Progress bar width must be positive: " + barWidth);
        }
        this.barWidth = barWidth;
        this.totalTrials = new AtomicInteger(0);
        this.completedTrials = new AtomicInteger(0);
        this.startTime = new AtomicLong(System.currentTimeMillis());
        this.currentStrategy = "";
    }

    public ProgressTracker() {
        this(BenchmarkConfig.DEFAULT_PROGRESS_BAR_WIDTH);
    }

    /**
     * Initializes the tracker for a whole run.
     *
     * @param runName Name of the run shown in the header
     * @param totalTrials Total number of measured trials across all strategies
     */
    public void initializeRun(String runName, int totalTrials) {
        this.totalTrials.set(totalTrials);
        this.completedTrials.set(0);
        this.startTime.set(System.currentTimeMillis());

        String timestamp = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"));
        logger.info(PROGRESS_MARKER, "=".repeat(80));
        logger.info(PROGRESS_MARKER, runName);
        logger.info(PROGRESS_MARKER, "Run Started: {}", timestamp);
        logger.info(PROGRESS_MARKER, "Total Trials: {}", totalTrials);
        logger.info(PROGRESS_MARKER, "=".repeat(80));
    }

    /**
     * Announces the strategy about to be measured.
     *
     * @param strategyName Strategy display name
     * @param iterations Measured trials for this strategy
     * @param datasetSize Elements per dataset
     */
    public void startStrategy(String strategyName, int iterations, int datasetSize) {
        this.currentStrategy = strategyName;
        logger.info(PROGRESS_MARKER, "");
        logger.info(PROGRESS_MARKER, "Analyzing {} Algorithm Performance:", strategyName);
        logger.info(PROGRESS_MARKER, "Executing {} iterations with {} elements...", iterations, datasetSize);
    }

    /**
     * Reports progress for the current strategy.
     *
     * @param strategyName Strategy display name
     * @param completed Number of completed trials for this strategy
     * @param total Total number of trials for this strategy
     */
    public void reportProgress(String strategyName, int completed, int total) {
        this.currentStrategy = strategyName;
        this.completedTrials.incrementAndGet();
        double percentage = total > 0 ? (double) completed / total * 100 : 100.0;
        logger.info(PROGRESS_MARKER, "{}", createProgressBar(percentage));
    }

    /**
     * Marks the current strategy as complete.
     *
     * @param strategyName Strategy display name
     */
    public void completeStrategy(String strategyName) {
        logger.info(PROGRESS_MARKER, "Analysis Complete: {}", strategyName);
        this.currentStrategy = "";
    }

    /**
     * Creates a visual progress bar followed by the percentage.
     *
     * @param percentage Completion percentage, clamped to [0, 100]
     * @return Progress bar string
     */
    public String createProgressBar(double percentage) {
        double clamped = Math.max(0.0, Math.min(100.0, percentage));
        int filledLength = (int) (barWidth * clamped / 100);

        StringBuilder bar = new StringBuilder();
        bar.append("[");
        for (int i = 0; i < barWidth; i++) {
            if (i < filledLength) {
                bar.append("█");
            } else {
                bar.append("░");
            }
        }
        bar.append("] ").append(String.format(Locale.ROOT, "%.1f%%", clamped));
        return bar.toString();
    }

    /**
     * Gets a summary report of the progress.
     *
     * @return Summary report string
     */
    public String getSummaryReport() {
        int completed = completedTrials.get();
        int total = totalTrials.get();
        long totalTime = System.currentTimeMillis() - startTime.get();

        return String.format(Locale.ROOT, "Progress Summary: %d/%d trials completed (%.1f%%) in %s",
                           completed, total, getOverallProgress(), formatDuration(totalTime));
    }

    /**
     * Logs completion information for the whole run.
     */
    public void logCompletion() {
        String timestamp = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"));
        logger.info(PROGRESS_MARKER, "=".repeat(80));
        logger.info(PROGRESS_MARKER, "Run Finished: {}", timestamp);
        logger.info(PROGRESS_MARKER, getSummaryReport());
        logger.info(PROGRESS_MARKER, "=".repeat(80));
    }

    /**
     * Gets the overall progress as a percentage.
     *
     * @return Progress percentage (0.0 to 100.0)
     */
    public double getOverallProgress() {
        int completed = completedTrials.get();
        int total = totalTrials.get();
        return total > 0 ? Math.min(100.0, (double) completed / total * 100) : 0.0;
    }

    public int getCompletedTrials() {
        return completedTrials.get();
    }

    public String getCurrentStrategy() {
        return currentStrategy;
    }

    public int getBarWidth() {
        return barWidth;
    }

    private String formatDuration(long milliseconds) {
        long seconds = milliseconds / 1000;
        long minutes = seconds / 60;
        long hours = minutes / 60;

        if (hours > 0) {
            return String.format("%dh %dm %ds", hours, minutes % 60, seconds % 60);
        } else if (minutes > 0) {
            return String.format("%dm %ds", minutes, seconds % 60);
        } else {
            return String.format("%ds", seconds);
        }
    }
}
