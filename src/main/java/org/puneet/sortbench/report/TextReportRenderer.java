package org.puneet.sortbench.report;

import org.puneet.sortbench.statistical.PerformanceMetrics;
import org.puneet.sortbench.statistical.PerformanceReport;
import org.puneet.sortbench.statistical.RankedResult;
import org.puneet.sortbench.util.BenchmarkConfig;

import java.io.IOException;
import java.util.Locale;

/**
 * Plain-text console report: one block per strategy followed by a summary
 * naming the optimal algorithm and every strategy's relative slowdown.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-07-22
 */
public class TextReportRenderer implements ReportRenderer {

    private static final int WIDE = 80;
    private static final int NARROW = 40;

    static final String UNDEFINED_RATIO = "n/a (optimal measured 0 ms)";

    @Override
    public void render(PerformanceReport report, BenchmarkConfig config, Appendable out) throws IOException {
        line(out, "");
        line(out, "=".repeat(WIDE));
        line(out, "COMPREHENSIVE ALGORITHM PERFORMANCE ANALYSIS REPORT");
        line(out, "=".repeat(WIDE));
        line(out, format("Dataset Configuration: %d elements per test", config.getDatasetSize()));
        line(out, format("Iteration Configuration: %d runs per algorithm", config.getIterations()));

        for (RankedResult result : report.getResults()) {
            PerformanceMetrics metrics = result.getMetrics();
            line(out, "");
            line(out, "Algorithm: " + metrics.getStrategyName());
            line(out, "-".repeat(NARROW));
            line(out, format("Average Execution Time: %.3f ms", metrics.getMeanMillis()));
            line(out, format("Minimum Execution Time: %.3f ms", metrics.getMinMillis()));
            line(out, format("Maximum Execution Time: %.3f ms", metrics.getMaxMillis()));
            line(out, format("Standard Deviation:     %.3f ms", metrics.getStandardDeviationMillis()));
            line(out, "Correctness Validation: " + (metrics.isCorrect() ? "PASSED" : "FAILED"));
        }

        RankedResult optimal = report.getOptimal();
        line(out, "");
        line(out, "=".repeat(WIDE));
        line(out, "PERFORMANCE ANALYSIS SUMMARY");
        line(out, "=".repeat(WIDE));
        line(out, "Optimal Performance Algorithm: " + optimal.getMetrics().getStrategyName());
        line(out, format("Performance Advantage: %.2f ms average execution", optimal.getMetrics().getMeanMillis()));
        line(out, "");
        line(out, "Relative Performance Analysis:");
        for (RankedResult result : report.getResults()) {
            String name = result.getMetrics().getStrategyName();
            if (result.hasFiniteRatio()) {
                line(out, format("- %s: %.2fx slower than optimal", name, result.getRatio()));
            } else {
                line(out, "- " + name + ": " + UNDEFINED_RATIO);
            }
        }
        line(out, "=".repeat(WIDE));
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }

    private static void line(Appendable out, String text) throws IOException {
        out.append(text).append(System.lineSeparator());
    }
}
