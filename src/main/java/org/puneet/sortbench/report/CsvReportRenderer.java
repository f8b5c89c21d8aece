package org.puneet.sortbench.report;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.puneet.sortbench.statistical.PerformanceMetrics;
import org.puneet.sortbench.statistical.PerformanceReport;
import org.puneet.sortbench.statistical.RankedResult;
import org.puneet.sortbench.util.BenchmarkConfig;

import java.io.IOException;
import java.util.Locale;

/**
 * Renders the report as CSV, one row per strategy in evaluation order.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-07-22
 */
public class CsvReportRenderer implements ReportRenderer {

    static final String[] HEADERS = {
        "Algorithm", "DatasetSize", "Iterations", "MeanMs", "MinMs", "MaxMs",
        "StdDevMs", "Correct", "Rank", "Ratio", "Optimal"
    };

    static final String UNDEFINED_RATIO = "n/a";

    @Override
    public void render(PerformanceReport report, BenchmarkConfig config, Appendable out) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader(HEADERS)
                .build();

        // not closed: the sink belongs to the caller
        CSVPrinter printer = new CSVPrinter(out, format);
        for (RankedResult result : report.getResults()) {
            PerformanceMetrics metrics = result.getMetrics();
            printer.printRecord(
                metrics.getStrategyName(),
                metrics.getDatasetSize(),
                metrics.getIterations(),
                decimal(metrics.getMeanMillis()),
                decimal(metrics.getMinMillis()),
                decimal(metrics.getMaxMillis()),
                decimal(metrics.getStandardDeviationMillis()),
                metrics.isCorrect(),
                result.getRank(),
                result.hasFiniteRatio() ? String.format(Locale.ROOT, "%.2f", result.getRatio()) : UNDEFINED_RATIO,
                result.isOptimal()
            );
        }
        printer.flush();
    }

    private static String decimal(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }
}
