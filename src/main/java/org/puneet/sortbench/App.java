package org.puneet.sortbench;

import org.puneet.sortbench.exceptions.ValidationException;
import org.puneet.sortbench.report.ReportRenderer;
import org.puneet.sortbench.simulation.BenchmarkCoordinator;
import org.puneet.sortbench.statistical.PerformanceReport;
import org.puneet.sortbench.util.BenchmarkConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;

/**
 * Main application class for the sorting algorithm benchmark.
 * Loads the configuration, measures every enabled strategy and prints the
 * comparative report to standard output.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-07-22
 */
public class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        logger.info("Starting Sorting Algorithm Benchmark");

        try {
            BenchmarkConfig config = BenchmarkConfig.load();
            run(config, System.out);
            logger.info("Benchmark completed successfully");
        } catch (ValidationException e) {
            logger.error("Invalid benchmark configuration: {}", e.getDetailedMessage());
            System.exit(1);
        } catch (Exception e) {
            logger.error("Critical error in application execution", e);
            System.exit(1);
        }
    }

    /**
     * Runs a full benchmark and renders the report.
     *
     * @param config run configuration
     * @param out sink for the report
     * @return the report that was rendered
     * @throws ValidationException if the configuration is invalid
     * @throws IOException if the report cannot be written
     */
    public static PerformanceReport run(BenchmarkConfig config, PrintStream out)
            throws ValidationException, IOException {
        BenchmarkCoordinator coordinator = new BenchmarkCoordinator(config);
        PerformanceReport report = coordinator.runBenchmark();

        ReportRenderer renderer = config.getReportFormat().createRenderer();
        renderer.render(report, config, out);
        out.flush();
        return report;
    }
}
