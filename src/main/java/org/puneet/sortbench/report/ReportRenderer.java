package org.puneet.sortbench.report;

import org.puneet.sortbench.statistical.PerformanceReport;
import org.puneet.sortbench.util.BenchmarkConfig;

import java.io.IOException;

/**
 * Renders a {@link PerformanceReport} as human-readable output.
 */
public interface ReportRenderer {

    /**
     * Writes the report to the given sink.
     *
     * @param report the report to render
     * @param config the configuration the report was produced with
     * @param out output sink
     * @throws IOException if writing to the sink fails
     */
    void render(PerformanceReport report, BenchmarkConfig config, Appendable out) throws IOException;
}
