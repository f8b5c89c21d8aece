package org.puneet.sortbench.unit;

import org.junit.jupiter.api.Test;
import org.puneet.sortbench.App;
import org.puneet.sortbench.exceptions.ValidationException;
import org.puneet.sortbench.statistical.PerformanceReport;
import org.puneet.sortbench.util.BenchmarkConfig;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class AppTest {

    @Test
    void testRunPrintsTextReport() throws ValidationException, IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        BenchmarkConfig config = BenchmarkConfig.builder().datasetSize(50).iterations(2).build();

        PerformanceReport report;
        try (PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
            report = App.run(config, out);
        }

        String text = buffer.toString(StandardCharsets.UTF_8);
        assertEquals(3, report.size());
        assertTrue(text.contains("Optimal Performance Algorithm: " + report.getOptimal().getMetrics().getStrategyName()));
    }

    @Test
    void testRunPrintsCsvReport() throws ValidationException, IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        BenchmarkConfig config = BenchmarkConfig.builder()
                .datasetSize(20).iterations(1).reportFormat("csv").build();

        try (PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
            App.run(config, out);
        }

        String[] lines = buffer.toString(StandardCharsets.UTF_8).trim().split("\\R");
        assertEquals(4, lines.length);
        assertTrue(lines[0].startsWith("Algorithm,DatasetSize,Iterations"));
    }

    @Test
    void testRunRejectsInvalidConfiguration() {
        BenchmarkConfig config = BenchmarkConfig.builder().iterations(0).build();
        assertThrows(ValidationException.class, () -> App.run(config, System.out));
    }
}
