package org.puneet.sortbench.unit;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.puneet.sortbench.exceptions.ValidationException;
import org.puneet.sortbench.report.CsvReportRenderer;
import org.puneet.sortbench.report.ReportFormat;
import org.puneet.sortbench.report.TextReportRenderer;
import org.puneet.sortbench.statistical.PerformanceMetrics;
import org.puneet.sortbench.statistical.PerformanceRanker;
import org.puneet.sortbench.statistical.PerformanceReport;
import org.puneet.sortbench.statistical.TrialStatistics;
import org.puneet.sortbench.util.BenchmarkConfig;

import java.io.IOException;
import java.io.StringReader;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReportRendererTest {

    private PerformanceReport report;
    private BenchmarkConfig config;

    @BeforeEach
    void setUp() throws ValidationException {
        config = BenchmarkConfig.builder().datasetSize(1000).iterations(2).build();
        report = new PerformanceRanker().rank(List.of(
                new PerformanceMetrics("Bubble Sort", TrialStatistics.of(new double[]{3.0, 5.0}), true, 1000),
                new PerformanceMetrics("Insertion Sort", TrialStatistics.of(new double[]{1.0, 1.0}), false, 1000)));
    }

    @Test
    void testTextReport() throws IOException {
        StringBuilder out = new StringBuilder();
        new TextReportRenderer().render(report, config, out);
        String text = out.toString();

        assertTrue(text.contains("Algorithm: Bubble Sort"));
        assertTrue(text.contains("Average Execution Time: 4.000 ms"));
        assertTrue(text.contains("Minimum Execution Time: 3.000 ms"));
        assertTrue(text.contains("Maximum Execution Time: 5.000 ms"));
        assertTrue(text.contains("Correctness Validation: PASSED"));
        assertTrue(text.contains("Correctness Validation: FAILED"));
        assertTrue(text.contains("Optimal Performance Algorithm: Insertion Sort"));
        assertTrue(text.contains("- Bubble Sort: 4.00x slower than optimal"));
        assertTrue(text.contains("- Insertion Sort: 1.00x slower than optimal"));
        assertTrue(text.indexOf("Algorithm: Bubble Sort") < text.indexOf("Algorithm: Insertion Sort"));
    }

    @Test
    void testCsvReport() throws IOException {
        StringBuilder out = new StringBuilder();
        new CsvReportRenderer().render(report, config, out);

        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).build();
        try (CSVParser parser = CSVParser.parse(new StringReader(out.toString()), format)) {
            List<CSVRecord> records = parser.getRecords();
            assertEquals(2, records.size());

            CSVRecord bubble = records.get(0);
            assertEquals("Bubble Sort", bubble.get("Algorithm"));
            assertEquals("4.000", bubble.get("MeanMs"));
            assertEquals("2", bubble.get("Rank"));
            assertEquals("4.00", bubble.get("Ratio"));
            assertEquals("false", bubble.get("Optimal"));

            CSVRecord insertion = records.get(1);
            assertEquals("false", insertion.get("Correct"));
            assertEquals("true", insertion.get("Optimal"));
            assertEquals("1000", insertion.get("DatasetSize"));
        }
    }

    @Test
    void testZeroOptimalMeanRendersUndefinedRatio() throws ValidationException, IOException {
        PerformanceReport zeroOptimal = new PerformanceRanker().rank(List.of(
                new PerformanceMetrics("Bubble Sort", TrialStatistics.of(new double[]{0.5, 1.5}), true, 0),
                new PerformanceMetrics("Insertion Sort", TrialStatistics.of(new double[]{0.0, 0.0}), true, 0)));

        StringBuilder text = new StringBuilder();
        new TextReportRenderer().render(zeroOptimal, config, text);
        assertTrue(text.toString().contains("- Bubble Sort: n/a (optimal measured 0 ms)"));
        assertTrue(text.toString().contains("- Insertion Sort: 1.00x slower than optimal"));
        assertFalse(text.toString().contains("Infinity"));

        StringBuilder csv = new StringBuilder();
        new CsvReportRenderer().render(zeroOptimal, config, csv);
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).build();
        try (CSVParser parser = CSVParser.parse(new StringReader(csv.toString()), format)) {
            List<CSVRecord> records = parser.getRecords();
            assertEquals("n/a", records.get(0).get("Ratio"));
            assertEquals("1.00", records.get(1).get("Ratio"));
        }
    }

    @Test
    void testFormatParsing() {
        assertEquals(ReportFormat.CSV, ReportFormat.parse(" CSV "));
        assertInstanceOf(TextReportRenderer.class, ReportFormat.TEXT.createRenderer());
        assertInstanceOf(CsvReportRenderer.class, ReportFormat.CSV.createRenderer());
        assertThrows(IllegalArgumentException.class, () -> ReportFormat.parse("html"));
        assertThrows(IllegalArgumentException.class, () -> ReportFormat.parse(""));
    }
}
