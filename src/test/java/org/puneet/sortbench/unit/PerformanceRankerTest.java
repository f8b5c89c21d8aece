package org.puneet.sortbench.unit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.puneet.sortbench.exceptions.ValidationException;
import org.puneet.sortbench.statistical.PerformanceMetrics;
import org.puneet.sortbench.statistical.PerformanceRanker;
import org.puneet.sortbench.statistical.PerformanceReport;
import org.puneet.sortbench.statistical.RankedResult;
import org.puneet.sortbench.statistical.TrialStatistics;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PerformanceRankerTest {

    private PerformanceRanker ranker;

    @BeforeEach
    void setUp() {
        ranker = new PerformanceRanker();
    }

    private static PerformanceMetrics metrics(String name, double... durations) {
        return new PerformanceMetrics(name, TrialStatistics.of(durations), true, 1000);
    }

    @Test
    void testOptimalHasRatioOneAndOthersAtLeastOne() throws ValidationException {
        List<PerformanceMetrics> input = List.of(
                metrics("Bubble Sort", 4.0, 6.0),
                metrics("Selection Sort", 1.5, 2.5),
                metrics("Insertion Sort", 0.5, 1.5));

        PerformanceReport report = ranker.rank(input);

        RankedResult optimal = report.getOptimal();
        assertEquals("Insertion Sort", optimal.getMetrics().getStrategyName());
        assertTrue(optimal.isOptimal());
        assertEquals(1.0, optimal.getRatio(), 1e-12);
        for (RankedResult result : report.getResults()) {
            assertTrue(result.getRatio() >= 1.0);
            assertTrue(optimal.getMetrics().getMeanMillis() <= result.getMetrics().getMeanMillis());
        }
        assertEquals(5.0, report.getResults().get(0).getRatio(), 1e-12);
        assertEquals(2.0, report.getResults().get(1).getRatio(), 1e-12);
    }

    @Test
    void testResultsKeepEvaluationOrderAndRankingSortsByMean() throws ValidationException {
        PerformanceReport report = ranker.rank(List.of(
                metrics("A", 3.0), metrics("B", 1.0), metrics("C", 2.0)));

        assertEquals(List.of("A", "B", "C"), names(report.getResults()));
        assertEquals(List.of("B", "C", "A"), names(report.getRanking()));
        assertEquals(3, report.getResults().get(0).getRank());
        assertEquals(1, report.getResults().get(1).getRank());
        assertEquals(2, report.getResults().get(2).getRank());
    }

    @Test
    void testTieBreakPrefersEvaluationOrder() throws ValidationException {
        PerformanceReport report = ranker.rank(List.of(
                metrics("First", 2.0), metrics("Second", 1.0), metrics("Third", 1.0)));

        assertEquals("Second", report.getOptimal().getMetrics().getStrategyName());
        assertEquals(1, report.getResults().get(1).getRank());
        assertEquals(2, report.getResults().get(2).getRank());
        assertFalse(report.getResults().get(2).isOptimal());
        assertEquals(1.0, report.getResults().get(2).getRatio(), 1e-12);
    }

    @Test
    void testSingleRecord() throws ValidationException {
        PerformanceReport report = ranker.rank(List.of(metrics("Only", 7.0)));
        assertEquals(1, report.size());
        assertEquals(1.0, report.getOptimal().getRatio());
    }

    @Test
    void testZeroOptimalMean() throws ValidationException {
        PerformanceReport report = ranker.rank(List.of(
                metrics("Zero", 0.0), metrics("AlsoZero", 0.0), metrics("Slow", 1.0)));

        assertEquals(1.0, report.getResults().get(0).getRatio());
        assertEquals(1.0, report.getResults().get(1).getRatio());
        assertEquals(Double.POSITIVE_INFINITY, report.getResults().get(2).getRatio());
    }

    @Test
    void testCorrectnessIsCarried() throws ValidationException {
        PerformanceMetrics broken = new PerformanceMetrics("Broken", TrialStatistics.of(new double[]{1.0}), false, 10);
        PerformanceReport report = ranker.rank(List.of(metrics("Fine", 2.0), broken));
        assertFalse(report.isAllCorrect());
        assertFalse(report.getResults().get(1).getMetrics().isCorrect());
    }

    @Test
    void testEmptyCollectionRejected() {
        ValidationException ex = assertThrows(ValidationException.class, () -> ranker.rank(new ArrayList<>()));
        assertEquals(ValidationException.ValidationType.CONFIGURATION_VALIDATION, ex.getValidationType());
        assertThrows(ValidationException.class, () -> ranker.rank(null));
        assertThrows(ValidationException.class, () -> ranker.rank(Arrays.asList(metrics("A", 1.0), null)));
    }

    @Test
    void testReportIsImmutable() throws ValidationException {
        PerformanceReport report = ranker.rank(List.of(metrics("A", 1.0)));
        assertThrows(UnsupportedOperationException.class, () -> report.getResults().clear());
        assertThrows(UnsupportedOperationException.class, () -> report.getRanking().clear());
    }

    private static List<String> names(List<RankedResult> results) {
        List<String> names = new ArrayList<>();
        for (RankedResult result : results) {
            names.add(result.getMetrics().getStrategyName());
        }
        return names;
    }
}
