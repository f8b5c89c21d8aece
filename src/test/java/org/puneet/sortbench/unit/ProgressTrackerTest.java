package org.puneet.sortbench.unit;

import org.junit.jupiter.api.Test;
import org.puneet.sortbench.util.ProgressTracker;

import static org.junit.jupiter.api.Assertions.*;

class ProgressTrackerTest {

    @Test
    void testReportProgressAndSummary() {
        ProgressTracker tracker = new ProgressTracker(10);
        tracker.initializeRun("run", 4);
        tracker.startStrategy("Bubble Sort", 2, 100);
        assertEquals("Bubble Sort", tracker.getCurrentStrategy());
        assertDoesNotThrow(() -> tracker.reportProgress("Bubble Sort", 1, 2));
        assertDoesNotThrow(() -> tracker.reportProgress("Bubble Sort", 2, 2));
        tracker.completeStrategy("Bubble Sort");

        assertEquals(2, tracker.getCompletedTrials());
        assertEquals(50.0, tracker.getOverallProgress(), 1e-9);
        String summary = tracker.getSummaryReport();
        assertTrue(summary.contains("2/4"));
        tracker.logCompletion();
    }

    @Test
    void testProgressBar() {
        ProgressTracker tracker = new ProgressTracker(20);
        String bar = tracker.createProgressBar(50.0);
        assertTrue(bar.startsWith("[" + "█".repeat(10) + "░".repeat(10) + "]"));
        assertTrue(bar.endsWith("50.0%"));

        assertTrue(tracker.createProgressBar(150.0).endsWith("100.0%"));
        assertTrue(tracker.createProgressBar(-5.0).contains("░".repeat(20)));
    }

    @Test
    void testOverallProgressWithoutRun() {
        ProgressTracker tracker = new ProgressTracker();
        assertEquals(0.0, tracker.getOverallProgress());
        assertEquals(50, tracker.getBarWidth());
    }

    @Test
    void testInvalidWidth() {
        assertThrows(IllegalArgumentException.class, () -> new ProgressTracker(0));
    }
}
