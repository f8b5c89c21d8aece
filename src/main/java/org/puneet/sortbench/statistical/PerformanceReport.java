package org.puneet.sortbench.statistical;

import java.util.*;

/**
 * Comparative report over all evaluated strategies. Exposes the data only;
 * rendering belongs to {@code org.puneet.sortbench.report}.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-07-22
 */
public final class PerformanceReport {

    private final List<RankedResult> results;
    private final RankedResult optimal;

    PerformanceReport(List<RankedResult> results, RankedResult optimal) {
        this.results = List.copyOf(results);
        this.optimal = optimal;
    }

    /**
     * Gets the results in evaluation order.
     *
     * @return unmodifiable list of results
     */
    public List<RankedResult> getResults() {
        return results;
    }

    /**
     * Gets the results ordered by rank (fastest mean first).
     *
     * @return unmodifiable list of results
     */
    public List<RankedResult> getRanking() {
        List<RankedResult> ranking = new ArrayList<>(results);
        ranking.sort(Comparator.comparingInt(RankedResult::getRank));
        return Collections.unmodifiableList(ranking);
    }

    public RankedResult getOptimal() {
        return optimal;
    }

    /**
     * Whether every strategy produced sorted output in every trial.
     */
    public boolean isAllCorrect() {
        return results.stream().allMatch(r -> r.getMetrics().isCorrect());
    }

    public int size() {
        return results.size();
    }

    @Override
    public String toString() {
        return "PerformanceReport[optimal=" + optimal.getMetrics().getStrategyName()
                + ", results=" + results + "]";
    }
}
