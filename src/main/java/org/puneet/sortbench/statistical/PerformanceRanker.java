package org.puneet.sortbench.statistical;

import org.puneet.sortbench.exceptions.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Ranks strategies by mean trial duration and computes each strategy's
 * slowdown relative to the fastest one.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-07-22
 */
public class PerformanceRanker {
    private static final Logger logger = LoggerFactory.getLogger(PerformanceRanker.class);

    /**
     * Builds the comparative report.
     *
     * <p>The optimal strategy is the first one, in evaluation order, with the
     * smallest mean. When that mean is zero, strategies that also measured zero
     * get ratio 1.0 and all others {@link Double#POSITIVE_INFINITY}.</p>
     *
     * @param metrics metrics records in evaluation order
     * @return the report, with results in the same order as the input
     * @throws ValidationException if metrics is null, empty or holds null records
     */
    public PerformanceReport rank(List<PerformanceMetrics> metrics) throws ValidationException {
        if (metrics == null) {
            throw ValidationException.nullValue("metrics");
        }
        if (metrics.isEmpty()) {
            throw ValidationException.emptyCollection("metrics");
        }
        for (PerformanceMetrics m : metrics) {
            if (m == null) {
                throw ValidationException.nullValue("metrics[]");
            }
        }

        int optimalIndex = 0;
        for (int i = 1; i < metrics.size(); i++) {
            if (metrics.get(i).getMeanMillis() < metrics.get(optimalIndex).getMeanMillis()) {
                optimalIndex = i;
            }
        }
        double optimalMean = metrics.get(optimalIndex).getMeanMillis();

        // stable sort keeps evaluation order on equal means
        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < metrics.size(); i++) {
            order.add(i);
        }
        order.sort(Comparator.comparingDouble(i -> metrics.get(i).getMeanMillis()));
        int[] ranks = new int[metrics.size()];
        for (int position = 0; position < order.size(); position++) {
            ranks[order.get(position)] = position + 1;
        }

        List<RankedResult> results = new ArrayList<>(metrics.size());
        RankedResult optimal = null;
        for (int i = 0; i < metrics.size(); i++) {
            PerformanceMetrics m = metrics.get(i);
            boolean isOptimal = i == optimalIndex;
            double ratio = isOptimal ? 1.0 : ratio(m.getMeanMillis(), optimalMean);
            RankedResult result = new RankedResult(m, ranks[i], ratio, isOptimal);
            results.add(result);
            if (isOptimal) {
                optimal = result;
            }
            logger.debug("Ranked {}: rank={}, ratio={}", m.getStrategyName(), ranks[i], ratio);
        }

        logger.info("Optimal algorithm: {} ({} ms mean)",
                optimal.getMetrics().getStrategyName(), String.format(Locale.ROOT, "%.3f", optimalMean));
        return new PerformanceReport(results, optimal);
    }

    private static double ratio(double mean, double optimalMean) {
        if (optimalMean == 0.0) {
            return mean == 0.0 ? 1.0 : Double.POSITIVE_INFINITY;
        }
        return Math.max(1.0, mean / optimalMean);
    }
}
