package org.puneet.sortbench.algorithm;

/**
 * An in-place sorting routine driven by the benchmark harness.
 *
 * <p>Implementations must leave the array in non-decreasing order as a
 * permutation of its original contents, and must not keep any state between
 * invocations so the same instance can be reused across trials.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-07-15
 */
public interface SortingStrategy {

    /**
     * Gets the display name used in metrics records and reports.
     *
     * @return strategy name, never null
     */
    String getName();

    /**
     * Sorts the given array in place into non-decreasing order.
     *
     * @param data the array to sort
     * @throws IllegalArgumentException if data is null
     */
    void sort(int[] data);
}
