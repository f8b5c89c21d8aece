package org.puneet.sortbench.baseline;

import org.puneet.sortbench.algorithm.SortingStrategy;

/**
 * Abstract base class for the quadratic comparison sorts.
 * Handles argument checks and trivially sorted inputs so subclasses only
 * implement the sorting pass itself.
 *
 * @author Puneet Chandna
 * @since 2025-07-15
 */
public abstract class ComparisonSortStrategy implements SortingStrategy {

    private final String name;

    protected ComparisonSortStrategy(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public final void sort(int[] data) {
        if (data == null) {
            throw new IllegalArgumentException("Data to sort cannot be null");
        }
        if (data.length < 2) {
            return;
        }
        sortInPlace(data);
    }

    /**
     * Sorts an array holding at least two elements.
     *
     * @param data the array to sort, never null
     */
    protected abstract void sortInPlace(int[] data);

    /**
     * The single element comparison every sort goes through.
     *
     * @return true if {@code left} must come after {@code right}
     */
    protected boolean outOfOrder(int left, int right) {
        return left > right;
    }

    protected static void swap(int[] data, int i, int j) {
        int temp = data[i];
        data[i] = data[j];
        data[j] = temp;
    }

    @Override
    public String toString() {
        return name;
    }
}
