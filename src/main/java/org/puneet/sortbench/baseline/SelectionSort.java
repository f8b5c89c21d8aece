package org.puneet.sortbench.baseline;

/**
 * Selection sort. Always performs n(n-1)/2 comparisons, at most n-1 swaps.
 *
 * @author Puneet Chandna
 * @version 1.0
 * @since 2025-07-18
 */
public class SelectionSort extends ComparisonSortStrategy {

    public static final String NAME = "Selection Sort";

    public SelectionSort() {
        super(NAME);
    }

    @Override
    protected void sortInPlace(int[] data) {
        int length = data.length;

        for (int boundary = 0; boundary < length - 1; boundary++) {
            int minIndex = boundary;

            for (int i = boundary + 1; i < length; i++) {
                if (outOfOrder(data[minIndex], data[i])) {
                    minIndex = i;
                }
            }

            if (minIndex != boundary) {
                swap(data, boundary, minIndex);
            }
        }
    }
}
