package org.puneet.sortbench.baseline;

/**
 * Bubble sort with early termination.
 *
 * <p>Algorithm characteristics:
 * <ul>
 *   <li>Time Complexity: O(n^2) worst and average case, O(n) on sorted input</li>
 *   <li>Space Complexity: O(1)</li>
 * </ul>
 * </p>
 *
 * @author Puneet Chandna
 * @version 1.0
 * @since 2025-07-18
 */
public class BubbleSort extends ComparisonSortStrategy {

    public static final String NAME = "Bubble Sort";

    public BubbleSort() {
        super(NAME);
    }

    /**
     * Sweeps the unsorted suffix swapping adjacent out-of-order pairs and stops
     * after the first sweep without a swap.
     */
    @Override
    protected void sortInPlace(int[] data) {
        int length = data.length;

        for (int pass = 0; pass < length - 1; pass++) {
            boolean swapped = false;

            for (int i = 0; i < length - pass - 1; i++) {
                if (outOfOrder(data[i], data[i + 1])) {
                    swap(data, i, i + 1);
                    swapped = true;
                }
            }

            if (!swapped) {
                break;
            }
        }
    }
}
