package org.puneet.sortbench.baseline;

/**
 * Insertion sort building a sorted prefix by shifting larger elements right.
 * O(n^2) worst case, close to O(n) on nearly sorted input.
 *
 * @author Puneet Chandna
 * @version 1.0
 * @since 2025-07-18
 */
public class InsertionSort extends ComparisonSortStrategy {

    public static final String NAME = "Insertion Sort";

    public InsertionSort() {
        super(NAME);
    }

    @Override
    protected void sortInPlace(int[] data) {
        for (int i = 1; i < data.length; i++) {
            int key = data[i];
            int j = i - 1;
            while (j >= 0 && outOfOrder(data[j], key)) {
                data[j + 1] = data[j];
                j--;
            }
            data[j + 1] = key;
        }
    }
}
