package org.puneet.sortbench.util;

import java.util.Arrays;

/**
 * Validates sort output. The harness only relies on {@link #isSorted(int[])};
 * the other checks support diagnostics and tests.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-07-20
 */
public final class SortValidator {

    private SortValidator() {
        throw new AssertionError("SortValidator is a utility class and cannot be instantiated");
    }

    /**
     * Checks that the array is in non-decreasing order.
     *
     * @param data the array to check
     * @return true if no element is strictly smaller than its predecessor
     * @throws IllegalArgumentException if data is null
     */
    public static boolean isSorted(int[] data) {
        return findFirstViolation(data) < 0;
    }

    /**
     * Finds the first element that is strictly smaller than its predecessor.
     *
     * @param data the array to check
     * @return index of the offending element, or -1 if the array is sorted
     * @throws IllegalArgumentException if data is null
     */
    public static int findFirstViolation(int[] data) {
        if (data == null) {
            throw new IllegalArgumentException("Data to validate cannot be null");
        }
        for (int i = 1; i < data.length; i++) {
            if (data[i] < data[i - 1]) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Checks that both arrays hold the same multiset of values.
     *
     * @param original the input before sorting
     * @param candidate the output after sorting
     * @return true if candidate is a permutation of original
     */
    public static boolean isPermutation(int[] original, int[] candidate) {
        if (original == null || candidate == null) {
            throw new IllegalArgumentException("Arrays to compare cannot be null");
        }
        if (original.length != candidate.length) {
            return false;
        }
        int[] left = Arrays.copyOf(original, original.length);
        int[] right = Arrays.copyOf(candidate, candidate.length);
        Arrays.sort(left);
        Arrays.sort(right);
        return Arrays.equals(left, right);
    }
}
