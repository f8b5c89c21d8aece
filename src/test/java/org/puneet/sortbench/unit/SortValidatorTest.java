package org.puneet.sortbench.unit;

import org.junit.jupiter.api.Test;
import org.puneet.sortbench.util.SortValidator;

import static org.junit.jupiter.api.Assertions.*;

class SortValidatorTest {

    @Test
    void testSortedSequences() {
        assertTrue(SortValidator.isSorted(new int[]{1, 3, 3, 5, 8}));
        assertTrue(SortValidator.isSorted(new int[0]));
        assertTrue(SortValidator.isSorted(new int[]{7}));
        assertTrue(SortValidator.isSorted(new int[]{4, 4, 4}));
    }

    @Test
    void testUnsortedSequence() {
        assertFalse(SortValidator.isSorted(new int[]{1, 3, 2}));
        assertEquals(2, SortValidator.findFirstViolation(new int[]{1, 3, 2}));
        assertEquals(1, SortValidator.findFirstViolation(new int[]{2, 1, 0}));
        assertEquals(-1, SortValidator.findFirstViolation(new int[]{1, 2}));
    }

    @Test
    void testValidatorDoesNotModifyInput() {
        int[] data = {3, 1, 2};
        SortValidator.isSorted(data);
        assertArrayEquals(new int[]{3, 1, 2}, data);
    }

    @Test
    void testPermutationCheck() {
        assertTrue(SortValidator.isPermutation(new int[]{5, 3, 8, 3, 1}, new int[]{1, 3, 3, 5, 8}));
        assertFalse(SortValidator.isPermutation(new int[]{5, 3, 8, 3, 1}, new int[]{1, 3, 5, 5, 8}));
        assertFalse(SortValidator.isPermutation(new int[]{1, 2}, new int[]{1, 2, 3}));
        assertTrue(SortValidator.isPermutation(new int[0], new int[0]));
    }

    @Test
    void testNullRejected() {
        assertThrows(IllegalArgumentException.class, () -> SortValidator.isSorted(null));
        assertThrows(IllegalArgumentException.class, () -> SortValidator.isPermutation(null, new int[0]));
    }
}
