package org.puneet.sortbench.simulation;

/**
 * Inclusive bounds for generated dataset values.
 *
 * @author Puneet Chandna
 * @since 2025-07-18
 */
public final class ValueRange {

    private final int min;
    private final int max;

    /**
     * Creates a new inclusive range.
     *
     * @param min lower bound, inclusive
     * @param max upper bound, inclusive
     * @throws IllegalArgumentException if min is greater than max
     */
    public ValueRange(int min, int max) {
        if (min > max) {
            throw new IllegalArgumentException(
                "Range lower bound " + min + " is greater than upper bound " + max);
        }
        this.min = min;
        this.max = max;
    }

    public int getMin() {
        return min;
    }

    public int getMax() {
        return max;
    }

    public boolean contains(int value) {
        return value >= min && value <= max;
    }

    /**
     * Number of distinct values in the range. A long because [MIN_VALUE, MAX_VALUE]
     * holds 2^32 values.
     */
    public long span() {
        return (long) max - (long) min + 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValueRange)) return false;
        ValueRange other = (ValueRange) o;
        return min == other.min && max == other.max;
    }

    @Override
    public int hashCode() {
        return 31 * min + max;
    }

    @Override
    public String toString() {
        return "[" + min + ", " + max + "]";
    }
}
