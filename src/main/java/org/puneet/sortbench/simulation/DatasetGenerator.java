package org.puneet.sortbench.simulation;

import org.puneet.sortbench.exceptions.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.util.Objects;
import java.util.Random;

/**
 * Generates datasets of uniformly distributed integers for sorting trials.
 *
 * <p>Without an explicit random source the generator seeds itself once from
 * {@link SecureRandom}, so consecutive runs see different data.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-07-18
 */
public class DatasetGenerator {
    private static final Logger logger = LoggerFactory.getLogger(DatasetGenerator.class);

    private final ValueRange range;
    private final Random random;

    /**
     * Creates a generator seeded from a non-deterministic entropy source.
     *
     * @param range inclusive value range
     */
    public DatasetGenerator(ValueRange range) {
        this(range, new Random(new SecureRandom().nextLong()));
    }

    /**
     * Creates a generator drawing from the given random source.
     *
     * @param range inclusive value range
     * @param random random source, e.g. a seeded {@link Random} for reproducible data
     */
    public DatasetGenerator(ValueRange range, Random random) {
        this.range = Objects.requireNonNull(range, "Value range cannot be null");
        this.random = Objects.requireNonNull(random, "Random source cannot be null");
        logger.debug("DatasetGenerator initialized with range {}", range);
    }

    /**
     * Generates a fresh dataset.
     *
     * @param size number of elements
     * @return array of exactly {@code size} values within the range
     * @throws ValidationException if size is negative
     */
    public int[] generate(int size) throws ValidationException {
        if (size < 0) {
            throw ValidationException.invalidSize("datasetSize", size, 0, "MIN");
        }

        int[] data = new int[size];
        long span = range.span();
        for (int i = 0; i < size; i++) {
            data[i] = nextValue(span);
        }
        return data;
    }

    private int nextValue(long span) {
        if (span <= Integer.MAX_VALUE) {
            return range.getMin() + random.nextInt((int) span);
        }
        // Span exceeds int: reject draws outside the range to stay uniform
        while (true) {
            int candidate = random.nextInt();
            if (range.contains(candidate)) {
                return candidate;
            }
        }
    }

    public ValueRange getRange() {
        return range;
    }
}
