package org.puneet.sortbench.algorithm;

import org.puneet.sortbench.baseline.BubbleSort;
import org.puneet.sortbench.baseline.InsertionSort;
import org.puneet.sortbench.baseline.SelectionSort;

import java.util.*;
import java.util.function.Supplier;

/**
 * Registry of the built-in sorting strategies, keyed by the short names used in
 * {@code algorithms.enabled}. Iteration order is the default evaluation order.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-07-15
 */
public final class SortingStrategies {

    public static final String BUBBLE = "bubble";
    public static final String SELECTION = "selection";
    public static final String INSERTION = "insertion";

    private static final Map<String, Supplier<SortingStrategy>> REGISTRY;

    static {
        Map<String, Supplier<SortingStrategy>> registry = new LinkedHashMap<>();
        registry.put(BUBBLE, BubbleSort::new);
        registry.put(SELECTION, SelectionSort::new);
        registry.put(INSERTION, InsertionSort::new);
        REGISTRY = Collections.unmodifiableMap(registry);
    }

    private SortingStrategies() {
        throw new AssertionError("SortingStrategies is a utility class and cannot be instantiated");
    }

    /**
     * Gets the keys of all built-in strategies in evaluation order.
     *
     * @return unmodifiable list of strategy keys
     */
    public static List<String> getKeys() {
        return List.copyOf(REGISTRY.keySet());
    }

    public static boolean isKnown(String key) {
        return key != null && REGISTRY.containsKey(normalize(key));
    }

    /**
     * Creates a strategy by its registry key (case-insensitive).
     *
     * @param key strategy key such as {@code bubble}
     * @return a new strategy instance
     * @throws IllegalArgumentException if the key is unknown
     */
    public static SortingStrategy create(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Strategy key cannot be null");
        }
        Supplier<SortingStrategy> supplier = REGISTRY.get(normalize(key));
        if (supplier == null) {
            throw new IllegalArgumentException(
                "Unknown sorting strategy '" + key + "', expected one of " + REGISTRY.keySet());
        }
        return supplier.get();
    }

    /**
     * Creates the strategies for the given keys, preserving their order.
     *
     * @param keys strategy keys
     * @return strategies in the same order as the keys
     */
    public static List<SortingStrategy> create(List<String> keys) {
        List<SortingStrategy> strategies = new ArrayList<>(keys.size());
        for (String key : keys) {
            strategies.add(create(key));
        }
        return strategies;
    }

    /**
     * Creates every built-in strategy in default evaluation order.
     *
     * @return bubble, selection and insertion sort
     */
    public static List<SortingStrategy> builtIn() {
        return create(getKeys());
    }

    private static String normalize(String key) {
        return key.trim().toLowerCase(Locale.ROOT);
    }
}
