package org.treekit.ast.pool;

import com.typesafe.config.Config;

/**
 * Admission limits of a {@link NodePool}.
 *
 * @param minPooledInt         Smallest integer value that is pooled.
 * @param maxPooledInt         Largest integer value that is pooled.
 * @param maxStringLength      Longest string literal that is pooled.
 * @param maxStringEntries     Capacity of the string literal cache.
 * @param maxIdentifierLength  Longest identifier that is pooled.
 * @param maxIdentifierEntries Capacity of the identifier cache.
 */
public record NodePoolConfig(
        int minPooledInt,
        int maxPooledInt,
        int maxStringLength,
        int maxStringEntries,
        int maxIdentifierLength,
        int maxIdentifierEntries
) {

    /** The defaults, identical to {@code treekit.pool} in {@code reference.conf}. */
    public static final NodePoolConfig DEFAULT = new NodePoolConfig(-128, 127, 50, 1000, 30, 500);

    public NodePoolConfig {
        if (minPooledInt > maxPooledInt) {
            throw new IllegalArgumentException(
                    "Integer pool range is empty: min " + minPooledInt + " > max " + maxPooledInt);
        }
        requireNonNegative("string max-length", maxStringLength);
        requireNonNegative("string max-entries", maxStringEntries);
        requireNonNegative("identifier max-length", maxIdentifierLength);
        requireNonNegative("identifier max-entries", maxIdentifierEntries);
    }

    /**
     * Reads the {@code treekit.pool} section.
     *
     * @param config A resolved configuration, typically from {@code ConfigLoader.load()}.
     * @return The pool configuration.
     * @throws com.typesafe.config.ConfigException if a key is missing or has the wrong type.
     */
    public static NodePoolConfig fromConfig(Config config) {
        Config pool = config.getConfig("treekit.pool");
        return new NodePoolConfig(
                pool.getInt("integer.min"),
                pool.getInt("integer.max"),
                pool.getInt("string.max-length"),
                pool.getInt("string.max-entries"),
                pool.getInt("identifier.max-length"),
                pool.getInt("identifier.max-entries"));
    }

    /**
     * @param category A pool category.
     * @return The maximum number of entries the category's cache holds.
     */
    public int capacity(PoolCategory category) {
        return switch (category) {
            case INTEGER -> (int) Math.min(Integer.MAX_VALUE, (long) maxPooledInt - minPooledInt + 1);
            case BOOLEAN -> 2;
            case STRING -> maxStringEntries;
            case IDENTIFIER -> maxIdentifierEntries;
        };
    }

    /**
     * @param category A pool category.
     * @param value    A candidate key of that category.
     * @return {@code true} if the value is within the admission limits of the category.
     */
    public boolean admits(PoolCategory category, Object value) {
        return switch (category) {
            case INTEGER -> {
                int v = (Integer) value;
                yield v >= minPooledInt && v <= maxPooledInt;
            }
            case BOOLEAN -> true;
            case STRING -> ((String) value).length() <= maxStringLength;
            case IDENTIFIER -> ((String) value).length() <= maxIdentifierLength;
        };
    }

    private static void requireNonNegative(String name, int value) {
        if (value < 0) {
            throw new IllegalArgumentException("Pool " + name + " must not be negative: " + value);
        }
    }
}
