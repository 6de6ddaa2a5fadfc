package org.treekit.ast.pool;

/**
 * The value categories a {@link NodePool} caches independently.
 */
public enum PoolCategory {
    INTEGER(Integer.class, 96),
    BOOLEAN(Boolean.class, 92),
    STRING(String.class, 120),
    IDENTIFIER(String.class, 110);

    private final Class<?> valueType;
    private final int estimatedBytesPerEntry;

    PoolCategory(Class<?> valueType, int estimatedBytesPerEntry) {
        this.valueType = valueType;
        this.estimatedBytesPerEntry = estimatedBytesPerEntry;
    }

    /**
     * @return The Java type of the cache keys of this category.
     */
    public Class<?> valueType() {
        return valueType;
    }

    /**
     * @return A rough per-entry footprint (node, key and map entry) used by {@link PoolStats#estimatedBytes()}.
     */
    public int estimatedBytesPerEntry() {
        return estimatedBytesPerEntry;
    }
}
