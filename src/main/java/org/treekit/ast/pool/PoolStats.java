package org.treekit.ast.pool;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * A snapshot of {@link NodePool} usage.
 *
 * @param hits    Requests served from a cache.
 * @param misses  Requests that constructed a fresh node.
 * @param hitRate Hits as a percentage of all requests, rounded to two decimals; 0 when there were none.
 * @param sizes   Number of cached entries per category.
 */
public record PoolStats(long hits, long misses, double hitRate, Map<PoolCategory, Integer> sizes) {

    public PoolStats {
        sizes = Collections.unmodifiableMap(new EnumMap<>(sizes));
    }

    static PoolStats of(long hits, long misses, Map<PoolCategory, Integer> sizes) {
        long total = hits + misses;
        double rate = total == 0 ? 0.0 : Math.round(hits * 10_000.0 / total) / 100.0;
        return new PoolStats(hits, misses, rate, sizes);
    }

    public int size(PoolCategory category) {
        return sizes.getOrDefault(category, 0);
    }

    public int totalSize() {
        return sizes.values().stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * @return A rough estimate of the memory held by the cached entries.
     */
    public long estimatedBytes() {
        long bytes = 0;
        for (Map.Entry<PoolCategory, Integer> entry : sizes.entrySet()) {
            bytes += (long) entry.getKey().estimatedBytesPerEntry() * entry.getValue();
        }
        return bytes;
    }
}
