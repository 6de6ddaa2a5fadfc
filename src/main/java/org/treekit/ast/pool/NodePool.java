package org.treekit.ast.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treekit.ast.config.ConfigLoader;
import org.treekit.ast.core.Node;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Deduplicates small immutable leaf nodes.
 * <p>
 * The pool keeps one cache per {@link PoolCategory}. Each cache maps a value to the single shared
 * node for it and is guarded by its own lock, held only for one {@link #getOrCreate} or
 * {@link #clear()} call; locks are never nested. Admission is governed by {@link NodePoolConfig}:
 * values outside the configured bounds, and new values arriving after a cache has reached its
 * capacity, are constructed fresh and never cached. There is no eviction.
 * <p>
 * Pools are ordinary objects so tests can work with isolated instances. {@link #global()} is the
 * process-wide pool used by the convenience factories of pooled kinds.
 */
public class NodePool {

    private static final Logger LOG = LoggerFactory.getLogger(NodePool.class);

    private final NodePoolConfig config;
    private final Map<PoolCategory, CategoryCache> caches = new EnumMap<>(PoolCategory.class);
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    /**
     * Creates a pool with the default limits.
     */
    public NodePool() {
        this(NodePoolConfig.DEFAULT);
    }

    /**
     * Creates a pool with the given limits.
     * @param config The admission limits.
     */
    public NodePool(NodePoolConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        for (PoolCategory category : PoolCategory.values()) {
            caches.put(category, new CategoryCache(category));
        }
        LOG.debug("Created node pool with {}", config);
    }

    /**
     * Returns the process-wide pool, configured from {@code treekit.pool} on first use.
     * @return The global pool.
     */
    public static NodePool global() {
        return GlobalHolder.INSTANCE;
    }

    /**
     * Returns the shared node for {@code value}, creating it through {@code factory} on a miss.
     * <p>
     * A hit requires a cached node of the requested {@code kind}. If the cached node for the value
     * belongs to another kind, a fresh node is returned and the request counts as a miss.
     *
     * @param category The cache to consult.
     * @param value    The key; must be of the category's value type.
     * @param kind     The concrete node kind the caller expects.
     * @param factory  Creates a new node for {@code value}; must not recurse into this pool.
     * @return The shared node, or a fresh one if the value is not admitted.
     * @throws IllegalArgumentException if {@code value} does not match the category's value type.
     */
    public <N extends Node> N getOrCreate(PoolCategory category, Object value, Class<N> kind,
                                          Supplier<? extends N> factory) {
        Objects.requireNonNull(value, "value");
        if (!category.valueType().isInstance(value)) {
            throw new IllegalArgumentException(String.format("Pool category %s expects %s values but got %s",
                    category, category.valueType().getSimpleName(), value.getClass().getSimpleName()));
        }
        if (!config.admits(category, value)) {
            misses.incrementAndGet();
            return factory.get();
        }
        return caches.get(category).getOrCreate(value, kind, factory);
    }

    /**
     * @return A snapshot of hit/miss counters and cache sizes.
     */
    public PoolStats stats() {
        Map<PoolCategory, Integer> sizes = new EnumMap<>(PoolCategory.class);
        for (CategoryCache cache : caches.values()) {
            sizes.put(cache.category, cache.size());
        }
        return PoolStats.of(hits.get(), misses.get(), sizes);
    }

    /**
     * @param category A pool category.
     * @return The number of entries currently cached for it.
     */
    public int size(PoolCategory category) {
        return caches.get(category).size();
    }

    /**
     * Empties every cache and resets the counters. Nodes handed out earlier stay valid; they are
     * just no longer shared with future requests.
     */
    public void clear() {
        for (CategoryCache cache : caches.values()) {
            cache.clear();
        }
        hits.set(0);
        misses.set(0);
        LOG.debug("Cleared node pool");
    }

    public NodePoolConfig config() {
        return config;
    }

    private final class CategoryCache {
        private final PoolCategory category;
        private final int capacity;
        private final Object lock = new Object();
        private final Map<Object, Node> entries = new HashMap<>();
        private boolean saturationLogged;

        private CategoryCache(PoolCategory category) {
            this.category = category;
            this.capacity = config.capacity(category);
        }

        <N extends Node> N getOrCreate(Object value, Class<N> kind, Supplier<? extends N> factory) {
            synchronized (lock) {
                Node cached = entries.get(value);
                if (cached != null) {
                    if (kind.isInstance(cached)) {
                        hits.incrementAndGet();
                        return kind.cast(cached);
                    }
                    misses.incrementAndGet();
                    return factory.get();
                }
                N created = factory.get();
                if (entries.size() < capacity) {
                    entries.put(value, created);
                } else if (!saturationLogged) {
                    saturationLogged = true;
                    LOG.debug("{} pool reached its capacity of {} entries; further values are not cached",
                            category, capacity);
                }
                misses.incrementAndGet();
                return created;
            }
        }

        int size() {
            synchronized (lock) {
                return entries.size();
            }
        }

        void clear() {
            synchronized (lock) {
                entries.clear();
                saturationLogged = false;
            }
        }
    }

    private static final class GlobalHolder {
        private static final NodePool INSTANCE = new NodePool(NodePoolConfig.fromConfig(ConfigLoader.load()));
    }
}
