package com.trade.sentinel.core.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Bounded key/value store for memoizing expensive or rate-limited lookups.
 * <p>
 * An expired entry is indistinguishable from a missing one. A {@code null} or non-positive TTL falls
 * back to the store's default TTL.
 */
public interface CacheStore<V> {

    Optional<V> get(String key);

    /**
     * @throws IllegalArgumentException for a null key or value
     */
    void set(String key, V value);

    void set(String key, V value, Duration ttl);

    /**
     * @return true when an entry was removed
     */
    boolean delete(String key);

    /**
     * Returns the cached value or loads, caches and returns a fresh one. A {@code null} load is not cached.
     */
    V getOrCompute(String key, Duration ttl, Supplier<? extends V> loader);

    /**
     * Removes every expired entry.
     *
     * @return number of entries removed
     */
    int cleanupExpired();

    /**
     * Drops every entry and resets the statistics.
     */
    void clear();

    int size();

    CacheStats getStats();
}
