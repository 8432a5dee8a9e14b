package com.trade.sentinel.core.cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * In-memory LRU cache with per-entry TTL.
 * <p>
 * Backed by an access-ordered {@link LinkedHashMap} so both reads and overwrites move an entry to the
 * most-recently-used end. Expired entries are removed lazily on read or by {@link #cleanupExpired()}.
 */
@Slf4j
public final class LruCacheStore<V> implements CacheStore<V> {

    private static final class Entry<V> {
        final V value;
        final long expAtMillis; // 0 = no expiry

        Entry(V value, long expAtMillis) {
            this.value = value;
            this.expAtMillis = expAtMillis;
        }
    }

    private final LinkedHashMap<String, Entry<V>> map = new LinkedHashMap<>(16, 0.75f, true);
    private final int maxSize;
    private final Duration defaultTtl;
    private final Clock clock;

    private long hits;
    private long misses;
    private long evictions;

    public LruCacheStore(int maxSize, Duration defaultTtl, Clock clock) {
        if (maxSize < 1) throw new IllegalArgumentException("maxSize must be >= 1");
        this.maxSize = maxSize;
        this.defaultTtl = defaultTtl;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    private static boolean isExpired(Entry<?> e, long now) {
        return e.expAtMillis > 0 && now >= e.expAtMillis;
    }

    private static boolean usable(Duration ttl) {
        return ttl != null && !ttl.isZero() && !ttl.isNegative();
    }

    private long expiryFor(Duration ttl, long now) {
        Duration effective = usable(ttl) ? ttl : defaultTtl;
        return usable(effective) ? now + effective.toMillis() : 0L;
    }

    @Override
    public synchronized Optional<V> get(String key) {
        Entry<V> e = map.get(key);
        if (e == null) {
            misses++;
            return Optional.empty();
        }
        if (isExpired(e, clock.millis())) {
            map.remove(key);
            misses++;
            return Optional.empty();
        }
        hits++;
        return Optional.of(e.value);
    }

    @Override
    public void set(String key, V value) {
        set(key, value, null);
    }

    @Override
    public synchronized void set(String key, V value, Duration ttl) {
        if (key == null) throw new IllegalArgumentException("key is required");
        if (value == null) throw new IllegalArgumentException("value is required for key " + key);
        long now = clock.millis();
        if (!map.containsKey(key) && map.size() >= maxSize) {
            evictEldest();
        }
        map.put(key, new Entry<>(value, expiryFor(ttl, now)));
    }

    @Override
    public synchronized boolean delete(String key) {
        return map.remove(key) != null;
    }

    @Override
    public V getOrCompute(String key, Duration ttl, Supplier<? extends V> loader) {
        Optional<V> cached = get(key);
        if (cached.isPresent()) return cached.get();
        // loader runs without holding the cache lock
        V fresh = loader.get();
        if (fresh != null) set(key, fresh, ttl);
        return fresh;
    }

    @Override
    public synchronized int cleanupExpired() {
        long now = clock.millis();
        int removed = 0;
        Iterator<Map.Entry<String, Entry<V>>> it = map.entrySet().iterator();
        while (it.hasNext()) {
            if (isExpired(it.next().getValue(), now)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    @Override
    public synchronized void clear() {
        map.clear();
        hits = 0;
        misses = 0;
        evictions = 0;
    }

    @Override
    public synchronized int size() {
        return map.size();
    }

    @Override
    public synchronized CacheStats getStats() {
        long lookups = hits + misses;
        double hitRate = lookups == 0 ? 0d : (double) hits / lookups * 100d;
        double utilization = (double) map.size() / maxSize * 100d;
        return new CacheStats(map.size(), maxSize, hits, misses, evictions, hitRate, utilization);
    }

    private void evictEldest() {
        Iterator<String> it = map.keySet().iterator();
        if (it.hasNext()) {
            String eldest = it.next();
            it.remove();
            evictions++;
            log.debug("Evicted least recently used key {}", eldest);
        }
    }
}
