package com.trade.sentinel.core.cache;

public record CacheStats(int size,
                         int maxSize,
                         long hits,
                         long misses,
                         long evictions,
                         double hitRatePct,
                         double utilizationPct) {
}
