package com.trade.sentinel.jobs;

import com.trade.sentinel.core.cache.CacheStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Sweeps expired cache entries so memory held by entries nobody reads again is released.
 * <p>
 * Configure (optional):
 * trade.sentinel.cache.cleanup-interval-ms=60000
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CacheMaintenanceJob {

    private final CacheStore<Object> cache;

    @Scheduled(
            fixedDelayString = "${trade.sentinel.cache.cleanup-interval-ms:60000}",
            initialDelayString = "${trade.sentinel.cache.cleanup-interval-ms:60000}"
    )
    public void sweepExpired() {
        long t0 = System.currentTimeMillis();
        try {
            int removed = cache.cleanupExpired();
            if (removed > 0) {
                log.info("Cache sweep removed {} expired entries ({} ms)", removed, System.currentTimeMillis() - t0);
            } else {
                log.debug("Cache sweep found nothing expired");
            }
        } catch (RuntimeException e) {
            log.warn("Cache sweep error: {}", e.getMessage(), e);
        }
    }
}
