package com.trade.sentinel.core.ratelimit;

import java.util.List;

public record RateLimiterStatus(List<BucketStatus> buckets,
                                long totalRequests,
                                long totalAdmitted,
                                long totalBlocked,
                                double blockRatePct) {

    public record BucketStatus(String name,
                               long capacity,
                               long windowSeconds,
                               boolean weighted,
                               double available,
                               double utilizationPct) {
    }
}
