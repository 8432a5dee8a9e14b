package com.trade.sentinel.service.decision;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * The outbound call to make when a cycle ends in EXECUTE.
 */
@Value
@Builder
public class ExecutionAction {
    /** Breaker name of the dependency the operation talks to. */
    String dependency;
    /** Charged to weighted rate limits. */
    @Builder.Default
    int weight = 1;
    Supplier<?> operation;
    /** When set, a successful result is cached under this key. */
    String cacheKey;
    Duration cacheTtl;
}
