package com.trade.sentinel.service.decision;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable snapshot handed to every evaluator of one cycle. The orchestrator fills in the mode,
 * the settings and the health score before evaluation.
 */
@Value
@Builder(toBuilder = true)
public class DecisionContext {
    String subject;
    @Singular
    Map<String, Object> attributes;
    Instant asOf;
    TradingMode mode;
    DecisionSettings settings;
    double systemHealth;

    public Object attribute(String key) {
        return attributes.get(key);
    }
}
