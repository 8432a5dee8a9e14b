package com.trade.sentinel.common.exception;

import lombok.Getter;

import java.util.Locale;

/**
 * Thrown when a circuit breaker rejects a call without invoking the dependency.
 */
@Getter
public class CircuitOpenException extends BaseSentinelException {
    public static final String DEFAULT_ERROR_CODE = "ERR-CIRCUIT-001";

    private final String dependencyName;
    private final double retryAfterSeconds;

    public CircuitOpenException(String dependencyName, double retryAfterSeconds) {
        super(String.format(Locale.ROOT, "Circuit '%s' is open, retry after %.3fs", dependencyName, retryAfterSeconds));
        this.dependencyName = dependencyName;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
