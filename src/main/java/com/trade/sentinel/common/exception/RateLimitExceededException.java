package com.trade.sentinel.common.exception;

import lombok.Getter;

import java.util.Locale;

/**
 * Thrown when a blocking acquire could not obtain capacity before its deadline.
 * Recoverable: the caller may retry after {@link #getRetryAfterSeconds()}.
 */
@Getter
public class RateLimitExceededException extends BaseSentinelException {
    public static final String DEFAULT_ERROR_CODE = "ERR-RATE-001";

    private final double retryAfterSeconds;
    private final String limitName;

    public RateLimitExceededException(String limitName, double retryAfterSeconds) {
        super(String.format(Locale.ROOT, "Rate limit '%s' exceeded, retry after %.3fs", limitName, retryAfterSeconds));
        this.limitName = limitName;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public RateLimitExceededException(String limitName, double retryAfterSeconds, Throwable cause) {
        super(String.format(Locale.ROOT, "Rate limit '%s' exceeded, retry after %.3fs", limitName, retryAfterSeconds), cause);
        this.limitName = limitName;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
