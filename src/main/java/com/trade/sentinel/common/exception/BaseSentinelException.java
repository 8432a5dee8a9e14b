package com.trade.sentinel.common.exception;

import lombok.Getter;

/**
 * Base exception for the control plane. Every subclass carries a stable error code that the web
 * layer maps to an HTTP status.
 */
@Getter
public abstract class BaseSentinelException extends RuntimeException {

    private final String errorCode;

    protected BaseSentinelException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    protected BaseSentinelException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = getDefaultErrorCode();
    }

    /**
     * Each subclass must provide a default error code.
     */
    protected abstract String getDefaultErrorCode();
}
