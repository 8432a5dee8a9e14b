package com.trade.sentinel.common.exception;

import com.trade.sentinel.common.Result;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;

public final class Http {
    private Http() {
    }

    public static <T> ResponseEntity<?> from(Result<T> r) {
        if (r == null) return ResponseEntity.internalServerError().body("Result is null");

        if (r.isSuccess()) {
            return ResponseEntity.ok(r.getData());
        }
        String errorCode = r.getErrorCode();
        if (errorCode == null) {
            return ResponseEntity.badRequest().body(new ErrorResponse(null, r.getError(), r.getTimestamp()));
        }
        return ResponseEntity.status(statusOf(errorCode))
                .body(new ErrorResponse(errorCode, r.getError(), r.getTimestamp()));
    }

    static HttpStatus statusOf(String errorCode) {
        return switch (errorCode) {
            case RateLimitExceededException.DEFAULT_ERROR_CODE -> HttpStatus.TOO_MANY_REQUESTS;
            case CircuitOpenException.DEFAULT_ERROR_CODE -> HttpStatus.SERVICE_UNAVAILABLE;
            case ConfigurationException.DEFAULT_ERROR_CODE, "ERR-SYS-001" -> HttpStatus.INTERNAL_SERVER_ERROR;
            case "ERR-NOT-FOUND" -> HttpStatus.NOT_FOUND;
            case "ERR-VAL-001", "ERR-REQ-001", "ERR-REQ-004" -> HttpStatus.BAD_REQUEST;
            default -> HttpStatus.BAD_REQUEST;
        };
    }

    /**
     * Error body returned to clients.
     */
    record ErrorResponse(String code, String message, Instant timestamp) {
    }
}
