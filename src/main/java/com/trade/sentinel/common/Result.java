package com.trade.sentinel.common;

import com.trade.sentinel.common.exception.BaseSentinelException;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Tagged success/failure value handed from services to the web layer.
 * <p>
 * A wrapped operation may also return a failed {@code Result} instead of throwing; the circuit
 * breaker counts that as a failure of the dependency.
 */
@Getter
@ToString
public final class Result<T> {

    private final boolean success;
    private final T data;
    private final String error;
    private final String errorCode;
    private final Instant timestamp;

    private Result(boolean success, T data, String error, String errorCode) {
        this.success = success;
        this.data = data;
        this.error = error;
        this.errorCode = errorCode;
        this.timestamp = Instant.now();
    }

    // ---------- factories ----------
    public static <T> Result<T> ok(T data) {
        return new Result<>(true, data, null, null);
    }

    public static <T> Result<T> fail(String code, String message) {
        return new Result<>(false, null, message, code);
    }

    /**
     * Failure carrying the error code of a sentinel exception, or no code for anything else.
     */
    public static <T> Result<T> fail(Throwable t) {
        if (t == null) return new Result<>(false, null, "Unknown error", null);
        String msg = t.getMessage() == null ? t.toString() : t.getMessage();
        String code = (t instanceof BaseSentinelException) ? ((BaseSentinelException) t).getErrorCode() : null;
        return new Result<>(false, null, msg, code);
    }

    // ---------- convenience helpers ----------

    public boolean isOk() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    /**
     * Null-safe convenience for extracting error text.
     */
    public static String errorOf(Result<?> r) {
        return (r == null) ? "Result is null" : r.getError();
    }
}
