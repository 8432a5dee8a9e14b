package com.trade.sentinel.common.exception;

import lombok.Getter;

/**
 * Wraps whatever an evaluator threw, or its timeout. Converted into a veto by the orchestrator and
 * never propagated out of a decision cycle.
 */
@Getter
public class EvaluatorFailureException extends BaseSentinelException {
    public static final String DEFAULT_ERROR_CODE = "ERR-EVAL-001";

    private final String evaluatorName;

    public EvaluatorFailureException(String evaluatorName, String message, Throwable cause) {
        super("Evaluator '" + evaluatorName + "' failed: " + message, cause);
        this.evaluatorName = evaluatorName;
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
