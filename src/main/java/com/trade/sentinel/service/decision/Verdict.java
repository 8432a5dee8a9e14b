package com.trade.sentinel.service.decision;

/**
 * One evaluator's answer. A veto is data, not an exception.
 *
 * @param confidence clamped to 0..1; NaN becomes 0
 */
public record Verdict(String name, boolean approved, String reason, double confidence) {

    public static final String FAILURE_PREFIX = "evaluator failure: ";

    public Verdict {
        if (Double.isNaN(confidence)) confidence = 0d;
        confidence = Math.max(0d, Math.min(1d, confidence));
        if (reason == null) reason = "";
    }

    public static Verdict approve(String name, double confidence, String reason) {
        return new Verdict(name, true, reason, confidence);
    }

    public static Verdict veto(String name, String reason) {
        return new Verdict(name, false, reason, 0d);
    }

    /**
     * Veto standing in for an evaluator that threw, timed out or returned nothing.
     */
    public static Verdict failure(String name) {
        return new Verdict(name, false, FAILURE_PREFIX + name, 0d);
    }

    public boolean isFailure() {
        return !approved && reason.startsWith(FAILURE_PREFIX);
    }
}
