package com.trade.sentinel.service.decision;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * The single explainable answer of one decision cycle.
 * <p>
 * Immutable. When execution fails after an EXECUTE, a new decision is built from this one with the
 * outcome replaced and {@code supersededOutcome} set; the verdicts are carried over untouched.
 */
@Value
@Builder(toBuilder = true)
public class FinalDecision {
    String id;
    DecisionOutcome outcome;
    TradingMode mode;
    SettingsProfile settingsProfile;
    int vetoCount;
    @Singular
    List<String> vetoReasons;
    @Singular
    List<String> reasons;
    /** In evaluator order. */
    @Singular
    Map<String, Verdict> verdicts;
    double confidence;
    double systemHealth;
    double positionSizeFraction;
    DecisionOutcome supersededOutcome;
    String executionError;
    @JsonIgnore
    Object executionResult;
    Instant timestamp;

    public boolean isVetoed() {
        return vetoCount > 0;
    }

    public boolean isSuperseded() {
        return supersededOutcome != null;
    }
}
