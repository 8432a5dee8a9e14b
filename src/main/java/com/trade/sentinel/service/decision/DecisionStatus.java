package com.trade.sentinel.service.decision;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class DecisionStatus {
    TradingMode mode;
    boolean paused;
    boolean safeMode;
    double systemHealth;
    long totalDecisions;
    Map<DecisionOutcome, Long> outcomes;
    long totalVetoes;
    long evaluatorFailures;
    long executionFailures;
    /** -1 until the first decision. */
    long latencyP95Ms;
    int activeActions;
    List<String> evaluators;
}
