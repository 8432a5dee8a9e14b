package com.trade.sentinel.service.decision;

public enum DecisionOutcome {
    EXECUTE,
    RECOMMEND,
    REJECT,
    PAUSED
}
