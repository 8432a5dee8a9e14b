package com.trade.sentinel.core.breaker;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
