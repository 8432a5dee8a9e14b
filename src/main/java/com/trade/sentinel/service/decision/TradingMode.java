package com.trade.sentinel.service.decision;

public enum TradingMode {
    /** Approved actions above the execute threshold run automatically. */
    AUTO,
    /** Never executes; approved actions become recommendations for a human. */
    HYBRID,
    /** Every cycle is rejected before any evaluator runs. */
    NO_TRADE
}
