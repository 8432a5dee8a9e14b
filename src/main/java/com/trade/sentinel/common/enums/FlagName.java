package com.trade.sentinel.common.enums;

public enum FlagName {
    /** Operator pause: every cycle ends PAUSED before evaluation. */
    PAUSE_DECISIONS,
    /** While safe mode is active, pause instead of deciding under fallback settings. */
    SAFE_MODE_HALT
}
