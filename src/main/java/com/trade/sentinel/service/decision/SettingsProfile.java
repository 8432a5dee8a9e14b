package com.trade.sentinel.service.decision;

public enum SettingsProfile {
    NORMAL,
    /** Conservative settings used while the system is in safe mode. */
    FALLBACK
}
