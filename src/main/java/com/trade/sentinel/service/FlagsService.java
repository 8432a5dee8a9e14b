package com.trade.sentinel.service;

import com.trade.sentinel.common.enums.FlagName;
import com.trade.sentinel.config.SentinelProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Holds the ON/OFF state of the operator flags read by the decision gate.
 */
@Slf4j
@Component
public class FlagsService {

    private final EnumMap<FlagName, Boolean> state = new EnumMap<>(FlagName.class);

    public FlagsService(SentinelProperties properties) {
        off(FlagName.PAUSE_DECISIONS);
        put(FlagName.SAFE_MODE_HALT, properties.getDecision().isHaltInSafeMode());
    }

    /**
     * Returns current ON/OFF for a flag.
     */
    public synchronized boolean isOn(FlagName f) {
        final Boolean v = state.get(f);
        return v != null && v;
    }

    public synchronized void set(FlagName f, boolean value) {
        Boolean previous = state.put(f, value);
        if (previous == null || previous != value) {
            log.info("Flag {} -> {}", f, value ? "ON" : "OFF");
        }
    }

    /**
     * Snapshot view for status endpoints.
     */
    public synchronized Map<FlagName, Boolean> snapshot() {
        return new EnumMap<>(state);
    }

    // ---------- helpers ----------
    private void off(FlagName... fs) {
        for (FlagName f : fs) state.put(f, false);
    }

    private void put(FlagName f, boolean val) {
        state.put(f, val);
    }
}
