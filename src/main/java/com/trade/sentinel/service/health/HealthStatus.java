package com.trade.sentinel.service.health;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class HealthStatus {
    double systemHealth;
    boolean safeMode;
    int totalModules;
    int healthyModules;
    List<String> unhealthyModules;
    List<ModuleHealth> modules;
    Recommendation recommendation;

    public enum Recommendation {
        CONTINUE_NORMAL,
        SWITCH_TO_SAFE_MODE
    }
}
