package com.trade.sentinel.service.health;

import java.time.Instant;

public record ModuleHealth(String moduleName,
                           boolean healthy,
                           int consecutiveFailures,
                           int consecutiveSuccesses,
                           long totalFailures,
                           Instant lastReportAt) {
}
