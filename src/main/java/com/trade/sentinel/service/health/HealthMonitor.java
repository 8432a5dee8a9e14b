package com.trade.sentinel.service.health;

import com.trade.sentinel.config.SentinelProperties;
import com.trade.sentinel.service.decision.DecisionSettings;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Tracks pass/fail reports per module and derives a 0..100 system health score.
 * <p>
 * A module turns unhealthy after {@code failureThreshold} consecutive failed reports and recovers on
 * its own after {@code recoveryThreshold} consecutive healthy ones. Safe mode is active whenever the
 * score is below {@code minHealthForNormalMode}.
 */
@Slf4j
public class HealthMonitor {

    private static final class Tracker {
        boolean healthy = true;
        int consecutiveFailures;
        int consecutiveSuccesses;
        long totalFailures;
        Instant lastReportAt;
    }

    private final Map<String, Tracker> modules = new TreeMap<>();
    private final SentinelProperties.Health settings;
    private final DecisionSettings fallback;
    private final Clock clock;
    private boolean safeModeLogged;

    public HealthMonitor(SentinelProperties.Health settings, Clock clock) {
        this.settings = settings == null ? new SentinelProperties.Health() : settings;
        this.fallback = this.settings.getFallback().toSettings();
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public synchronized void reportModuleResult(String module, boolean healthy) {
        Tracker t = modules.computeIfAbsent(module, m -> new Tracker());
        t.lastReportAt = clock.instant();
        if (healthy) {
            t.consecutiveFailures = 0;
            t.consecutiveSuccesses++;
            if (!t.healthy && t.consecutiveSuccesses >= settings.getRecoveryThreshold()) {
                t.healthy = true;
                log.info("Module '{}' recovered", module);
            }
        } else {
            t.consecutiveSuccesses = 0;
            t.consecutiveFailures++;
            t.totalFailures++;
            if (t.healthy && t.consecutiveFailures >= settings.getFailureThreshold()) {
                t.healthy = false;
                log.warn("Module '{}' marked unhealthy after {} consecutive failures", module, t.consecutiveFailures);
            }
        }
        logSafeModeTransition();
    }

    /**
     * Percentage of healthy modules; 100 when nothing has reported yet.
     */
    public synchronized double systemHealth() {
        if (modules.isEmpty()) return 100.0;
        long healthy = modules.values().stream().filter(t -> t.healthy).count();
        return healthy * 100.0 / modules.size();
    }

    public synchronized boolean shouldActivateSafeMode() {
        return systemHealth() < settings.getMinHealthForNormalMode();
    }

    /**
     * Conservative settings for cycles that run while safe mode is active.
     */
    public DecisionSettings fallbackSettings() {
        return fallback;
    }

    public synchronized HealthStatus getStatus() {
        List<ModuleHealth> views = new ArrayList<>(modules.size());
        List<String> unhealthy = new ArrayList<>();
        for (Map.Entry<String, Tracker> e : modules.entrySet()) {
            Tracker t = e.getValue();
            views.add(new ModuleHealth(e.getKey(), t.healthy, t.consecutiveFailures, t.consecutiveSuccesses,
                    t.totalFailures, t.lastReportAt));
            if (!t.healthy) unhealthy.add(e.getKey());
        }
        double health = systemHealth();
        return HealthStatus.builder()
                .systemHealth(health)
                .safeMode(health < settings.getMinHealthForNormalMode())
                .totalModules(modules.size())
                .healthyModules(modules.size() - unhealthy.size())
                .unhealthyModules(unhealthy)
                .modules(views)
                .recommendation(health > settings.getContinueNormalAbove()
                        ? HealthStatus.Recommendation.CONTINUE_NORMAL
                        : HealthStatus.Recommendation.SWITCH_TO_SAFE_MODE)
                .build();
    }

    /**
     * Forgets every module.
     */
    public synchronized void reset() {
        modules.clear();
        logSafeModeTransition();
        log.info("Health monitor reset");
    }

    private void logSafeModeTransition() {
        boolean safeMode = shouldActivateSafeMode();
        if (safeMode == safeModeLogged) return;
        safeModeLogged = safeMode;
        if (safeMode) {
            log.warn("Safe mode ACTIVATED: system health {}%", String.format("%.1f", systemHealth()));
        } else {
            log.info("Safe mode cleared: system health {}%", String.format("%.1f", systemHealth()));
        }
    }
}
