package com.trade.sentinel.service;

import com.trade.sentinel.common.Result;
import com.trade.sentinel.common.enums.FlagName;
import com.trade.sentinel.core.breaker.CircuitBreakerRegistry;
import com.trade.sentinel.core.breaker.CircuitBreakerStatus;
import com.trade.sentinel.core.cache.CacheStore;
import com.trade.sentinel.core.ratelimit.RateLimiter;
import com.trade.sentinel.service.decision.DecisionJournal;
import com.trade.sentinel.service.decision.DecisionOrchestrator;
import com.trade.sentinel.service.decision.DecisionStatus;
import com.trade.sentinel.service.decision.FinalDecision;
import com.trade.sentinel.service.decision.TradingMode;
import com.trade.sentinel.service.health.HealthMonitor;
import com.trade.sentinel.service.health.HealthStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Read-only snapshots of the control plane plus the few operator actions it allows.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ControlPlaneService {

    static final int MAX_PAGE = 500;

    private final DecisionOrchestrator orchestrator;
    private final DecisionJournal journal;
    private final HealthMonitor health;
    private final CircuitBreakerRegistry breakers;
    private final RateLimiter rateLimiter;
    private final CacheStore<Object> cache;
    private final FlagsService flags;
    private final Clock clock;

    public Result<ControlPlaneStatus> getStatus() {
        return Result.ok(ControlPlaneStatus.builder()
                .asOf(clock.instant())
                .decision(orchestrator.getStatus())
                .health(health.getStatus())
                .breakers(breakers.getAllStatus())
                .rateLimiter(rateLimiter.getStatus())
                .cache(cache.getStats())
                .flags(flags.snapshot())
                .build());
    }

    public Result<Map<String, CircuitBreakerStatus>> getBreakers() {
        return Result.ok(breakers.getAllStatus());
    }

    /**
     * Resets one breaker, or every breaker when {@code name} is blank.
     */
    public Result<Map<String, CircuitBreakerStatus>> resetBreakers(String name) {
        if (name == null || name.isBlank()) {
            log.warn("Operator reset of all circuit breakers");
            breakers.resetAll();
        } else if (!breakers.names().contains(name)) {
            return Result.fail("ERR-NOT-FOUND", "Unknown circuit breaker: " + name);
        } else {
            log.warn("Operator reset of circuit breaker '{}'", name);
            breakers.get(name).reset();
        }
        return Result.ok(breakers.getAllStatus());
    }

    /**
     * Forgets every module's failure history, which clears safe mode until new failures arrive.
     */
    public Result<HealthStatus> resetHealth() {
        log.warn("Operator reset of module health");
        health.reset();
        return Result.ok(health.getStatus());
    }

    public Result<DecisionStatus> pause() {
        flags.set(FlagName.PAUSE_DECISIONS, true);
        return Result.ok(orchestrator.getStatus());
    }

    public Result<DecisionStatus> resume() {
        flags.set(FlagName.PAUSE_DECISIONS, false);
        return Result.ok(orchestrator.getStatus());
    }

    public Result<DecisionStatus> setMode(TradingMode mode) {
        if (mode == null) return Result.fail("ERR-VAL-001", "mode is required");
        orchestrator.setMode(mode);
        return Result.ok(orchestrator.getStatus());
    }

    public Result<List<FinalDecision>> history(int limit) {
        if (limit < 1 || limit > MAX_PAGE) {
            return Result.fail("ERR-VAL-001", "limit must be between 1 and " + MAX_PAGE);
        }
        return Result.ok(journal.recent(limit));
    }

    public Result<List<FinalDecision>> vetoes(int limit) {
        if (limit < 1 || limit > MAX_PAGE) {
            return Result.fail("ERR-VAL-001", "limit must be between 1 and " + MAX_PAGE);
        }
        return Result.ok(journal.recentVetoes(limit));
    }
}
