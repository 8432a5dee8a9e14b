package com.trade.sentinel.service.decision;

import com.trade.sentinel.common.Result;
import com.trade.sentinel.common.enums.FlagName;
import com.trade.sentinel.common.exception.CircuitOpenException;
import com.trade.sentinel.common.exception.ConfigurationException;
import com.trade.sentinel.common.exception.EvaluatorFailureException;
import com.trade.sentinel.common.exception.RateLimitExceededException;
import com.trade.sentinel.config.SentinelProperties;
import com.trade.sentinel.core.cache.CacheStore;
import com.trade.sentinel.service.FlagsService;
import com.trade.sentinel.service.execution.GuardedInvoker;
import com.trade.sentinel.service.health.HealthMonitor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs one decision cycle: preliminary gate, every evaluator, veto-first aggregation, and the
 * guarded side effect of an EXECUTE.
 * <p>
 * Any single veto rejects the cycle regardless of confidence. An evaluator that throws, times out or
 * returns nothing counts as a veto ("evaluator failure: name"). All evaluators always run so the
 * decision lists every reason.
 */
@Slf4j
public class DecisionOrchestrator {

    static final String MODULE_EVALUATOR = "evaluator:";
    static final String MODULE_DEPENDENCY = "dependency:";

    private final List<Evaluator> evaluators;
    private final HealthMonitor health;
    private final GuardedInvoker invoker;
    private final CacheStore<Object> cache;
    private final FlagsService flags;
    private final DecisionJournal journal;
    private final DecisionEventSupport events;
    private final AsyncTaskExecutor executor;
    private final LatencyWindow latency;
    private final Clock clock;

    private final DecisionSettings normalSettings;
    private final Duration evaluatorTimeout;
    private final Map<String, Double> weights;

    private volatile TradingMode mode;
    private final AtomicInteger activeActions = new AtomicInteger();
    private final Map<DecisionOutcome, AtomicLong> outcomeCounts = new EnumMap<>(DecisionOutcome.class);
    private final AtomicLong totalDecisions = new AtomicLong();
    private final AtomicLong totalVetoes = new AtomicLong();
    private final AtomicLong evaluatorFailures = new AtomicLong();
    private final AtomicLong executionFailures = new AtomicLong();

    public DecisionOrchestrator(List<Evaluator> evaluators,
                                HealthMonitor health,
                                GuardedInvoker invoker,
                                CacheStore<Object> cache,
                                FlagsService flags,
                                DecisionJournal journal,
                                DecisionEventSupport events,
                                AsyncTaskExecutor executor,
                                LatencyWindow latency,
                                SentinelProperties.Decision settings,
                                Clock clock) {
        this.evaluators = List.copyOf(evaluators == null ? List.of() : evaluators);
        checkNames(this.evaluators);
        this.health = health;
        this.invoker = invoker;
        this.cache = cache;
        this.flags = flags;
        this.journal = journal;
        this.events = events;
        this.executor = executor;
        this.latency = latency;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.normalSettings = settings.toSettings();
        this.evaluatorTimeout = settings.getEvaluatorTimeout();
        this.weights = Map.copyOf(settings.getWeights());
        this.mode = settings.getMode();
        for (DecisionOutcome o : DecisionOutcome.values()) outcomeCounts.put(o, new AtomicLong());
        log.info("Decision orchestrator ready: mode={}, evaluators={}", mode, evaluatorNames());
    }

    public FinalDecision decide(DecisionRequest request) {
        final long t0 = System.nanoTime();
        final DecisionContext base = (request == null || request.getContext() == null)
                ? DecisionContext.builder().build()
                : request.getContext();
        final TradingMode cycleMode = mode;
        final double systemHealth = health.systemHealth();
        final boolean safeMode = health.shouldActivateSafeMode();
        final DecisionSettings active = safeMode ? health.fallbackSettings() : normalSettings;

        FinalDecision.FinalDecisionBuilder b = FinalDecision.builder()
                .id(UUID.randomUUID().toString())
                .mode(cycleMode)
                .settingsProfile(active.getProfile())
                .systemHealth(systemHealth)
                .positionSizeFraction(active.getPositionSizeFraction())
                .timestamp(clock.instant());

        FinalDecision decision;
        if (flags.isOn(FlagName.PAUSE_DECISIONS)) {
            decision = b.outcome(DecisionOutcome.PAUSED).reason("decisions paused by operator").build();
        } else if (cycleMode == TradingMode.NO_TRADE) {
            decision = b.outcome(DecisionOutcome.REJECT).reason("trading mode is NO_TRADE").build();
        } else if (safeMode && flags.isOn(FlagName.SAFE_MODE_HALT)) {
            // evaluators still run so their health reports can lift safe mode; their verdicts decide nothing
            if (!evaluators.isEmpty()) {
                b.verdicts(runEvaluators(cycleContext(base, cycleMode, active, systemHealth)));
            }
            decision = b.outcome(DecisionOutcome.PAUSED)
                    .reason(String.format(Locale.ROOT, "safe mode active: system health %.1f%%, decisions halted", systemHealth))
                    .build();
        } else {
            if (safeMode) {
                log.warn("Safe mode active (health {}%), deciding under fallback settings", fmt1(systemHealth));
                b.reason(String.format(Locale.ROOT, "safe mode active: system health %.1f%%, using fallback settings", systemHealth));
            }
            if (evaluators.isEmpty()) {
                decision = b.outcome(DecisionOutcome.REJECT).reason("no evaluators registered").build();
            } else {
                DecisionContext ctx = cycleContext(base, cycleMode, active, systemHealth);
                decision = aggregate(b, runEvaluators(ctx), cycleMode, active);
            }
        }

        if (decision.getOutcome() == DecisionOutcome.EXECUTE && request != null && request.getAction() != null) {
            decision = execute(decision, request.getAction(), active);
        }
        return finish(decision, t0);
    }

    public TradingMode getMode() {
        return mode;
    }

    public void setMode(TradingMode mode) {
        if (mode == null) throw new IllegalArgumentException("mode is required");
        TradingMode previous = this.mode;
        this.mode = mode;
        if (previous != mode) log.info("Trading mode {} -> {}", previous, mode);
    }

    public List<String> evaluatorNames() {
        List<String> names = new ArrayList<>(evaluators.size());
        for (Evaluator e : evaluators) names.add(e.name());
        return names;
    }

    public DecisionStatus getStatus() {
        Map<DecisionOutcome, Long> outcomes = new EnumMap<>(DecisionOutcome.class);
        outcomeCounts.forEach((k, v) -> outcomes.put(k, v.get()));
        return DecisionStatus.builder()
                .mode(mode)
                .paused(flags.isOn(FlagName.PAUSE_DECISIONS))
                .safeMode(health.shouldActivateSafeMode())
                .systemHealth(health.systemHealth())
                .totalDecisions(totalDecisions.get())
                .outcomes(outcomes)
                .totalVetoes(totalVetoes.get())
                .evaluatorFailures(evaluatorFailures.get())
                .executionFailures(executionFailures.get())
                .latencyP95Ms(latency.percentile(95).map(Duration::toMillis).orElse(-1L))
                .activeActions(activeActions.get())
                .evaluators(evaluatorNames())
                .build();
    }

    // ---------- evaluation ----------

    private DecisionContext cycleContext(DecisionContext base, TradingMode cycleMode, DecisionSettings active, double systemHealth) {
        return base.toBuilder()
                .asOf(base.getAsOf() == null ? clock.instant() : base.getAsOf())
                .mode(cycleMode)
                .settings(active)
                .systemHealth(systemHealth)
                .build();
    }

    private Map<String, Verdict> runEvaluators(DecisionContext ctx) {
        // one budget for the whole cycle, started before anything is submitted
        final long deadline = System.nanoTime() + evaluatorTimeout.toNanos();
        List<Future<Verdict>> futures = new ArrayList<>(evaluators.size());
        for (Evaluator e : evaluators) {
            futures.add(submit(e, ctx));
        }
        Map<String, Verdict> verdicts = new LinkedHashMap<>();
        for (int i = 0; i < evaluators.size(); i++) {
            Evaluator e = evaluators.get(i);
            verdicts.put(e.name(), collect(e.name(), futures.get(i), deadline));
        }
        return verdicts;
    }

    private Future<Verdict> submit(Evaluator e, DecisionContext ctx) {
        try {
            return executor.submit(() -> e.evaluate(ctx));
        } catch (TaskRejectedException rejected) {
            // surfaces as a failure verdict when collected
            return CompletableFuture.failedFuture(rejected);
        }
    }

    private Verdict collect(String name, Future<Verdict> future, long deadline) {
        try {
            Verdict v = future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            if (v == null) {
                return failed(name, new EvaluatorFailureException(name, "returned no verdict", null));
            }
            health.reportModuleResult(MODULE_EVALUATOR + name, true);
            return name.equals(v.name()) ? v : new Verdict(name, v.approved(), v.reason(), v.confidence());
        } catch (TimeoutException te) {
            future.cancel(true);
            return failed(name, new EvaluatorFailureException(name, "timed out after " + evaluatorTimeout.toMillis() + " ms", te));
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause() == null ? ee : ee.getCause();
            return failed(name, new EvaluatorFailureException(name, String.valueOf(cause.getMessage()), cause));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return failed(name, new EvaluatorFailureException(name, "interrupted", ie));
        }
    }

    private Verdict failed(String name, EvaluatorFailureException ex) {
        evaluatorFailures.incrementAndGet();
        log.warn("{}", ex.getMessage(), ex.getCause());
        health.reportModuleResult(MODULE_EVALUATOR + name, false);
        return Verdict.failure(name);
    }

    private FinalDecision aggregate(FinalDecision.FinalDecisionBuilder b,
                                    Map<String, Verdict> verdicts,
                                    TradingMode cycleMode,
                                    DecisionSettings active) {
        double confidence = weightedConfidence(verdicts);
        b.verdicts(verdicts).confidence(confidence);

        List<String> vetoReasons = new ArrayList<>();
        for (Verdict v : verdicts.values()) {
            if (!v.approved()) vetoReasons.add(v.isFailure() ? v.reason() : v.name() + ": " + v.reason());
        }
        if (!vetoReasons.isEmpty()) {
            return b.outcome(DecisionOutcome.REJECT)
                    .vetoCount(vetoReasons.size())
                    .vetoReasons(vetoReasons)
                    .reasons(vetoReasons)
                    .build();
        }

        if (active.isRequireUnanimousConfidence()) {
            List<String> weak = new ArrayList<>();
            for (Verdict v : verdicts.values()) {
                if (v.confidence() < active.getMinRecommendConfidence()) {
                    weak.add(String.format(Locale.ROOT, "%s: confidence %.2f below floor %.2f",
                            v.name(), v.confidence(), active.getMinRecommendConfidence()));
                }
            }
            if (!weak.isEmpty()) return b.outcome(DecisionOutcome.REJECT).reasons(weak).build();
        }

        if (cycleMode == TradingMode.AUTO && confidence >= active.getMinExecuteConfidence()) {
            return b.outcome(DecisionOutcome.EXECUTE)
                    .reason(String.format(Locale.ROOT, "confidence %.2f meets execute threshold %.2f",
                            confidence, active.getMinExecuteConfidence()))
                    .build();
        }
        if (confidence >= active.getMinRecommendConfidence()) {
            String why = cycleMode == TradingMode.HYBRID
                    ? String.format(Locale.ROOT, "confidence %.2f, HYBRID mode awaits confirmation", confidence)
                    : String.format(Locale.ROOT, "confidence %.2f below execute threshold %.2f",
                    confidence, active.getMinExecuteConfidence());
            return b.outcome(DecisionOutcome.RECOMMEND).reason(why).build();
        }
        return b.outcome(DecisionOutcome.REJECT)
                .reason(String.format(Locale.ROOT, "confidence %.2f below recommend threshold %.2f",
                        confidence, active.getMinRecommendConfidence()))
                .build();
    }

    private double weightedConfidence(Map<String, Verdict> verdicts) {
        double weighted = 0d;
        double total = 0d;
        for (Verdict v : verdicts.values()) {
            double w = Math.max(0d, weights.getOrDefault(v.name(), 1.0));
            weighted += w * v.confidence();
            total += w;
        }
        return total == 0d ? 0d : weighted / total;
    }

    // ---------- side effects ----------

    private FinalDecision execute(FinalDecision decision, ExecutionAction action, DecisionSettings active) {
        try {
            invoker.checkAction(action.getDependency(), action.getWeight(), action.getOperation());
        } catch (IllegalArgumentException e) {
            // a malformed action says nothing about the dependency's health
            return supersede(decision, "invalid action: " + e.getMessage());
        }
        String module = MODULE_DEPENDENCY + action.getDependency();
        int inFlight = activeActions.incrementAndGet();
        try {
            if (inFlight > active.getMaxConcurrentActions()) {
                return supersede(decision, "concurrent action limit reached (" + active.getMaxConcurrentActions() + ")");
            }
            Object result = invoker.invoke(action.getDependency(), action.getWeight(), action.getOperation());
            if (result instanceof Result && ((Result<?>) result).isFailure()) {
                health.reportModuleResult(module, false);
                return supersede(decision, "execution returned error: " + Result.errorOf((Result<?>) result));
            }
            health.reportModuleResult(module, true);
            if (action.getCacheKey() != null && result != null) {
                cache.set(action.getCacheKey(), result, action.getCacheTtl());
            }
            return decision.toBuilder().executionResult(result).build();
        } catch (RateLimitExceededException e) {
            return supersede(decision, "rate limited: " + e.getMessage());
        } catch (CircuitOpenException e) {
            health.reportModuleResult(module, false);
            return supersede(decision, "circuit open: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Execution against '{}' failed", action.getDependency(), e);
            health.reportModuleResult(module, false);
            return supersede(decision, "execution failed: " + (e.getMessage() == null ? e.toString() : e.getMessage()));
        } finally {
            activeActions.decrementAndGet();
        }
    }

    private FinalDecision supersede(FinalDecision decision, String error) {
        executionFailures.incrementAndGet();
        log.warn("Decision {} superseded: {}", decision.getId(), error);
        return decision.toBuilder()
                .outcome(DecisionOutcome.REJECT)
                .supersededOutcome(decision.getOutcome())
                .executionError(error)
                .reason(error)
                .timestamp(clock.instant())
                .build();
    }

    private FinalDecision finish(FinalDecision decision, long t0) {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - t0);
        long elapsedMs = elapsed.toMillis();
        totalDecisions.incrementAndGet();
        outcomeCounts.get(decision.getOutcome()).incrementAndGet();
        if (decision.isVetoed()) totalVetoes.addAndGet(decision.getVetoCount());
        latency.record(elapsed);
        journal.record(decision);
        events.emitDecision(decision, elapsedMs);
        log.info("Decision {} -> {} (confidence {}, vetoes {}, {} ms)", decision.getId(), decision.getOutcome(),
                fmt2(decision.getConfidence()), decision.getVetoCount(), elapsedMs);
        return decision;
    }

    private static void checkNames(List<Evaluator> evaluators) {
        Set<String> seen = new LinkedHashSet<>();
        for (Evaluator e : evaluators) {
            String name = e.name();
            if (name == null || name.isBlank()) {
                throw new ConfigurationException("decision.evaluators", "evaluator " + e.getClass().getName() + " has no name");
            }
            if (!seen.add(name)) {
                throw new ConfigurationException("decision.evaluators", "duplicate evaluator name " + name);
            }
        }
    }

    private static String fmt1(double v) {
        return String.format(Locale.ROOT, "%.1f", v);
    }

    private static String fmt2(double v) {
        return String.format(Locale.ROOT, "%.2f", v);
    }
}
