package com.trade.sentinel.config;

import com.trade.sentinel.core.cache.CacheStore;
import com.trade.sentinel.service.FlagsService;
import com.trade.sentinel.service.decision.DecisionEventSupport;
import com.trade.sentinel.service.decision.DecisionJournal;
import com.trade.sentinel.service.decision.DecisionOrchestrator;
import com.trade.sentinel.service.decision.Evaluator;
import com.trade.sentinel.service.decision.LatencyWindow;
import com.trade.sentinel.service.execution.GuardedInvoker;
import com.trade.sentinel.service.health.HealthMonitor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.stream.Collectors;

@Configuration
public class DecisionConfig {

    @Bean
    public LatencyWindow decisionLatencyWindow() {
        return new LatencyWindow(2048);
    }

    @Bean
    public DecisionJournal decisionJournal(SentinelProperties properties) {
        return new DecisionJournal(properties.getDecision().getHistorySize());
    }

    /**
     * Every {@link Evaluator} bean in {@code @Order} order.
     */
    @Bean
    public DecisionOrchestrator decisionOrchestrator(ObjectProvider<Evaluator> evaluators,
                                                     HealthMonitor health,
                                                     GuardedInvoker invoker,
                                                     CacheStore<Object> cache,
                                                     FlagsService flags,
                                                     DecisionJournal journal,
                                                     DecisionEventSupport events,
                                                     @Qualifier("evaluatorExecutor") ThreadPoolTaskExecutor executor,
                                                     LatencyWindow latency,
                                                     SentinelProperties properties,
                                                     Clock clock) {
        return new DecisionOrchestrator(
                evaluators.orderedStream().collect(Collectors.toList()),
                health, invoker, cache, flags, journal, events, executor, latency,
                properties.getDecision(), clock);
    }
}
