package com.trade.sentinel.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class EvaluatorExecutorConfig {

    /**
     * Thread pool evaluators run on, so each one can be timed out on its own.
     * <p>
     * A saturated pool rejects instead of running the evaluator on the deciding thread; the
     * orchestrator turns the rejection into a failed verdict.
     */
    @Bean(name = "evaluatorExecutor")
    public ThreadPoolTaskExecutor evaluatorExecutor(SentinelProperties properties) {
        SentinelProperties.Executor cfg = properties.getDecision().getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(cfg.getCorePoolSize());
        executor.setMaxPoolSize(cfg.getMaxPoolSize());
        executor.setQueueCapacity(cfg.getQueueCapacity());
        executor.setThreadNamePrefix("Evaluator-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
