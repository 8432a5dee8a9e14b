package com.trade.sentinel.config;

import com.trade.sentinel.core.breaker.CircuitBreakerConfig;
import com.trade.sentinel.core.ratelimit.RateLimit;
import com.trade.sentinel.core.ratelimit.RateLimiter;
import com.trade.sentinel.service.decision.DecisionSettings;
import com.trade.sentinel.service.decision.SettingsProfile;
import com.trade.sentinel.service.decision.TradingMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed view of {@code trade.sentinel.*}.
 */
@Getter
@Setter
@Component
@Validated
@ConfigurationProperties("trade.sentinel")
public class SentinelProperties {

    @Valid
    private Breaker breaker = new Breaker();
    /** Per-dependency overrides keyed by dependency name. */
    @Valid
    private Map<String, Breaker> breakers = new LinkedHashMap<>();
    @Valid
    private RateLimits rateLimit = new RateLimits();
    @Valid
    private Cache cache = new Cache();
    @Valid
    private Health health = new Health();
    @Valid
    private Decision decision = new Decision();

    public CircuitBreakerConfig defaultBreakerConfig() {
        return breaker.toConfig();
    }

    public Map<String, CircuitBreakerConfig> breakerOverrides() {
        Map<String, CircuitBreakerConfig> out = new HashMap<>();
        breakers.forEach((name, b) -> out.put(name, b.toConfig()));
        return out;
    }

    @Getter
    @Setter
    public static class Breaker {
        @Min(1)
        private int failureThreshold = 5;
        @Min(1)
        private int successThreshold = 2;
        private Duration openTimeout = Duration.ofSeconds(60);
        @Min(1)
        private int halfOpenMaxProbes = 3;

        public CircuitBreakerConfig toConfig() {
            return CircuitBreakerConfig.builder()
                    .failureThreshold(failureThreshold)
                    .successThreshold(successThreshold)
                    .openTimeout(openTimeout)
                    .halfOpenMaxProbes(halfOpenMaxProbes)
                    .build();
        }
    }

    @Getter
    @Setter
    public static class RateLimits {
        /** How long a guarded call may block waiting for capacity. */
        private Duration acquireTimeout = Duration.ofSeconds(5);
        /** Empty means the venue defaults. */
        private List<Limit> limits = new ArrayList<>();

        public List<RateLimit> toRateLimits() {
            if (limits.isEmpty()) return RateLimiter.defaultLimits();
            List<RateLimit> out = new ArrayList<>(limits.size());
            for (Limit l : limits) {
                out.add(new RateLimit(l.getName(), l.getMaxUnits(), l.getWindowSeconds(), l.isWeighted()));
            }
            return out;
        }
    }

    @Getter
    @Setter
    public static class Limit {
        private String name;
        private long maxUnits;
        private long windowSeconds;
        private boolean weighted;
    }

    @Getter
    @Setter
    public static class Cache {
        @Min(1)
        private int maxSize = 1000;
        private Duration defaultTtl = Duration.ofMinutes(5);
        private long cleanupIntervalMs = 60_000L;
    }

    @Getter
    @Setter
    public static class Health {
        @Min(1)
        private int failureThreshold = 3;
        @Min(1)
        private int recoveryThreshold = 1;
        private double minHealthForNormalMode = 50.0;
        private double continueNormalAbove = 70.0;
        @Valid
        private Fallback fallback = new Fallback();
    }

    @Getter
    @Setter
    public static class Fallback {
        private double minExecuteConfidence = 0.95;
        private double minRecommendConfidence = 0.80;
        private double positionSizeFraction = 0.001;
        private int maxConcurrentActions = 1;
        private boolean requireUnanimousConfidence = true;

        public DecisionSettings toSettings() {
            return DecisionSettings.builder()
                    .profile(SettingsProfile.FALLBACK)
                    .minExecuteConfidence(minExecuteConfidence)
                    .minRecommendConfidence(minRecommendConfidence)
                    .positionSizeFraction(positionSizeFraction)
                    .maxConcurrentActions(maxConcurrentActions)
                    .requireUnanimousConfidence(requireUnanimousConfidence)
                    .build();
        }
    }

    @Getter
    @Setter
    public static class Decision {
        private TradingMode mode = TradingMode.HYBRID;
        private Duration evaluatorTimeout = Duration.ofSeconds(2);
        private double minExecuteConfidence = 0.80;
        private double minRecommendConfidence = 0.65;
        private double positionSizeFraction = 1.0;
        private int maxConcurrentActions = 5;
        /** Pause instead of degrading when safe mode is active. */
        private boolean haltInSafeMode = false;
        @Min(1)
        private int historySize = 500;
        /** Confidence weight per evaluator name; missing names weigh 1.0. */
        private Map<String, Double> weights = new HashMap<>();
        @Valid
        private Executor executor = new Executor();

        public DecisionSettings toSettings() {
            return DecisionSettings.builder()
                    .profile(SettingsProfile.NORMAL)
                    .minExecuteConfidence(minExecuteConfidence)
                    .minRecommendConfidence(minRecommendConfidence)
                    .positionSizeFraction(positionSizeFraction)
                    .maxConcurrentActions(maxConcurrentActions)
                    .requireUnanimousConfidence(false)
                    .build();
        }
    }

    @Getter
    @Setter
    public static class Executor {
        @Min(1)
        private int corePoolSize = 4;
        @Min(1)
        private int maxPoolSize = 8;
        private int queueCapacity = 100;
    }
}
