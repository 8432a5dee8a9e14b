package com.trade.sentinel.service.decision;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Emits one flat JSON audit line per decision to the {@code decision.audit} logger.
 * <p>
 * Usage:
 * <pre>
 *   events.event(DecisionEventSupport.EVT_DECIDED)
 *         .id(decision.getId())
 *         .outcome(decision.getOutcome().name())
 *         .confidence(decision.getConfidence())
 *         .reasons(decision.getReasons())
 *         .emit();
 * </pre>
 */
@Component
public class DecisionEventSupport {

    public static final String EVT_DECIDED = "decision.decided";
    public static final String EVT_SUPERSEDED = "decision.superseded";

    private static final Logger AUDIT = LoggerFactory.getLogger("decision.audit");

    private final Clock clock;

    public DecisionEventSupport(Clock clock) {
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * New event stamped with the current time; {@link Event#at(Instant)} overrides it.
     */
    public Event event(String name) {
        return new Event(name, clock.instant());
    }

    /**
     * Convenience for the orchestrator: the full audit record of one decision.
     */
    public JsonObject emitDecision(FinalDecision d, long latencyMs) {
        return event(d.isSuperseded() ? EVT_SUPERSEDED : EVT_DECIDED)
                .at(d.getTimestamp())
                .id(d.getId())
                .outcome(d.getOutcome() == null ? null : d.getOutcome().name())
                .mode(d.getMode() == null ? null : d.getMode().name())
                .profile(d.getSettingsProfile() == null ? null : d.getSettingsProfile().name())
                .confidence(d.getConfidence())
                .systemHealth(d.getSystemHealth())
                .latencyMs(latencyMs)
                .reasons(d.getReasons())
                .votes(d.getVerdicts())
                .emit();
    }

    public static final class Event {
        private final String name;
        private Instant at;
        private String id;
        private String outcome;
        private String mode;
        private String profile;
        private Double confidence;
        private Double systemHealth;
        private Long latencyMs;
        private List<String> reasons;
        private Map<String, Verdict> votes;

        private Event(String name, Instant at) {
            this.name = name;
            this.at = at;
        }

        public Event at(Instant at) {
            if (at != null) this.at = at;
            return this;
        }

        public Event id(String id) {
            this.id = id;
            return this;
        }

        public Event outcome(String outcome) {
            this.outcome = outcome;
            return this;
        }

        public Event mode(String mode) {
            this.mode = mode;
            return this;
        }

        public Event profile(String profile) {
            this.profile = profile;
            return this;
        }

        public Event confidence(Double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Event systemHealth(Double systemHealth) {
            this.systemHealth = systemHealth;
            return this;
        }

        public Event latencyMs(Long latencyMs) {
            this.latencyMs = latencyMs;
            return this;
        }

        public Event reasons(List<String> reasons) {
            this.reasons = reasons;
            return this;
        }

        public Event votes(Map<String, Verdict> votes) {
            this.votes = votes;
            return this;
        }

        public JsonObject toJson() {
            JsonObject o = new JsonObject();
            o.addProperty("ts", at.toEpochMilli());
            o.addProperty("ts_iso", at.toString());
            o.addProperty("event", isBlank(name) ? "decision.unknown" : name);
            o.addProperty("source", "decision");

            if (!isBlank(id)) o.addProperty("id", id);
            if (!isBlank(outcome)) o.addProperty("outcome", outcome);
            if (!isBlank(mode)) o.addProperty("mode", mode);
            if (!isBlank(profile)) o.addProperty("profile", profile);
            if (confidence != null) o.addProperty("confidence", confidence);
            if (systemHealth != null) o.addProperty("system_health", systemHealth);
            if (latencyMs != null) o.addProperty("latency_ms", latencyMs);

            if (reasons != null && !reasons.isEmpty()) {
                JsonArray arr = new JsonArray();
                for (String r : reasons) {
                    if (!isBlank(r)) arr.add(r);
                }
                if (arr.size() > 0) o.add("reasons", arr);
            }
            if (votes != null && !votes.isEmpty()) {
                JsonObject v = new JsonObject();
                votes.forEach((k, verdict) -> v.addProperty(k, verdict.approved() ? "APPROVE" : "VETO"));
                o.add("votes", v);
            }
            return o;
        }

        public JsonObject emit() {
            JsonObject o = toJson();
            AUDIT.info("{}", o);
            return o;
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
