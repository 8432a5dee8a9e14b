package com.trade.sentinel.service.decision;

import lombok.Builder;
import lombok.Value;

/**
 * Thresholds and sizing a decision cycle runs under.
 */
@Value
@Builder(toBuilder = true)
public class DecisionSettings {
    SettingsProfile profile;
    double minExecuteConfidence;
    double minRecommendConfidence;
    /** Fraction of the normal position size the action may use. */
    double positionSizeFraction;
    int maxConcurrentActions;
    /** Every verdict, not only the average, must reach the recommend floor. */
    boolean requireUnanimousConfidence;
}
