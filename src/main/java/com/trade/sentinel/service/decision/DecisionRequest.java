package com.trade.sentinel.service.decision;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DecisionRequest {
    DecisionContext context;
    /** Optional; without it an EXECUTE outcome has no side effect. */
    ExecutionAction action;
}
