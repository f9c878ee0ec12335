package com.deepansh.salesagent.core;

import com.deepansh.salesagent.plan.StepResult;

import java.util.List;
import java.util.Map;

/**
 * Everything a step's parameters may be resolved against.
 *
 * @param previousResults results of the steps already run in this plan, in order
 */
public record ResolutionContext(
        String sessionId,
        String userId,
        Map<String, Object> context,
        List<StepResult> previousResults) {

    public ResolutionContext {
        context = context == null ? Map.of() : context;
        previousResults = previousResults == null ? List.of() : List.copyOf(previousResults);
    }
}
