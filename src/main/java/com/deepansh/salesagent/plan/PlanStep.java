package com.deepansh.salesagent.plan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One tool invocation inside a plan: the action name plus its raw parameter mapping.
 * Parameters may still hold placeholders, resolved right before dispatch.
 */
public record PlanStep(String action, Map<String, Object> params) {

    public PlanStep {
        // LinkedHashMap rather than Map.copyOf: planner output can carry null values
        params = params == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static PlanStep of(String action, Map<String, Object> params) {
        return new PlanStep(action, params);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("action", action);
        m.put("params", new LinkedHashMap<>(params));
        return m;
    }
}
