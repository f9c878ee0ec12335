package com.deepansh.salesagent.plan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one executed (or short-circuited) step.
 * Index-aligned with the plan's steps; never mutated after creation.
 */
public record StepResult(
        String step,
        boolean success,
        Map<String, Object> params,
        Object result,
        String error) {

    public StepResult {
        params = params == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static StepResult succeeded(String action, Map<String, Object> params, Object result) {
        return new StepResult(action, true, params, result, null);
    }

    public static StepResult failed(String action, Map<String, Object> params, String error) {
        return new StepResult(action, false, params, null, error);
    }

    /** Plain JSON-friendly form, used when the result is written into session context. */
    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("step", step);
        m.put("success", success);
        m.put("params", new LinkedHashMap<>(params));
        m.put("result", result);
        m.put("error", error);
        return m;
    }
}
