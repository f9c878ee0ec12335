package com.deepansh.salesagent.plan;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A validated plan: intent label, ordered steps, response style and the
 * side-effect flag. Immutable once built; the validator is the only producer.
 *
 * Wire shape (snake_case, matches what the planner emits):
 * <pre>
 * { "intent": "...", "steps": [{"action": "...", "params": {...}}],
 *   "response_style": "...", "needs_side_effects": true }
 * </pre>
 */
public record Plan(
        String intent,
        List<PlanStep> steps,
        @JsonProperty("response_style") String responseStyle,
        @JsonProperty("needs_side_effects") boolean needsSideEffects) {

    public static final String FALLBACK_INTENT = "validation failed";
    public static final String DEFAULT_RESPONSE_STYLE = "professional";

    public Plan {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    /** The fixed plan returned whenever validation (and repair) cannot produce a usable one. */
    public static Plan fallback() {
        return new Plan(FALLBACK_INTENT, List.of(), DEFAULT_RESPONSE_STYLE, false);
    }

    public boolean isFallback() {
        return FALLBACK_INTENT.equals(intent) && steps.isEmpty();
    }

    public Map<String, Object> toMap() {
        List<Map<String, Object>> rawSteps = new ArrayList<>();
        steps.forEach(s -> rawSteps.add(s.toMap()));

        Map<String, Object> m = new LinkedHashMap<>();
        m.put("intent", intent);
        m.put("steps", rawSteps);
        m.put("response_style", responseStyle);
        m.put("needs_side_effects", needsSideEffects);
        return m;
    }
}
