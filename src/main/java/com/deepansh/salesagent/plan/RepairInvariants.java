package com.deepansh.salesagent.plan;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * What a repair is not allowed to change, captured from the invalid plan
 * before the repair call and checked against the repaired one.
 */
record RepairInvariants(int stepCount, Set<String> actions, Set<String> intentTokens) {

    /** Below this many intent tokens the intent is too short to compare meaningfully. */
    static final int MIN_INTENT_TOKENS_TO_COMPARE = 3;

    static RepairInvariants capture(Map<String, Object> plan) {
        List<?> steps = plan.get("steps") instanceof List<?> l ? l : List.of();
        return new RepairInvariants(steps.size(), actionsOf(steps), intentTokensOf(plan.get("intent")));
    }

    void verify(Map<String, Object> repaired) {
        List<?> steps = repaired.get("steps") instanceof List<?> l ? l : List.of();

        if (steps.size() != stepCount) {
            throw new SemanticViolationException(
                    "Step count changed from " + stepCount + " to " + steps.size());
        }

        Set<String> repairedActions = actionsOf(steps);
        if (!repairedActions.equals(actions)) {
            throw new SemanticViolationException(
                    "Actions changed from " + actions + " to " + repairedActions);
        }

        if (intentTokens.size() >= MIN_INTENT_TOKENS_TO_COMPARE) {
            Set<String> repairedTokens = intentTokensOf(repaired.get("intent"));
            repairedTokens.retainAll(intentTokens);
            if (repairedTokens.isEmpty()) {
                throw new SemanticViolationException(
                        "Intent changed: '" + repaired.get("intent") + "' shares nothing with the original");
            }
        }
    }

    private static Set<String> actionsOf(List<?> steps) {
        return steps.stream()
                .filter(Map.class::isInstance)
                .map(s -> ((Map<?, ?>) s).get("action"))
                .filter(a -> a != null)
                .map(Object::toString)
                .collect(Collectors.toSet());
    }

    private static Set<String> intentTokensOf(Object intent) {
        if (intent == null) return new HashSet<>();
        return Arrays.stream(intent.toString().toLowerCase(Locale.ROOT).strip().split("\\s+"))
                .filter(t -> !t.isEmpty())
                .collect(Collectors.toCollection(HashSet::new));
    }
}
