package com.deepansh.salesagent.plan;

import java.util.List;

/**
 * @param valid    true when {@code plan} is the (possibly repaired) proposal, false when it is the fallback
 * @param plan     never null, either the validated plan or {@link Plan#fallback()}
 * @param errors   structural / repair errors collected along the way; empty when valid
 * @param repaired true when the plan only became valid after a guardrailed repair
 */
public record ValidationResult(boolean valid, Plan plan, List<String> errors, boolean repaired) {

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    static ValidationResult accepted(Plan plan, boolean repaired) {
        return new ValidationResult(true, plan, List.of(), repaired);
    }

    static ValidationResult rejected(List<String> errors) {
        return new ValidationResult(false, Plan.fallback(), errors, false);
    }
}
