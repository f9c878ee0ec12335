package com.deepansh.salesagent.model;

import com.deepansh.salesagent.plan.StepResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Per-request trace returned to the caller next to the reply.
 * Carries internal detail (errors, step results) for debugging clients;
 * the reply text itself never does.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionTrace {

    /** The plan that ran (wire shape), or the fallback plan. */
    private Map<String, Object> plan;

    private boolean validationPassed;

    @Builder.Default
    private List<String> validationErrors = new ArrayList<>();

    @Builder.Default
    private List<StepResult> executionSteps = new ArrayList<>();

    /** True when the plan only became valid after a guardrailed repair. */
    private boolean governanceUsed;

    /** Why repair ran, when it did. */
    private String governanceFixes;
}
