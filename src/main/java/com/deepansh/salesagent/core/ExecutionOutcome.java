package com.deepansh.salesagent.core;

import com.deepansh.salesagent.plan.StepResult;

import java.util.List;
import java.util.Map;

/**
 * @param executionSteps one result per plan step, in plan order
 * @param context        the session context as it was persisted (or as it would have been)
 */
public record ExecutionOutcome(String response, List<StepResult> executionSteps, Map<String, Object> context) {
}
