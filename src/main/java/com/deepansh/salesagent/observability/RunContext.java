package com.deepansh.salesagent.observability;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable per-request collector for observability data.
 * Created by the orchestrator, filled by the executor, flushed to
 * PlanRunTrace at the end. Not shared between requests.
 */
@Getter
public class RunContext {

    private final long startTimeMs = System.currentTimeMillis();
    private final List<StepRecord> stepRecords = new ArrayList<>();

    public void recordStep(String action, boolean success, long latencyMs, String error) {
        stepRecords.add(new StepRecord(action, success, latencyMs, error));
    }

    public long elapsedMs() {
        return System.currentTimeMillis() - startTimeMs;
    }

    public long failedSteps() {
        return stepRecords.stream().filter(r -> !r.success()).count();
    }

    public record StepRecord(String action, boolean success, long latencyMs, String error) {
    }
}
