package com.deepansh.salesagent.observability;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * One document per handled request: input, reply, the plan that ran,
 * validation outcome and per-step timing.
 *
 * Steps are embedded rather than referenced; a plan has a handful of steps
 * and they are always read together with the run.
 */
@Document(collection = "plan_run_traces")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanRunTrace {

    public enum Status { SUCCESS, PARTIAL_FAILURE, VALIDATION_FAILED, ERROR }

    @Id
    private String id;

    @Indexed
    private String sessionId;

    @Indexed
    private String userId;

    private String userMessage;
    private String response;

    @Indexed
    private Status status;

    private String intent;
    private boolean repaired;
    private List<String> validationErrors;

    private int stepCount;
    private long failedStepCount;
    private long totalLatencyMs;
    private List<RunContext.StepRecord> steps;

    /** Set when status = ERROR */
    private String errorMessage;

    @CreatedDate
    @Indexed
    private Instant createdAt;
}
