package com.deepansh.salesagent.observability;

import com.deepansh.salesagent.model.ExecutionTrace;
import com.deepansh.salesagent.model.SalesAgentResponse;
import com.deepansh.salesagent.plan.StepResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Persists run traces and exposes analytics.
 *
 * Trace persistence is @Async — it never blocks the reply.
 * Analytics queries are synchronous (called explicitly by the traces endpoint).
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TraceService {

    private final PlanRunTraceRepository traceRepository;

    /**
     * Persist a finished run asynchronously.
     * Called at the end of every request from SalesAgentOrchestrator.
     */
    @Async("traceTaskExecutor")
    public void persistTrace(String sessionId, String userId, String userMessage,
                             SalesAgentResponse response, RunContext runCtx, Throwable error) {
        try {
            PlanRunTrace trace = buildTrace(sessionId, userId, userMessage, response, runCtx, error);
            traceRepository.save(trace);

            log.info("Trace persisted [sessionId={}, status={}, steps={}, latency={}ms]",
                    sessionId, trace.getStatus(), trace.getStepCount(), trace.getTotalLatencyMs());
        } catch (Exception e) {
            // Trace persistence must never crash the app
            log.error("Failed to persist run trace [sessionId={}]", sessionId, e);
        }
    }

    PlanRunTrace buildTrace(String sessionId, String userId, String userMessage,
                            SalesAgentResponse response, RunContext runCtx, Throwable error) {
        ExecutionTrace execution = response != null ? response.getExecutionTrace() : null;
        List<StepResult> steps = execution != null ? execution.getExecutionSteps() : List.of();
        long failed = steps.stream().filter(s -> !s.success()).count();

        return PlanRunTrace.builder()
                .sessionId(sessionId)
                .userId(userId)
                .userMessage(truncate(userMessage, 4000))
                .response(truncate(response != null ? response.getResponse() : null, 8000))
                .status(statusOf(execution, failed, error))
                .intent(execution != null && execution.getPlan() != null
                        ? String.valueOf(execution.getPlan().get("intent")) : null)
                .repaired(execution != null && execution.isGovernanceUsed())
                .validationErrors(execution != null ? execution.getValidationErrors() : List.of())
                .stepCount(steps.size())
                .failedStepCount(failed)
                .totalLatencyMs(runCtx.elapsedMs())
                .steps(List.copyOf(runCtx.getStepRecords()))
                .errorMessage(error != null ? truncate(error.getMessage(), 2000) : null)
                .build();
    }

    static PlanRunTrace.Status statusOf(ExecutionTrace execution, long failedSteps, Throwable error) {
        if (error != null || execution == null) return PlanRunTrace.Status.ERROR;
        if (!execution.isValidationPassed()) return PlanRunTrace.Status.VALIDATION_FAILED;
        if (failedSteps > 0) return PlanRunTrace.Status.PARTIAL_FAILURE;
        return PlanRunTrace.Status.SUCCESS;
    }

    public List<PlanRunTrace> getTracesForUser(String userId) {
        return traceRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    public List<PlanRunTrace> getTracesForSession(String sessionId) {
        return traceRepository.findBySessionIdOrderByCreatedAtDesc(sessionId);
    }

    /**
     * Summary analytics for a user — avg latency, runs in the last 24h, status breakdown.
     */
    public Map<String, Object> getAnalytics(String userId) {
        Instant since24h = Instant.now().minus(24, ChronoUnit.HOURS);

        Double avgLatency = traceRepository.avgLatencyForUser(userId);
        long runsLast24h = traceRepository.countRecentByUser(userId, since24h);
        Map<String, Long> statusBreakdown = traceRepository.statusBreakdownForUser(userId).stream()
                .collect(Collectors.toMap(
                        r -> String.valueOf(r.id()),
                        PlanRunTraceRepository.StatusCount::count));

        return Map.of(
                "userId", userId,
                "avgLatencyMs", avgLatency != null ? Math.round(avgLatency) : 0L,
                "runsLast24h", runsLast24h,
                "statusBreakdown", statusBreakdown
        );
    }

    private static String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max) + "...[truncated]";
    }
}
