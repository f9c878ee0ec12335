package com.deepansh.salesagent.observability;

import com.deepansh.salesagent.model.ExecutionTrace;
import com.deepansh.salesagent.model.SalesAgentResponse;
import com.deepansh.salesagent.plan.StepResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TraceServiceTest {

    @Mock PlanRunTraceRepository traceRepository;

    @InjectMocks
    TraceService traceService;

    @Test
    void buildTrace_partialFailure_countsFailedSteps() {
        RunContext runCtx = new RunContext();
        runCtx.recordStep("get_user_profile", true, 4, null);
        runCtx.recordStep("apply_offers", false, 2, "cart must not be empty");
        SalesAgentResponse response = response(true, List.of(
                StepResult.succeeded("get_user_profile", Map.of(), Map.of()),
                StepResult.failed("apply_offers", Map.of(), "cart must not be empty")));

        PlanRunTrace trace = traceService.buildTrace("s1", "001", "offers?", response, runCtx, null);

        assertThat(trace.getStatus()).isEqualTo(PlanRunTrace.Status.PARTIAL_FAILURE);
        assertThat(trace.getStepCount()).isEqualTo(2);
        assertThat(trace.getFailedStepCount()).isEqualTo(1);
        assertThat(trace.getIntent()).isEqualTo("apply offers");
        assertThat(trace.getSteps()).hasSize(2);
    }

    @Test
    void statusOf_ordersErrorThenValidationThenSteps() {
        ExecutionTrace valid = ExecutionTrace.builder().validationPassed(true).build();
        ExecutionTrace invalid = ExecutionTrace.builder().validationPassed(false).build();

        assertThat(TraceService.statusOf(valid, 0, new RuntimeException())).isEqualTo(PlanRunTrace.Status.ERROR);
        assertThat(TraceService.statusOf(null, 0, null)).isEqualTo(PlanRunTrace.Status.ERROR);
        assertThat(TraceService.statusOf(invalid, 0, null)).isEqualTo(PlanRunTrace.Status.VALIDATION_FAILED);
        assertThat(TraceService.statusOf(valid, 0, null)).isEqualTo(PlanRunTrace.Status.SUCCESS);
    }

    @Test
    void persistTrace_repositoryFailure_doesNotThrow() {
        when(traceRepository.save(any())).thenThrow(new RuntimeException("mongo down"));

        traceService.persistTrace("s1", "001", "hi", response(true, List.of()), new RunContext(), null);

        verify(traceRepository).save(any(PlanRunTrace.class));
    }

    @Test
    void getAnalytics_aggregatesRepositoryResults() {
        when(traceRepository.avgLatencyForUser("001")).thenReturn(123.6);
        when(traceRepository.countRecentByUser(eq("001"), any())).thenReturn(4L);
        when(traceRepository.statusBreakdownForUser("001")).thenReturn(List.of(
                new PlanRunTraceRepository.StatusCount("SUCCESS", 3),
                new PlanRunTraceRepository.StatusCount("ERROR", 1)));

        Map<String, Object> analytics = traceService.getAnalytics("001");

        assertThat(analytics)
                .containsEntry("avgLatencyMs", 124L)
                .containsEntry("runsLast24h", 4L)
                .containsEntry("statusBreakdown", Map.of("SUCCESS", 3L, "ERROR", 1L));
    }

    private static SalesAgentResponse response(boolean valid, List<StepResult> steps) {
        return SalesAgentResponse.builder()
                .sessionId("s1")
                .response("done")
                .executionTrace(ExecutionTrace.builder()
                        .plan(Map.of("intent", "apply offers"))
                        .validationPassed(valid)
                        .executionSteps(steps)
                        .build())
                .build();
    }
}
