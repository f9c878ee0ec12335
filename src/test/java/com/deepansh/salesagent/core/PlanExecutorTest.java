package com.deepansh.salesagent.core;

import com.deepansh.salesagent.exception.SalesAgentException;
import com.deepansh.salesagent.llm.CompletionException;
import com.deepansh.salesagent.llm.ResponseGenerator;
import com.deepansh.salesagent.observability.RunContext;
import com.deepansh.salesagent.plan.Plan;
import com.deepansh.salesagent.plan.PlanStep;
import com.deepansh.salesagent.plan.StepResult;
import com.deepansh.salesagent.session.SessionStore;
import com.deepansh.salesagent.store.ProductStore;
import com.deepansh.salesagent.tool.SalesTool;
import com.deepansh.salesagent.tool.ToolCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PlanExecutorTest {

    private ResponseGenerator responseGenerator;
    private SessionStore sessionStore;
    private PlanExecutor executor;

    @BeforeEach
    void setUp() {
        ToolCatalog catalog = new ToolCatalog(List.of(
                new StubTool("get_user_profile", params -> Map.of("name", "Asha", "loyalty_tier", "gold")),
                new StubTool("apply_offers", params -> {
                    throw new IllegalArgumentException("cart must not be empty");
                }),
                new StubTool("check_inventory", params -> Map.of("available", true, "quantity", 3, "location", "warehouse")),
                new StubTool("save_session_context", params -> Map.of("status", "saved"))));
        ParameterResolver resolver = new ParameterResolver(catalog,
                new ProductReferenceResolver(mock(ProductStore.class)));
        responseGenerator = mock(ResponseGenerator.class);
        sessionStore = mock(SessionStore.class);
        executor = new PlanExecutor(catalog, resolver, responseGenerator, sessionStore);

        when(responseGenerator.generate(anyString(), any(), anyList(), anyMap())).thenReturn("Here you go.");
    }

    @Test
    void execute_failingStep_doesNotStopLaterSteps() {
        Plan plan = plan(
                PlanStep.of("get_user_profile", Map.of()),
                PlanStep.of("apply_offers", Map.of()),
                PlanStep.of("check_inventory", Map.of("sku", "SKU-002")));
        RunContext runCtx = new RunContext();

        ExecutionOutcome outcome = executor.execute(plan, "s1", "001", "offers and stock?", new HashMap<>(), runCtx);

        assertThat(outcome.executionSteps()).extracting(StepResult::success).containsExactly(true, false, true);
        assertThat(outcome.executionSteps().get(1).error()).isEqualTo("cart must not be empty");
        assertThat(outcome.context()).containsKeys("step_0_result", "step_2_result").doesNotContainKey("step_1_result");
        assertThat(runCtx.failedSteps()).isEqualTo(1);
        assertThat(outcome.response()).isEqualTo("Here you go.");
    }

    @Test
    void execute_unknownAction_recordedAsFailedStep() {
        ExecutionOutcome outcome = executor.execute(plan(PlanStep.of("send_email", Map.of())),
                "s1", "001", "email me", new HashMap<>());

        assertThat(outcome.executionSteps()).singleElement()
                .satisfies(r -> assertThat(r.error()).isEqualTo("Tool 'send_email' not found"));
    }

    @Test
    void execute_unresolvableInventoryTarget_failsBeforeDispatch() {
        ExecutionOutcome outcome = executor.execute(plan(PlanStep.of("check_inventory", Map.of("size", "M"))),
                "s1", "001", "is it in stock in M?", new HashMap<>());

        StepResult result = outcome.executionSteps().get(0);
        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo(ProductReferenceResolver.UNRESOLVABLE);
    }

    @Test
    @SuppressWarnings("unchecked")
    void execute_persistsHistoryAndLastIntent() {
        Map<String, Object> context = new HashMap<>();
        context.put("message_history", List.of(Map.of("user", "hi", "intent", "greeting", "response", "Hello!")));

        executor.execute(plan(PlanStep.of("get_user_profile", Map.of())), "s1", "001", "who am I?", context);

        ArgumentCaptor<Map<String, Object>> saved = ArgumentCaptor.forClass(Map.class);
        verify(sessionStore).put(eq("001"), eq("s1"), saved.capture());
        assertThat(saved.getValue())
                .containsEntry("last_message", "who am I?")
                .containsEntry("last_intent", "test intent");
        assertThat((List<Map<String, Object>>) saved.getValue().get("message_history"))
                .hasSize(2)
                .last()
                .satisfies(turn -> assertThat(turn).containsEntry("response", "Here you go."));
        assertThat((List<?>) saved.getValue().get("trace_history")).hasSize(1);
        assertThat(context).doesNotContainKey("last_message");
    }

    @Test
    void execute_explicitlySavedKeys_survivePersist() {
        executor.execute(plan(PlanStep.of("save_session_context", Map.of("context", Map.of("preferred_size", "M")))),
                "s1", "001", "remember I wear M", new HashMap<>());

        verify(sessionStore).put(eq("001"), eq("s1"), argThat(ctx -> "M".equals(ctx.get("preferred_size"))));
    }

    @Test
    void execute_noSuppliedContext_loadsFromStore() {
        when(sessionStore.get("001", "s1")).thenReturn(new HashMap<>(Map.of("preferred_category", "Fashion")));

        ExecutionOutcome outcome = executor.execute(plan(), "s1", "001", "hello", null);

        assertThat(outcome.context()).containsEntry("preferred_category", "Fashion");
    }

    @Test
    void execute_storeFailures_swallowed() {
        when(sessionStore.get(anyString(), anyString())).thenThrow(new SalesAgentException("redis down"));
        doThrow(new SalesAgentException("redis down")).when(sessionStore).put(anyString(), anyString(), anyMap());

        ExecutionOutcome outcome = executor.execute(plan(PlanStep.of("get_user_profile", Map.of())),
                "s1", "001", "who am I?", null);

        assertThat(outcome.response()).isEqualTo("Here you go.");
        assertThat(outcome.executionSteps()).singleElement().satisfies(r -> assertThat(r.success()).isTrue());
    }

    @Test
    void execute_responderFails_inventoryFallbackReply() {
        when(responseGenerator.generate(anyString(), any(), anyList(), anyMap()))
                .thenThrow(new CompletionException("provider down"));

        ExecutionOutcome outcome = executor.execute(plan(PlanStep.of("check_inventory", Map.of("sku", "SKU-002"))),
                "s1", "001", "in stock?", new HashMap<>());

        assertThat(outcome.response()).isEqualTo("The product is available, with quantity 3 at location warehouse.");
    }

    @Test
    void fallbackResponse_outOfStockAndGeneric() {
        StepResult outOfStock = StepResult.succeeded("check_inventory", Map.of(),
                Map.of("available", false, "quantity", 0));

        assertThat(PlanExecutor.fallbackResponse(plan(), List.of(outOfStock)))
                .isEqualTo("I'm sorry, but this product is currently out of stock.");
        assertThat(PlanExecutor.fallbackResponse(plan(), List.of()))
                .isEqualTo("I've processed your request about 'test intent'.");
    }

    @Test
    void fallbackResponse_partialFailure_doesNotClaimSuccess() {
        StepResult offers = StepResult.succeeded("apply_offers", Map.of(), Map.of("final_price", 900));
        StepResult payment = StepResult.failed("calculate_payment", Map.of(), "Tool 'calculate_payment' not found");

        assertThat(PlanExecutor.fallbackResponse(plan(), List.of(offers, payment)))
                .isEqualTo("I've processed your request about 'test intent', but 1 of 2 steps could not be "
                        + "completed. Please try again.")
                .doesNotContain("successfully");
    }

    @Test
    void execute_emptyPlan_noToolCalls() {
        ExecutionOutcome outcome = executor.execute(Plan.fallback(), "s1", "001", "???", new HashMap<>());

        assertThat(outcome.executionSteps()).isEmpty();
        verify(sessionStore, never()).get(anyString(), anyString());
    }

    private static Plan plan(PlanStep... steps) {
        return new Plan("test intent", List.of(steps), "friendly", steps.length > 0);
    }

    private interface Body {
        Object apply(Map<String, Object> params) throws Exception;
    }

    private record StubTool(String name, Body body) implements SalesTool {

        @Override
        public String getName() {
            return name;
        }

        @Override
        public String getDescription() {
            return name;
        }

        @Override
        public Set<String> getRequiredParams() {
            return Set.of();
        }

        @Override
        public Set<String> getAllowedParams() {
            return Set.of("sku", "size", "product_id", "cart", "user_id", "context");
        }

        @Override
        public Object execute(Map<String, Object> params) throws Exception {
            return body.apply(params);
        }
    }
}
