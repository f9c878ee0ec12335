package com.deepansh.salesagent.core;

import com.deepansh.salesagent.llm.ResponseGenerator;
import com.deepansh.salesagent.observability.RunContext;
import com.deepansh.salesagent.plan.Plan;
import com.deepansh.salesagent.plan.PlanStep;
import com.deepansh.salesagent.plan.StepResult;
import com.deepansh.salesagent.session.SessionContextBounds;
import com.deepansh.salesagent.session.SessionStore;
import com.deepansh.salesagent.tool.SalesTool;
import com.deepansh.salesagent.tool.ToolCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs a validated plan step by step.
 *
 * Per-request flow:
 * 1. Load context (supplied copy, or the session store)
 * 2. For each step: resolve params → dispatch tool → record result
 * 3. Phrase the reply (deterministic fallback if phrasing fails)
 * 4. Persist the updated context
 *
 * Failure isolation: a step that cannot be resolved, names an unknown tool
 * or throws becomes a failed StepResult; later steps still run. Context load
 * and persist failures are logged and swallowed, so the caller always gets
 * a reply.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PlanExecutor {

    static final String STEP_RESULT_KEY = "step_%d_result";
    private static final String SAVE_CONTEXT_ACTION = "save_session_context";

    private final ToolCatalog toolCatalog;
    private final ParameterResolver parameterResolver;
    private final ResponseGenerator responseGenerator;
    private final SessionStore sessionStore;

    public ExecutionOutcome execute(Plan plan, String sessionId, String userId, String userMessage,
                                    Map<String, Object> sessionContext) {
        return execute(plan, sessionId, userId, userMessage, sessionContext, new RunContext());
    }

    public ExecutionOutcome execute(Plan plan, String sessionId, String userId, String userMessage,
                                    Map<String, Object> sessionContext, RunContext runCtx) {
        Map<String, Object> context = loadContext(sessionId, userId, sessionContext);
        List<StepResult> results = new ArrayList<>();

        List<PlanStep> steps = plan.steps();
        for (int i = 0; i < steps.size(); i++) {
            PlanStep step = steps.get(i);
            long start = System.currentTimeMillis();

            StepResult result = executeStep(step, new ResolutionContext(sessionId, userId, context, results));
            results.add(result);
            runCtx.recordStep(result.step(), result.success(), System.currentTimeMillis() - start, result.error());

            if (result.success()) {
                context.put(STEP_RESULT_KEY.formatted(i), result.result());
                mergeSavedContext(result, context);
            }
            log.info("Step {} [{}] {} [sessionId={}]", i, step.action(),
                    result.success() ? "succeeded" : "failed: " + result.error(), sessionId);
        }

        String response = respond(userMessage, plan, results, context);
        persist(sessionId, userId, userMessage, plan, results, response, context);

        return new ExecutionOutcome(response, List.copyOf(results), context);
    }

    private StepResult executeStep(PlanStep step, ResolutionContext ctx) {
        Optional<SalesTool> tool = toolCatalog.find(step.action());
        if (tool.isEmpty()) {
            return StepResult.failed(step.action(), step.params(), "Tool '" + step.action() + "' not found");
        }

        StepResolution resolution = parameterResolver.resolve(step, ctx);
        if (resolution.isFailure()) {
            return StepResult.failed(step.action(), resolution.params(), resolution.error());
        }

        try {
            Object result = tool.get().execute(resolution.params());
            return StepResult.succeeded(step.action(), resolution.params(), result);
        } catch (Exception e) {
            log.warn("Tool [{}] threw [sessionId={}]: {}", step.action(), ctx.sessionId(), e.toString());
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return StepResult.failed(step.action(), resolution.params(), message);
        }
    }

    /** Keys a plan saved explicitly must survive the end-of-run persist, which writes this map. */
    private static void mergeSavedContext(StepResult result, Map<String, Object> context) {
        if (SAVE_CONTEXT_ACTION.equals(result.step()) && result.params().get("context") instanceof Map<?, ?> saved) {
            saved.forEach((k, v) -> context.put(String.valueOf(k), v));
        }
    }

    // ─── Phases ───────────────────────────────────────────────────────────────

    private Map<String, Object> loadContext(String sessionId, String userId, Map<String, Object> supplied) {
        if (supplied != null) {
            return new LinkedHashMap<>(supplied);
        }
        try {
            return new LinkedHashMap<>(sessionStore.get(userId, sessionId));
        } catch (RuntimeException e) {
            log.warn("Session context load failed, starting empty [userId={}, sessionId={}]: {}",
                    userId, sessionId, e.getMessage());
            return new LinkedHashMap<>();
        }
    }

    private String respond(String userMessage, Plan plan, List<StepResult> results, Map<String, Object> context) {
        try {
            return responseGenerator.generate(userMessage, plan, results, context);
        } catch (RuntimeException e) {
            log.warn("Response generation failed, using deterministic reply: {}", e.getMessage());
            return fallbackResponse(plan, results);
        }
    }

    static String fallbackResponse(Plan plan, List<StepResult> results) {
        Optional<Map<?, ?>> inventory = results.stream()
                .filter(r -> r.success() && "check_inventory".equals(r.step()))
                .map(StepResult::result)
                .filter(Map.class::isInstance)
                .<Map<?, ?>>map(r -> (Map<?, ?>) r)
                .findFirst();

        if (inventory.isPresent()) {
            Map<?, ?> inv = inventory.get();
            if (Boolean.TRUE.equals(inv.get("available"))) {
                return "The product is available, with quantity " + inv.get("quantity")
                        + " at location " + inv.get("location") + ".";
            }
            return "I'm sorry, but this product is currently out of stock.";
        }
        long failed = results.stream().filter(r -> !r.success()).count();
        if (failed > 0) {
            return "I've processed your request about '" + plan.intent() + "', but " + failed + " of "
                    + results.size() + " steps could not be completed. Please try again.";
        }
        return "I've processed your request about '" + plan.intent() + "'.";
    }

    private void persist(String sessionId, String userId, String userMessage, Plan plan,
                         List<StepResult> results, String response, Map<String, Object> context) {
        context.put("last_message", userMessage);
        context.put("last_intent", plan.intent());

        Map<String, Object> turn = new LinkedHashMap<>();
        turn.put("user", userMessage);
        turn.put("intent", plan.intent());
        turn.put("response", response);
        appendTo(context, SessionContextBounds.MESSAGE_HISTORY, turn);

        Map<String, Object> trace = new LinkedHashMap<>();
        trace.put("intent", plan.intent());
        trace.put("steps", results.stream().map(StepResult::toMap).toList());
        appendTo(context, SessionContextBounds.TRACE_HISTORY, trace);

        try {
            sessionStore.put(userId, sessionId, context);
        } catch (RuntimeException e) {
            log.error("Session context persist failed [userId={}, sessionId={}]: {}",
                    userId, sessionId, e.getMessage());
        }
    }

    private static void appendTo(Map<String, Object> context, String key, Object entry) {
        List<Object> list = context.get(key) instanceof List<?> existing
                ? new ArrayList<>(existing)
                : new ArrayList<>();
        list.add(entry);
        context.put(key, list);
    }
}
