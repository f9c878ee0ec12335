package com.deepansh.salesagent.core;

import com.deepansh.salesagent.llm.PlanProposer;
import com.deepansh.salesagent.model.ExecutionTrace;
import com.deepansh.salesagent.model.SalesAgentRequest;
import com.deepansh.salesagent.model.SalesAgentResponse;
import com.deepansh.salesagent.observability.RunContext;
import com.deepansh.salesagent.observability.TraceService;
import com.deepansh.salesagent.plan.PlanValidator;
import com.deepansh.salesagent.plan.ValidationResult;
import com.deepansh.salesagent.session.SessionStore;
import com.deepansh.salesagent.store.UserStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for one user turn: propose → validate → execute → reply.
 *
 * Per-request flow:
 * 1. Take the (user, session) lock
 * 2. Reject unknown users with a friendly reply
 * 3. Load the session context (empty if the store is unreachable)
 * 4. Ask the planner for a proposal, validate (and maybe repair) it
 * 5. Run the plan; the executor phrases the reply and persists context
 * 6. Always: release the lock, persist the run trace asynchronously
 *
 * Internal errors never reach the reply text; they go to the trace.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SalesAgentOrchestrator {

    static final String UNKNOWN_USER_REPLY =
            "It looks like your account needs attention before I can help. "
            + "Please check your user id or contact support.";

    static final String ERROR_REPLY =
            "Sorry, something went wrong while handling your request. Please try again in a moment.";

    private final PlanProposer planProposer;
    private final PlanValidator planValidator;
    private final PlanExecutor planExecutor;
    private final SessionStore sessionStore;
    private final UserStore userStore;
    private final SessionLockRegistry lockRegistry;
    private final TraceService traceService;

    public SalesAgentResponse handle(SalesAgentRequest request) {
        String sessionId = request.getSessionId();
        String userId = request.getUserId();
        String message = request.getMessage();

        log.info("Sales agent run started [sessionId={}, userId={}, message='{}']", sessionId, userId, message);

        RunContext runCtx = new RunContext();
        SalesAgentResponse response = null;
        Throwable error = null;

        lockRegistry.acquire(userId, sessionId);
        try {
            if (!knownUser(userId)) {
                log.warn("Rejecting request for unknown user [userId={}]", userId);
                error = new IllegalArgumentException("User '" + userId + "' does not exist");
                response = replyOnly(sessionId, UNKNOWN_USER_REPLY, error.getMessage());
                return response;
            }

            Map<String, Object> context = loadContext(userId, sessionId);

            PlanProposer.Proposal proposal = planProposer.propose(message, sessionId, userId, context);
            ValidationResult validation = planValidator.validate(proposal.rawPlan(), proposal.rawText(), message);

            ExecutionOutcome outcome = planExecutor.execute(
                    validation.plan(), sessionId, userId, message, context, runCtx);

            response = SalesAgentResponse.builder()
                    .sessionId(sessionId)
                    .response(outcome.response())
                    .executionTrace(ExecutionTrace.builder()
                            .plan(validation.plan().toMap())
                            .validationPassed(validation.valid())
                            .validationErrors(validation.errors())
                            .executionSteps(outcome.executionSteps())
                            .governanceUsed(validation.repaired())
                            .governanceFixes(validation.repaired() ? "Plan repaired after structural errors" : null)
                            .build())
                    .build();
            return response;

        } catch (RuntimeException e) {
            log.error("Sales agent run failed [sessionId={}, userId={}]", sessionId, userId, e);
            error = e;
            response = replyOnly(sessionId, ERROR_REPLY, e.getMessage());
            return response;
        } finally {
            lockRegistry.release(userId, sessionId);
            traceService.persistTrace(sessionId, userId, message, response, runCtx, error);
            log.info("Sales agent run complete [sessionId={}, steps={}, failed={}, latency={}ms]",
                    sessionId, runCtx.getStepRecords().size(), runCtx.failedSteps(), runCtx.elapsedMs());
        }
    }

    private boolean knownUser(String userId) {
        try {
            return userStore.exists(userId);
        } catch (DataAccessException e) {
            // catalog down: let the run proceed, tools report their own failures
            log.warn("User lookup failed, continuing [userId={}]: {}", userId, e.getMessage());
            return true;
        }
    }

    private Map<String, Object> loadContext(String userId, String sessionId) {
        try {
            return sessionStore.get(userId, sessionId);
        } catch (RuntimeException e) {
            log.warn("Session load failed, starting with empty context [userId={}, sessionId={}]: {}",
                    userId, sessionId, e.getMessage());
            return new LinkedHashMap<>();
        }
    }

    private static SalesAgentResponse replyOnly(String sessionId, String reply, String detail) {
        return SalesAgentResponse.builder()
                .sessionId(sessionId)
                .response(reply)
                .executionTrace(ExecutionTrace.builder()
                        .validationPassed(false)
                        .validationErrors(detail != null ? List.of(detail) : List.of())
                        .build())
                .build();
    }
}
