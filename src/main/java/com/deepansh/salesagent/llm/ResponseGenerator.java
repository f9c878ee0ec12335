package com.deepansh.salesagent.llm;

import com.deepansh.salesagent.config.EngineProperties;
import com.deepansh.salesagent.plan.IntentHeuristics;
import com.deepansh.salesagent.plan.Plan;
import com.deepansh.salesagent.plan.StepResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Phrases the final reply. Business facts come only from tool results;
 * the model is used for wording.
 *
 * Decision order:
 * <ol>
 *   <li>small talk with nothing executed → short chat reply (deterministic fallback if the call fails)</li>
 *   <li>intent unsupported_request → fixed capabilities message</li>
 *   <li>no successful step → fixed apology</li>
 *   <li>otherwise → phrasing call over the successful results and compact history</li>
 * </ol>
 * A failure of the phrasing call propagates; PlanExecutor owns that fallback.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ResponseGenerator {

    public static final String UNSUPPORTED_INTENT = "unsupported_request";

    static final String UNSUPPORTED_REPLY =
            "I might not be able to do exactly that yet, but I can help you with things like checking "
            + "whether items are in stock, suggesting products, looking up your loyalty benefits, "
            + "estimating order totals, and exploring delivery or pickup options.";

    static final String NO_RESULTS_REPLY =
            "I tried to process your request but ran into an unexpected issue. "
            + "Please try again or rephrase your question.";

    static final String SMALL_TALK_FALLBACK =
            "I'm doing well, thanks for asking! How can I help you with your shopping today?";

    private static final Set<String> CHAT_INTENTS = Set.of("", "small_talk", "general_chat", "greeting");

    private final CompletionClient completionClient;
    private final ObjectMapper objectMapper;
    private final EngineProperties engineProperties;

    public String generate(String userMessage, Plan plan, List<StepResult> steps, Map<String, Object> context) {
        String intent = plan.intent() == null ? "" : plan.intent().toLowerCase(Locale.ROOT).strip();
        List<StepResult> successful = steps.stream().filter(StepResult::success).toList();

        boolean smallTalk = IntentHeuristics.isSmallTalk(userMessage) || CHAT_INTENTS.contains(intent);
        if (smallTalk && successful.isEmpty()) {
            return smallTalk(userMessage, context);
        }
        if (smallTalk) {
            log.info("Small-talk signal but {} steps succeeded, phrasing tool results [intent={}]",
                    successful.size(), plan.intent());
        }

        if (UNSUPPORTED_INTENT.equals(intent)) {
            return UNSUPPORTED_REPLY;
        }
        if (successful.isEmpty()) {
            return NO_RESULTS_REPLY;
        }

        return completionClient.complete(buildPrompt(userMessage, plan, successful, context),
                PromptTemplates.RESPONDER_SYSTEM_PROMPT);
    }

    private String smallTalk(String userMessage, Map<String, Object> context) {
        Object last = context.get("last_message");
        String prompt = "User: " + userMessage
                + "\n\nPrevious message from this user (if any): " + (last == null ? "" : last)
                + "\n\nReply naturally, as a human assistant would.";
        try {
            return completionClient.complete(prompt, PromptTemplates.SMALL_TALK_SYSTEM_PROMPT);
        } catch (RuntimeException e) {
            log.warn("Small-talk completion failed, using canned reply: {}", e.getMessage());
            return SMALL_TALK_FALLBACK;
        }
    }

    private String buildPrompt(String userMessage, Plan plan, List<StepResult> successful,
                               Map<String, Object> context) {
        List<Map<String, Object>> toolResults = successful.stream().map(s -> {
            Map<String, Object> r = new LinkedHashMap<>();
            r.put("action", s.step());
            r.put("params", s.params());
            r.put("result", s.result());
            return r;
        }).toList();

        Map<String, Object> contextSummary = new LinkedHashMap<>();
        contextSummary.put("last_intent", context.get("last_intent"));
        contextSummary.put("last_message", context.get("last_message"));

        List<Map<String, Object>> history = PlanProposer.compactHistory(context.get("message_history"),
                engineProperties.getResponder().getHistoryTurns(),
                engineProperties.getResponder().getMaxCharsPerTurn());

        return "User message:\n" + userMessage
                + "\n\nIntent:\n" + plan.intent()
                + "\n\nTool results (JSON, for your reference only):\n" + json(toolResults)
                + "\n\nContext summary:\n" + json(contextSummary)
                + "\n\nUser explicitly mentioned product/sku IDs: " + IntentHeuristics.mentionsExplicitIds(userMessage)
                + "\n\nRecent conversation (most recent last):\n" + json(history)
                + "\n\nNow respond to the user. Do not reveal raw JSON or internal structures.";
    }

    private String json(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.debug("Falling back to toString for prompt payload: {}", e.getOriginalMessage());
            return String.valueOf(value);
        }
    }
}
