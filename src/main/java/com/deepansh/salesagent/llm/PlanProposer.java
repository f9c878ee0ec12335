package com.deepansh.salesagent.llm;

import com.deepansh.salesagent.config.EngineProperties;
import com.deepansh.salesagent.tool.ToolCatalog;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The planner call: user message + bounded session context in, raw plan out.
 *
 * The output is untrusted. It is normalized and decoded here but not checked;
 * that is PlanValidator's job. Undecodable output becomes a placeholder plan
 * carrying the parse error and raw text, so validation and repair see it
 * like any other broken plan.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PlanProposer {

    public static final String PARSE_ERROR_INTENT = "Parse error - needs governance fix";

    /** Context keys forwarded to the planner verbatim when present. */
    private static final List<String> FORWARDED_KEYS = List.of(
            "last_message", "last_intent", "preferred_category", "budget", "loyalty_tier", "user_profile");

    private final CompletionClient completionClient;
    private final ToolCatalog toolCatalog;
    private final ObjectMapper objectMapper;
    private final EngineProperties engineProperties;

    /**
     * @param rawPlan decoded JSON (normally a Map), or the parse-error placeholder
     * @param rawText the completion text exactly as returned
     */
    public record Proposal(Object rawPlan, String rawText) {
    }

    public Proposal propose(String userMessage, String sessionId, String userId, Map<String, Object> context) {
        String systemPrompt = PromptTemplates.plannerSystemPrompt(toolCatalog.describe());
        String userPrompt = buildUserPrompt(userMessage, sessionId, userId, context);

        String raw = completionClient.complete(userPrompt, systemPrompt);
        String normalized = LlmOutputNormalizer.normalize(raw);

        try {
            Object decoded = objectMapper.readValue(normalized, Object.class);
            log.debug("Planner proposal decoded [sessionId={}, chars={}]", sessionId, raw.length());
            return new Proposal(decoded, raw);
        } catch (JsonProcessingException e) {
            log.warn("Planner output is not valid JSON [sessionId={}]: {}", sessionId, e.getOriginalMessage());
            return new Proposal(parseErrorPlaceholder(e.getOriginalMessage(), raw), raw);
        }
    }

    static Map<String, Object> parseErrorPlaceholder(String error, String raw) {
        Map<String, Object> placeholder = new LinkedHashMap<>();
        placeholder.put("intent", PARSE_ERROR_INTENT);
        placeholder.put("steps", new ArrayList<>());
        placeholder.put("response_style", "professional");
        placeholder.put("_parse_error", error);
        placeholder.put("_raw_response", raw);
        return placeholder;
    }

    String buildUserPrompt(String userMessage, String sessionId, String userId, Map<String, Object> context) {
        Map<String, Object> essential = new LinkedHashMap<>();
        FORWARDED_KEYS.forEach(k -> {
            if (context.containsKey(k)) essential.put(k, context.get(k));
        });

        if (context.get("personalization") instanceof Map<?, ?> p && !p.isEmpty()) {
            essential.put("personalization", p);
            if (p.get("gender") != null) essential.put("user_gender", p.get("gender"));
            if (p.get("preferred_size") != null) essential.put("user_preferred_size", p.get("preferred_size"));
        }

        List<Map<String, Object>> history = compactHistory(context.get("message_history"),
                engineProperties.getPlanner().getHistoryTurns(),
                engineProperties.getPlanner().getMaxCharsPerTurn());
        if (!history.isEmpty()) {
            essential.put("conversation_history", history);
        }

        String contextJson;
        try {
            contextJson = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(essential);
        } catch (JsonProcessingException e) {
            log.warn("Session context not serializable for planner prompt, sending none: {}", e.getOriginalMessage());
            contextJson = "{}";
        }

        return """
                User Message: "%s"
                User ID: %s
                Session ID: %s

                Context (session, profile, personalization, recent conversation):
                %s

                Extract category, gender, product type and price range from the message first,
                fill gaps from personalization and history, then act. Generate a JSON action plan."""
                .formatted(userMessage, userId, sessionId, contextJson);
    }

    /** Last {@code maxTurns} turns, each field cut to {@code maxChars}. Tolerates junk entries. */
    public static List<Map<String, Object>> compactHistory(Object rawHistory, int maxTurns, int maxChars) {
        if (!(rawHistory instanceof List<?> list) || list.isEmpty()) return List.of();

        List<Map<String, Object>> compacted = new ArrayList<>();
        for (Object turn : list.subList(Math.max(0, list.size() - maxTurns), list.size())) {
            if (!(turn instanceof Map<?, ?> t)) continue;
            Map<String, Object> c = new LinkedHashMap<>();
            c.put("user", truncate(t.get("user"), maxChars));
            c.put("response", truncate(t.get("response"), maxChars));
            c.put("intent", t.get("intent") == null ? "" : t.get("intent").toString());
            compacted.add(c);
        }
        return compacted;
    }

    private static String truncate(Object value, int max) {
        String s = value == null ? "" : value.toString();
        return s.length() <= max ? s : s.substring(0, max);
    }
}
