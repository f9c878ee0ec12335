package com.deepansh.salesagent.plan;

import com.deepansh.salesagent.llm.CompletionClient;
import com.deepansh.salesagent.llm.LlmOutputNormalizer;
import com.deepansh.salesagent.llm.PromptTemplates;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One-shot, guardrailed plan repair.
 *
 * Asks the model to fix formatting only, then checks the answer did not
 * change what the user asked for: same number of steps, same set of
 * actions, and (for intents of three or more words) at least one shared
 * intent word. Anything else is a {@link SemanticViolationException}.
 *
 * Never retried here — the completion client already retried transient
 * transport failures, and a semantically wrong repair will not get better
 * on a second ask.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PlanRepairService {

    private final CompletionClient completionClient;
    private final ObjectMapper objectMapper;

    /**
     * @param invalidPlan  the plan as it failed validation
     * @param originalText the raw planner output it was decoded from (for diagnostics)
     * @return the repaired plan, already checked against the invariants
     */
    public Map<String, Object> repair(Map<String, Object> invalidPlan, String originalText) {
        RepairInvariants invariants = RepairInvariants.capture(invalidPlan);

        String planJson;
        try {
            planJson = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(invalidPlan);
        } catch (JsonProcessingException e) {
            throw new PlanRepairException("Invalid plan is not serializable: " + e.getOriginalMessage(), e);
        }

        log.info("Attempting plan repair [steps={}, actions={}, originalChars={}]",
                invariants.stepCount(), invariants.actions(), originalText == null ? 0 : originalText.length());

        String raw = completionClient.complete(PromptTemplates.repairUserPrompt(planJson),
                PromptTemplates.REPAIR_SYSTEM_PROMPT);
        String normalized = LlmOutputNormalizer.normalize(raw);

        Object decoded;
        try {
            decoded = objectMapper.readValue(normalized, Object.class);
        } catch (JsonProcessingException e) {
            throw new PlanRepairException("Repair output is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (!(decoded instanceof Map<?, ?> decodedMap)) {
            throw new PlanRepairException("Repair output is not a JSON object");
        }

        Map<String, Object> repaired = new LinkedHashMap<>();
        decodedMap.forEach((k, v) -> {
            // internal markers like _parse_error must not survive a repair
            if (k != null && !k.toString().startsWith("_")) repaired.put(k.toString(), v);
        });

        invariants.verify(repaired);
        log.info("Plan repair passed guardrails [steps={}]", invariants.stepCount());
        return repaired;
    }
}
