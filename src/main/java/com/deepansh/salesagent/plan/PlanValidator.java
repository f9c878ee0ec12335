package com.deepansh.salesagent.plan;

import com.deepansh.salesagent.config.EngineProperties;
import com.deepansh.salesagent.tool.ToolCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Turns an untrusted proposal into a {@link Plan} the executor can run, or
 * into the fixed fallback plan.
 *
 * Order of work:
 * <ol>
 *   <li>intent enforcement: inject recommend_products / check_inventory when the
 *       user clearly asked for products or stock and the proposal forgot</li>
 *   <li>structural checks against the tool catalog</li>
 *   <li>on errors, one guardrailed repair, re-validated without further repair</li>
 *   <li>otherwise {@link Plan#fallback()}</li>
 * </ol>
 * The caller's raw plan is never mutated; everything works on a copy.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PlanValidator {

    static final String RECOMMEND = "recommend_products";
    static final String CHECK_INVENTORY = "check_inventory";

    private final ToolCatalog toolCatalog;
    private final PlanRepairService repairService;
    private final EngineProperties engineProperties;

    public ValidationResult validate(Object rawPlan, String rawProposalText, String userMessage) {
        return validate(rawPlan, rawProposalText, userMessage, true);
    }

    private ValidationResult validate(Object rawPlan, String rawProposalText, String userMessage,
                                      boolean allowRepair) {
        if (!(rawPlan instanceof Map<?, ?> rawMap)) {
            log.warn("Plan rejected: proposal is not a JSON object [type={}]",
                    rawPlan == null ? "null" : rawPlan.getClass().getSimpleName());
            return ValidationResult.rejected(List.of("Plan must be a JSON object"));
        }

        Map<String, Object> plan = copyOf(rawMap);
        enforceIntent(plan, userMessage);

        List<String> errors = checkStructure(plan);
        if (errors.isEmpty()) {
            return ValidationResult.accepted(toPlan(plan), false);
        }
        log.info("Plan failed structural checks [errors={}]", errors);

        if (allowRepair && engineProperties.getRepair().isEnabled()
                && rawProposalText != null && !rawProposalText.isBlank()) {
            try {
                Map<String, Object> repaired = repairService.repair(plan, rawProposalText);
                ValidationResult second = validate(repaired, "", userMessage, false);
                if (second.valid()) {
                    log.info("Plan accepted after repair [intent={}]", second.plan().intent());
                    return ValidationResult.accepted(second.plan(), true);
                }
                second.errors().forEach(e -> errors.add("Repair fix failed: " + e));
            } catch (SemanticViolationException e) {
                log.warn("Repair rejected by guardrails: {}", e.getMessage());
                errors.add("Repair violated constraints: " + e.getMessage());
            } catch (RuntimeException e) {
                log.warn("Repair attempt failed: {}", e.getMessage());
                errors.add("Repair error: " + e.getMessage());
            }
        }

        log.warn("Plan rejected, using fallback [errors={}]", errors);
        return ValidationResult.rejected(errors);
    }

    // ─── Intent enforcement ───────────────────────────────────────────────────

    /**
     * Only touches plans whose steps are a list (or missing). A malformed
     * steps value is left for the structural checks to report.
     */
    private void enforceIntent(Map<String, Object> plan, String userMessage) {
        Object rawSteps = plan.get("steps");
        if (rawSteps != null && !(rawSteps instanceof List)) return;

        @SuppressWarnings("unchecked")
        List<Object> steps = rawSteps == null ? new ArrayList<>() : (List<Object>) rawSteps;
        boolean injected = false;

        if (IntentHeuristics.mentionsSizeOrStock(userMessage) && !hasAction(steps, CHECK_INVENTORY)) {
            steps.add(step(CHECK_INVENTORY, new LinkedHashMap<>()));
            injected = true;
            log.info("Injected {} step for size/stock request", CHECK_INVENTORY);
        }

        if (IntentHeuristics.mentionsProducts(userMessage) && !hasAction(steps, RECOMMEND)) {
            Optional<IntentHeuristics.Gender> gender = IntentHeuristics.detectGender(userMessage);
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("category", IntentHeuristics.categoryFor(gender));
            gender.ifPresent(g -> params.put("gender", g.value()));

            steps.add(0, step(RECOMMEND, params));
            plan.put("needs_side_effects", true);
            injected = true;
            log.info("Injected {} step for product request [params={}]", RECOMMEND, params);
        }

        if (injected) {
            plan.put("steps", steps);
        }
    }

    private static boolean hasAction(List<Object> steps, String action) {
        return steps.stream()
                .anyMatch(s -> s instanceof Map<?, ?> m && action.equals(m.get("action")));
    }

    private static Map<String, Object> step(String action, Map<String, Object> params) {
        Map<String, Object> step = new LinkedHashMap<>();
        step.put("action", action);
        step.put("params", params);
        return step;
    }

    // ─── Structural checks ────────────────────────────────────────────────────

    private List<String> checkStructure(Map<String, Object> plan) {
        List<String> errors = new ArrayList<>();

        if (plan.get("_parse_error") != null) {
            errors.add("Planner output could not be parsed: " + plan.get("_parse_error"));
        }

        for (String field : List.of("intent", "steps", "response_style")) {
            if (!plan.containsKey(field)) {
                errors.add("Missing required field: " + field);
            }
        }
        if (plan.containsKey("intent") && !(plan.get("intent") instanceof String)) {
            errors.add("Field 'intent' must be a string");
        }
        if (plan.containsKey("response_style") && !(plan.get("response_style") instanceof String)) {
            errors.add("Field 'response_style' must be a string");
        }

        Object rawSteps = plan.get("steps");
        if (plan.containsKey("steps") && !(rawSteps instanceof List)) {
            errors.add("Steps must be a list");
        }
        List<?> steps = rawSteps instanceof List<?> l ? l : List.of();
        for (int i = 0; i < steps.size(); i++) {
            errors.addAll(checkStep(steps.get(i), i));
        }

        Object sideEffects = plan.get("needs_side_effects");
        if (sideEffects == null) {
            plan.put("needs_side_effects", !steps.isEmpty());
        } else if (!(sideEffects instanceof Boolean)) {
            errors.add("Field 'needs_side_effects' must be a boolean");
        } else if ((Boolean) sideEffects && rawSteps instanceof List && steps.isEmpty()) {
            errors.add("needs_side_effects is true but the plan has no steps");
        }

        return errors;
    }

    private List<String> checkStep(Object rawStep, int i) {
        if (!(rawStep instanceof Map<?, ?> step)) {
            return List.of("Step " + i + " must be an object");
        }

        Object action = step.get("action");
        if (!(action instanceof String name) || name.isBlank()) {
            return List.of("Step " + i + " is missing 'action'");
        }
        if (!toolCatalog.contains(name)) {
            return List.of("Step " + i + " has invalid action '" + name + "'. Available: "
                    + String.join(", ", toolCatalog.actionNames()));
        }

        Object params = step.get("params");
        if (params != null && !(params instanceof Map)) {
            return List.of("Step " + i + " (action: " + name + ") params must be an object");
        }
        Map<?, ?> paramMap = params == null ? Map.of() : (Map<?, ?>) params;

        TreeSet<String> missing = new TreeSet<>(toolCatalog.requiredParams(name));
        missing.removeIf(paramMap::containsKey);
        if (!missing.isEmpty()) {
            return List.of("Step " + i + " (action: " + name + ") missing required parameters: "
                    + String.join(", ", missing));
        }
        return List.of();
    }

    // ─── Conversion ───────────────────────────────────────────────────────────

    @SuppressWarnings("unchecked")
    private static Plan toPlan(Map<String, Object> plan) {
        List<PlanStep> steps = new ArrayList<>();
        for (Object s : (List<Object>) plan.get("steps")) {
            Map<String, Object> step = (Map<String, Object>) s;
            steps.add(PlanStep.of((String) step.get("action"), (Map<String, Object>) step.get("params")));
        }
        return new Plan(
                (String) plan.get("intent"),
                steps,
                (String) plan.get("response_style"),
                (Boolean) plan.get("needs_side_effects"));
    }

    /** Copies the plan, its steps list and each step map; params are copied when steps are built. */
    private static Map<String, Object> copyOf(Map<?, ?> raw) {
        Map<String, Object> copy = new LinkedHashMap<>();
        raw.forEach((k, v) -> copy.put(String.valueOf(k), v));

        if (copy.get("steps") instanceof List<?> steps) {
            List<Object> stepsCopy = new ArrayList<>();
            for (Object s : steps) {
                if (s instanceof Map<?, ?> m) {
                    Map<String, Object> stepCopy = new LinkedHashMap<>();
                    m.forEach((k, v) -> stepCopy.put(String.valueOf(k), v));
                    stepsCopy.add(stepCopy);
                } else {
                    stepsCopy.add(s);
                }
            }
            copy.put("steps", stepsCopy);
        }
        return copy;
    }
}
