package com.deepansh.salesagent.core;

import com.deepansh.salesagent.plan.PlanStep;
import com.deepansh.salesagent.tool.ToolCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns a step's planner-written parameters into the concrete ones a tool gets.
 *
 * <ul>
 *   <li>placeholders ({@code extracted_from_context}, {@code {{session_id}}},
 *       {@code {{user_id}}}) are replaced, recursively through maps and lists</li>
 *   <li>recommend_products inherits the stored personalization gender</li>
 *   <li>check_inventory gets a product_id inferred from earlier recommendations
 *       or the catalog (see ProductReferenceResolver)</li>
 *   <li>parameters the tool does not declare are dropped</li>
 * </ul>
 * Same inputs, same output: resolving already-resolved parameters changes nothing.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ParameterResolver {

    static final String FROM_CONTEXT = "extracted_from_context";
    static final String SESSION_MARKER = "{{session_id}}";
    static final String USER_MARKER = "{{user_id}}";

    private static final Set<String> PLACEHOLDERS = Set.of(FROM_CONTEXT, SESSION_MARKER, USER_MARKER);

    private final ToolCatalog toolCatalog;
    private final ProductReferenceResolver productReferenceResolver;

    public StepResolution resolve(PlanStep step, ResolutionContext ctx) {
        Map<String, Object> params = resolveParams(step.params(), ctx.sessionId(), ctx.userId(), ctx.context());

        StepResolution resolution = switch (step.action()) {
            case "recommend_products" -> {
                injectGender(params, ctx.context());
                yield StepResolution.resolved(params);
            }
            case "check_inventory" -> productReferenceResolver.resolveInventoryTarget(params, ctx.previousResults());
            default -> StepResolution.resolved(params);
        };

        Map<String, Object> allowed = retainAllowed(step.action(), resolution.params());
        return resolution.isFailure()
                ? StepResolution.failed(allowed, resolution.error())
                : StepResolution.resolved(allowed);
    }

    /** Placeholder substitution only; no tool-specific policy. Returns a new mutable map. */
    public Map<String, Object> resolveParams(Map<String, Object> params, String sessionId, String userId,
                                             Map<String, Object> context) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        params.forEach((key, value) -> resolved.put(key, resolveValue(key, value, sessionId, userId, context)));
        return resolved;
    }

    @SuppressWarnings("unchecked")
    private Object resolveValue(String key, Object value, String sessionId, String userId,
                                Map<String, Object> context) {
        if (value instanceof String s && PLACEHOLDERS.contains(s.strip())) {
            return resolvePlaceholder(key, s.strip(), sessionId, userId, context);
        }
        if (value instanceof Map<?, ?> nested) {
            return resolveParams((Map<String, Object>) nested, sessionId, userId, context);
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            list.forEach(item -> out.add(resolveValue(key, item, sessionId, userId, context)));
            return out;
        }
        return value;
    }

    /**
     * Key name decides first ("session"/"user" in the key), then a same-named
     * context entry, then the marker itself ({{session_id}} → session id).
     * An {@code extracted_from_context} nothing can fill stays as written.
     */
    private Object resolvePlaceholder(String key, String marker, String sessionId, String userId,
                                      Map<String, Object> context) {
        String k = key.toLowerCase(Locale.ROOT);
        if (k.contains("session")) return sessionId;
        if (k.contains("user")) return userId;
        if (context.containsKey(key)) return context.get(key);
        if (SESSION_MARKER.equals(marker)) return sessionId;
        if (USER_MARKER.equals(marker)) return userId;
        return marker;
    }

    private static void injectGender(Map<String, Object> params, Map<String, Object> context) {
        Object current = params.get("gender");
        if (current != null && !current.toString().isBlank()) return;
        if (context.get("personalization") instanceof Map<?, ?> p
                && p.get("gender") instanceof String g && !g.isBlank()) {
            params.put("gender", g);
        }
    }

    private Map<String, Object> retainAllowed(String action, Map<String, Object> params) {
        Set<String> allowed = toolCatalog.allowedParams(action);
        Map<String, Object> kept = new LinkedHashMap<>();
        params.forEach((k, v) -> {
            if (allowed.contains(k)) {
                kept.put(k, v);
            } else {
                log.debug("Dropping undeclared parameter [action={}, param={}]", action, k);
            }
        });
        return kept;
    }
}
