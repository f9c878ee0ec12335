package com.deepansh.salesagent.tool;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Static action → tool mapping, built once at startup.
 *
 * Spring injects every SalesTool bean; they are indexed by name. The catalog
 * is the single source of truth for which actions exist and what parameters
 * they require/accept: the validator, the resolver, the executor and the
 * planner prompt all read from here.
 */
@Component
@Slf4j
public class ToolCatalog {

    private final Map<String, SalesTool> tools;

    public ToolCatalog(List<SalesTool> toolBeans) {
        Map<String, SalesTool> indexed = new TreeMap<>();
        toolBeans.forEach(tool -> {
            SalesTool previous = indexed.put(tool.getName(), tool);
            if (previous != null) {
                throw new IllegalStateException("Duplicate tool name: " + tool.getName());
            }
            log.info("Registered tool: [{}] required={}", tool.getName(), tool.getRequiredParams());
        });
        this.tools = Collections.unmodifiableMap(indexed);
        log.info("Total tools registered: {}", tools.size());
    }

    public Optional<SalesTool> find(String action) {
        return action == null ? Optional.empty() : Optional.ofNullable(tools.get(action));
    }

    public boolean contains(String action) {
        return action != null && tools.containsKey(action);
    }

    /** Sorted, for stable error messages. */
    public Set<String> actionNames() {
        return tools.keySet();
    }

    public Set<String> requiredParams(String action) {
        return find(action).map(SalesTool::getRequiredParams).orElse(Set.of());
    }

    public Set<String> allowedParams(String action) {
        return find(action).map(SalesTool::getAllowedParams).orElse(Set.of());
    }

    /** One "- name(a, b): description" line per tool, for the planner prompt. */
    public String describe() {
        return tools.values().stream()
                .map(t -> "- " + t.getName()
                        + "(" + String.join(", ", new TreeSet<>(t.getAllowedParams())) + "): "
                        + t.getDescription())
                .collect(Collectors.joining("\n"));
    }
}
