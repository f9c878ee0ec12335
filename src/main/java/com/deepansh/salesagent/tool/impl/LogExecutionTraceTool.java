package com.deepansh.salesagent.tool.impl;

import com.deepansh.salesagent.tool.SalesTool;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

/**
 * Lets a plan write an explicit audit line. Every run is traced to MongoDB
 * anyway (TraceService); this goes to the application log under its own logger
 * name so it can be routed separately.
 */
@Component
@Slf4j(topic = "sales-agent.audit")
@RequiredArgsConstructor
public class LogExecutionTraceTool implements SalesTool {

    private final ObjectMapper objectMapper;

    @Override
    public String getName() {
        return "log_execution_trace";
    }

    @Override
    public String getDescription() {
        return "Record an audit entry describing what was done for the user.";
    }

    @Override
    public Set<String> getRequiredParams() {
        return Set.of("trace");
    }

    @Override
    public Set<String> getAllowedParams() {
        return getRequiredParams();
    }

    @Override
    public Object execute(Map<String, Object> params) throws JsonProcessingException {
        Object trace = params.get("trace");
        if (trace == null) {
            throw new IllegalArgumentException("trace must not be null");
        }
        log.info("[audit] {}", objectMapper.writeValueAsString(trace));
        return Map.of("status", "logged");
    }
}
