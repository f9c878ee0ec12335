package com.deepansh.salesagent.tool.impl;

import com.deepansh.salesagent.session.SessionStore;
import com.deepansh.salesagent.tool.SalesTool;
import com.deepansh.salesagent.tool.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Merges the supplied keys into the stored session context.
 * The engine persists its own bookkeeping after the plan anyway; this tool
 * is for plans that explicitly want to remember something (a preference, a cart).
 */
@Component
@RequiredArgsConstructor
public class SaveSessionContextTool implements SalesTool {

    private final SessionStore sessionStore;

    @Override
    public String getName() {
        return "save_session_context";
    }

    @Override
    public String getDescription() {
        return "Merge key/value pairs into the stored context of a session.";
    }

    @Override
    public Set<String> getRequiredParams() {
        return Set.of("user_id", "session_id", "context");
    }

    @Override
    public Set<String> getAllowedParams() {
        return getRequiredParams();
    }

    @Override
    public Object execute(Map<String, Object> params) {
        String userId = ToolArguments.requireString(params, "user_id");
        String sessionId = ToolArguments.requireString(params, "session_id");
        Map<String, Object> updates = ToolArguments.map(params, "context");

        Map<String, Object> merged = new LinkedHashMap<>(sessionStore.get(userId, sessionId));
        merged.putAll(updates);
        sessionStore.put(userId, sessionId, merged);

        return Map.of("status", "saved", "keys", updates.keySet());
    }
}
