package com.deepansh.salesagent.tool.impl;

import com.deepansh.salesagent.session.SessionStore;
import com.deepansh.salesagent.tool.SalesTool;
import com.deepansh.salesagent.tool.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

@Component
@RequiredArgsConstructor
public class GetSessionContextTool implements SalesTool {

    private final SessionStore sessionStore;

    @Override
    public String getName() {
        return "get_session_context";
    }

    @Override
    public String getDescription() {
        return "Read the stored context (history, last intent, earlier step results) of a session.";
    }

    @Override
    public Set<String> getRequiredParams() {
        return Set.of("user_id", "session_id");
    }

    @Override
    public Set<String> getAllowedParams() {
        return getRequiredParams();
    }

    @Override
    public Object execute(Map<String, Object> params) {
        return sessionStore.get(
                ToolArguments.requireString(params, "user_id"),
                ToolArguments.requireString(params, "session_id"));
    }
}
