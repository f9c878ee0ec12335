package com.deepansh.salesagent.tool.impl;

import com.deepansh.salesagent.store.UserStore;
import com.deepansh.salesagent.tool.SalesTool;
import com.deepansh.salesagent.tool.ToolArguments;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

/** Used when the user asks to be addressed differently ("call me Priya"). */
@Component
@Slf4j
@RequiredArgsConstructor
public class UpdateUserNameTool implements SalesTool {

    private final UserStore userStore;

    @Override
    public String getName() {
        return "update_user_name";
    }

    @Override
    public String getDescription() {
        return "Change the display name stored for a user.";
    }

    @Override
    public Set<String> getRequiredParams() {
        return Set.of("user_id", "name");
    }

    @Override
    public Set<String> getAllowedParams() {
        return getRequiredParams();
    }

    @Override
    public Object execute(Map<String, Object> params) {
        String userId = ToolArguments.string(params, "user_id");
        if (userId == null) {
            throw new IllegalArgumentException("user_id is required");
        }
        String name = ToolArguments.string(params, "name");
        if (name == null) {
            throw new IllegalArgumentException("name must be a non-empty string");
        }

        if (userStore.updateName(userId, name) == 0) {
            throw new IllegalArgumentException("User '" + userId + "' does not exist");
        }
        log.info("Updated display name [userId={}]", userId);

        return userStore.findProfile(userId)
                .orElseThrow(() -> new IllegalStateException("User '" + userId + "' vanished after update"))
                .toMap();
    }
}
