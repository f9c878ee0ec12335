package com.deepansh.salesagent.tool.impl;

import com.deepansh.salesagent.store.UserProfile;
import com.deepansh.salesagent.store.UserStore;
import com.deepansh.salesagent.tool.SalesTool;
import com.deepansh.salesagent.tool.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

/** Unknown users get the guest profile (bronze) rather than an error. */
@Component
@RequiredArgsConstructor
public class GetUserProfileTool implements SalesTool {

    private final UserStore userStore;

    @Override
    public String getName() {
        return "get_user_profile";
    }

    @Override
    public String getDescription() {
        return "Look up a user's name and loyalty tier.";
    }

    @Override
    public Set<String> getRequiredParams() {
        return Set.of("user_id");
    }

    @Override
    public Set<String> getAllowedParams() {
        return getRequiredParams();
    }

    @Override
    public Object execute(Map<String, Object> params) {
        String userId = ToolArguments.requireString(params, "user_id");
        return userStore.findProfile(userId)
                .orElseGet(() -> UserProfile.guest(userId))
                .toMap();
    }
}
