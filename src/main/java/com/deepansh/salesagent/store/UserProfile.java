package com.deepansh.salesagent.store;

import java.util.LinkedHashMap;
import java.util.Map;

public record UserProfile(String userId, String name, String loyaltyTier) {

    public static final String DEFAULT_NAME = "Guest";
    public static final String DEFAULT_TIER = "bronze";

    public static UserProfile guest(String userId) {
        return new UserProfile(userId, DEFAULT_NAME, DEFAULT_TIER);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("user_id", userId);
        m.put("name", name);
        m.put("loyalty_tier", loyaltyTier);
        return m;
    }
}
