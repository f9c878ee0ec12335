package com.deepansh.salesagent.llm;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Connection settings for the one provider the engine talks to.
 * Both the planner and the responder/repair calls share it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LlmProviderProperties {
    private String name;
    private String apiKey;
    private String baseUrl;
    private String model;
    private int maxTokens;
    private double temperature;

    /** First 8 and last 4 characters, for startup logging. Never log the full key. */
    public String maskedKey() {
        if (apiKey == null || apiKey.isBlank()) return "<unset>";
        if (apiKey.length() <= 12) return "****";
        return apiKey.substring(0, 8) + "..." + apiKey.substring(apiKey.length() - 4);
    }
}
