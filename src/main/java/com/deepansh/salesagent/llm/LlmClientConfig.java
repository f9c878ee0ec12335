package com.deepansh.salesagent.llm;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Factory that creates the provider completion client based on LLM_PROVIDER.
 * The bean is the raw client; ResilientCompletionClient wraps it and is what
 * the planner, repair service and responder get injected.
 */
@Configuration
@Slf4j
public class LlmClientConfig {

    @Value("${llm.provider:groq}")
    private String provider;

    // OpenAI
    @Value("${llm.openai.api-key:}")       private String openAiKey;
    @Value("${llm.openai.base-url}")       private String openAiBaseUrl;
    @Value("${llm.openai.model}")          private String openAiModel;
    @Value("${llm.openai.max-tokens:1024}") private int openAiMaxTokens;
    @Value("${llm.openai.temperature:0.2}") private double openAiTemp;

    // Groq
    @Value("${llm.groq.api-key:}")       private String groqKey;
    @Value("${llm.groq.base-url}")       private String groqBaseUrl;
    @Value("${llm.groq.model}")          private String groqModel;
    @Value("${llm.groq.max-tokens:1024}") private int groqMaxTokens;
    @Value("${llm.groq.temperature:0.2}") private double groqTemp;

    // Gemini
    @Value("${llm.gemini.api-key:}")       private String geminiKey;
    @Value("${llm.gemini.base-url}")       private String geminiBaseUrl;
    @Value("${llm.gemini.model}")          private String geminiModel;
    @Value("${llm.gemini.max-tokens:1024}") private int geminiMaxTokens;
    @Value("${llm.gemini.temperature:0.2}") private double geminiTemp;

    @PostConstruct
    public void logActiveProvider() {
        LlmProviderProperties active = activeProps();
        log.info("================================================================");
        log.info("  Active LLM Provider : {}", active.getName().toUpperCase());
        log.info("  Model               : {}", active.getModel());
        log.info("  Key                 : {}", active.maskedKey());
        log.info("================================================================");
        if (active.getApiKey() == null || active.getApiKey().isBlank()) {
            log.error("  {} API key not set! Set env var: {}_API_KEY",
                    active.getName(), active.getName().toUpperCase());
        }
    }

    @Bean("providerCompletionClient")
    public CompletionClient providerCompletionClient(
            @Qualifier("llmRestClientBuilder") RestClient.Builder builder) {
        return new GenericCompletionClient(activeProps(), builder.clone());
    }

    // ─── Props builders ───────────────────────────────────────────────────────

    LlmProviderProperties activeProps() {
        return switch (provider.toLowerCase()) {
            case "openai" -> LlmProviderProperties.builder()
                    .name("openai").apiKey(openAiKey).baseUrl(openAiBaseUrl).model(openAiModel)
                    .maxTokens(openAiMaxTokens).temperature(openAiTemp).build();
            case "gemini" -> LlmProviderProperties.builder()
                    .name("gemini").apiKey(geminiKey).baseUrl(geminiBaseUrl).model(geminiModel)
                    .maxTokens(geminiMaxTokens).temperature(geminiTemp).build();
            default -> LlmProviderProperties.builder()
                    .name("groq").apiKey(groqKey).baseUrl(groqBaseUrl).model(groqModel)
                    .maxTokens(groqMaxTokens).temperature(groqTemp).build();
        };
    }
}
