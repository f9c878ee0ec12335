package com.deepansh.salesagent.llm;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat-completions client — works with Groq, OpenAI, and Gemini.
 *
 * Error handling strategy:
 *
 * | Error                    | Action                                            |
 * |--------------------------|---------------------------------------------------|
 * | 401 invalid_api_key      | CompletionException (not retried)                 |
 * | 400 model_decommissioned | CompletionException with loud guidance message    |
 * | 429 rate limit           | TransientCompletionException (retried)            |
 * | 4xx other                | CompletionException (not retried)                 |
 * | 5xx server error         | TransientCompletionException (retried)            |
 * | network error / timeout  | ResourceAccessException from RestClient (retried) |
 * | no choices / no content  | CompletionException (not retried)                 |
 *
 * Retrying is not this class's job — see ResilientCompletionClient.
 */
@Slf4j
public class GenericCompletionClient implements CompletionClient {

    private final LlmProviderProperties props;
    private final RestClient restClient;

    public GenericCompletionClient(LlmProviderProperties props, RestClient.Builder restClientBuilder) {
        this.props = props;
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public String complete(String prompt, String systemPrompt) {
        Map<String, Object> requestBody = buildRequestBody(prompt, systemPrompt);

        log.debug("Sending completion to {} [model={}, promptChars={}]",
                props.getName(), props.getModel(), prompt == null ? 0 : prompt.length());

        Map<String, Object> response = restClient.post()
                .uri("/chat/completions")
                .body(requestBody)
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, (req, res) -> {
                    String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                    log.error("{} 4xx [{}]: {}", props.getName(), res.getStatusCode(), body);
                    handle4xxError(body, res.getStatusCode().value());
                })
                .onStatus(HttpStatusCode::is5xxServerError, (req, res) -> {
                    String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                    log.error("{} 5xx [{}]: {}", props.getName(), res.getStatusCode(), body);
                    throw new TransientCompletionException(
                            props.getName() + " server error [" + res.getStatusCode() + "]");
                })
                .body(new ParameterizedTypeReference<>() {});

        return extractContent(response);
    }

    /**
     * Maps provider 4xx bodies to the two exception types so the retry
     * policy only ever sees TransientCompletionException for rate limits.
     */
    private void handle4xxError(String body, int statusCode) {
        if (body.contains("model_decommissioned")) {
            log.error("================================================================");
            log.error("  MODEL DECOMMISSIONED: {} is no longer supported.", props.getModel());
            log.error("  Update llm.{}.model in application.yml", props.getName());
            log.error("================================================================");
            throw new CompletionException("Model '" + props.getModel() + "' is decommissioned");
        }

        if (statusCode == 401) {
            throw new CompletionException(
                    props.getName() + " API key is invalid. Check your "
                    + props.getName().toUpperCase() + "_API_KEY environment variable.");
        }

        if (statusCode == 429) {
            throw new TransientCompletionException(props.getName() + " rate limit exceeded");
        }

        throw new CompletionException(props.getName() + " client error [" + statusCode + "]");
    }

    private Map<String, Object> buildRequestBody(String prompt, String systemPrompt) {
        List<Map<String, Object>> messages = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(Map.of("role", "system", "content", systemPrompt));
        }
        messages.add(Map.of("role", "user", "content", prompt != null ? prompt : ""));

        Map<String, Object> body = new HashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", props.getMaxTokens());
        body.put("temperature", props.getTemperature());
        body.put("messages", messages);
        return body;
    }

    @SuppressWarnings("unchecked")
    private String extractContent(Map<String, Object> response) {
        if (response == null) {
            throw new CompletionException(props.getName() + " returned an empty body");
        }
        List<Map<String, Object>> choices = (List<Map<String, Object>>) response.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw new CompletionException(props.getName() + " returned no choices in response");
        }

        Map<String, Object> usage = (Map<String, Object>) response.get("usage");
        if (usage != null) {
            log.debug("Token usage — prompt={} completion={}",
                    usage.getOrDefault("prompt_tokens", 0), usage.getOrDefault("completion_tokens", 0));
        }

        Map<String, Object> message = (Map<String, Object>) choices.get(0).get("message");
        Object content = message == null ? null : message.get("content");
        if (!(content instanceof String text) || text.isBlank()) {
            throw new CompletionException(props.getName() + " returned an empty completion");
        }
        return text;
    }
}
