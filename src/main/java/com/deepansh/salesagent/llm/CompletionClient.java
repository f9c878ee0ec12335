package com.deepansh.salesagent.llm;

/**
 * Text-in / text-out access to the language model.
 *
 * Implementations either return the model's text or throw:
 * {@link TransientCompletionException} for failures worth retrying (5xx, 429),
 * {@link CompletionException} for everything that will fail the same way again.
 * Network timeouts surface as Spring's {@code ResourceAccessException}.
 */
public interface CompletionClient {

    /**
     * @param prompt       the user-turn content
     * @param systemPrompt optional system instruction; null or blank means none
     * @return the raw completion text (may still contain prose or fences)
     */
    String complete(String prompt, String systemPrompt);
}
