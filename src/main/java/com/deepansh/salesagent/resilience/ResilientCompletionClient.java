package com.deepansh.salesagent.resilience;

import com.deepansh.salesagent.llm.CompletionClient;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

/**
 * Decorator around the provider client that adds a bounded retry.
 *
 * Retry config (resilience4j.retry.instances.completionClient in application.yml):
 * - 2 attempts total (one retry), fixed 500ms wait
 * - retries TransientCompletionException and ResourceAccessException (timeouts, resets)
 * - CompletionException is ignored: bad keys and bad requests fail fast
 *
 * No fallback value here — every caller has its own deterministic fallback
 * (planner placeholder plan, repair-to-fallback, responder templates), so the
 * last exception is rethrown as-is.
 */
@Component
@Primary
@Slf4j
public class ResilientCompletionClient implements CompletionClient {

    static final String RETRY_NAME = "completionClient";

    private final CompletionClient delegate;
    private final Retry retry;

    public ResilientCompletionClient(@Qualifier("providerCompletionClient") CompletionClient delegate,
                                     RetryRegistry retryRegistry) {
        this.delegate = delegate;
        this.retry = retryRegistry.retry(RETRY_NAME);
        this.retry.getEventPublisher()
                .onRetry(e -> log.warn("Completion attempt {} failed, retrying: {}",
                        e.getNumberOfRetryAttempts(),
                        e.getLastThrowable() != null ? e.getLastThrowable().getMessage() : "unknown"))
                .onError(e -> log.error("Completion failed after {} attempts: {}",
                        e.getNumberOfRetryAttempts(),
                        e.getLastThrowable() != null ? e.getLastThrowable().getMessage() : "unknown"));
    }

    @Override
    public String complete(String prompt, String systemPrompt) {
        return retry.executeSupplier(() -> delegate.complete(prompt, systemPrompt));
    }
}
