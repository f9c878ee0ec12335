package com.deepansh.salesagent.llm;

import com.deepansh.salesagent.exception.SalesAgentException;

/** Provider hiccup (5xx, rate limit) — the completion retry policy retries these. */
public class TransientCompletionException extends SalesAgentException {

    public TransientCompletionException(String message) {
        super(message);
    }
}
