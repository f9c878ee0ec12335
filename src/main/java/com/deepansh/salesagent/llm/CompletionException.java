package com.deepansh.salesagent.llm;

import com.deepansh.salesagent.exception.SalesAgentException;

/** Non-retryable completion failure: bad key, bad request, decommissioned model, empty answer. */
public class CompletionException extends SalesAgentException {

    public CompletionException(String message) {
        super(message);
    }

    public CompletionException(String message, Throwable cause) {
        super(message, cause);
    }
}
