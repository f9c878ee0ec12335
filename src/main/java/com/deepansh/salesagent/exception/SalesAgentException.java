package com.deepansh.salesagent.exception;

/**
 * Root of the engine's unchecked exception hierarchy.
 * Carries a message that is safe to log; never shown verbatim to end users.
 */
public class SalesAgentException extends RuntimeException {

    public SalesAgentException(String message) {
        super(message);
    }

    public SalesAgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
