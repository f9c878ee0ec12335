package com.deepansh.salesagent.plan;

import com.deepansh.salesagent.exception.SalesAgentException;

/**
 * A repaired plan changed what the user asked for (step count, action set or intent).
 * Fatal to that repair attempt; the validator falls back instead of retrying.
 */
public class SemanticViolationException extends SalesAgentException {

    public SemanticViolationException(String message) {
        super(message);
    }
}
