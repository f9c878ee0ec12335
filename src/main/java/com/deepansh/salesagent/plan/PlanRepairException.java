package com.deepansh.salesagent.plan;

import com.deepansh.salesagent.exception.SalesAgentException;

/** The repair call answered, but not with a decodable plan object. */
public class PlanRepairException extends SalesAgentException {

    public PlanRepairException(String message) {
        super(message);
    }

    public PlanRepairException(String message, Throwable cause) {
        super(message, cause);
    }
}
