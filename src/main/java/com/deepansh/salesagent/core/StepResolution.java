package com.deepansh.salesagent.core;

import java.util.Map;

/**
 * Resolved parameters, or the reason they could not be resolved.
 * A failed resolution short-circuits the step before dispatch.
 */
public record StepResolution(Map<String, Object> params, String error) {

    public static StepResolution resolved(Map<String, Object> params) {
        return new StepResolution(params, null);
    }

    public static StepResolution failed(Map<String, Object> params, String error) {
        return new StepResolution(params, error);
    }

    public boolean isFailure() {
        return error != null;
    }
}
