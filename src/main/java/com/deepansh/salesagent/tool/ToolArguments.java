package com.deepansh.salesagent.tool;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;

/**
 * Lenient readers for planner-supplied parameters. Planners send "2" where
 * 2 is meant, and null where a key should have been left out.
 */
public final class ToolArguments {

    private ToolArguments() {
    }

    public static String string(Map<String, Object> params, String key) {
        Object v = params.get(key);
        if (v == null) return null;
        String s = v.toString().strip();
        return s.isEmpty() ? null : s;
    }

    public static String requireString(Map<String, Object> params, String key) {
        String s = string(params, key);
        if (s == null) {
            throw new IllegalArgumentException("Missing required parameter: " + key);
        }
        return s;
    }

    public static double number(Object v, double defaultValue) {
        if (v instanceof Number n) return n.doubleValue();
        if (v instanceof String s && !s.isBlank()) {
            try {
                return Double.parseDouble(s.strip());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Not a number: '" + s + "'");
            }
        }
        return defaultValue;
    }

    @SuppressWarnings("unchecked")
    public static List<Map<String, Object>> listOfMaps(Map<String, Object> params, String key) {
        Object v = params.get(key);
        if (v == null) return List.of();
        if (!(v instanceof List<?> list)) {
            throw new IllegalArgumentException("Parameter '" + key + "' must be a list");
        }
        for (Object item : list) {
            if (!(item instanceof Map)) {
                throw new IllegalArgumentException("Every entry of '" + key + "' must be an object");
            }
        }
        return (List<Map<String, Object>>) list;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> map(Map<String, Object> params, String key) {
        Object v = params.get(key);
        if (v == null) return Map.of();
        if (!(v instanceof Map)) {
            throw new IllegalArgumentException("Parameter '" + key + "' must be an object");
        }
        return (Map<String, Object>) v;
    }

    /** Money values rounded half-up to 2 decimals. */
    public static double round2(double value) {
        return BigDecimal.valueOf(value)
                .setScale(2, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
