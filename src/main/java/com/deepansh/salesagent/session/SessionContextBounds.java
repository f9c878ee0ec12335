package com.deepansh.salesagent.session;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * FIFO caps applied to a session context before it is written.
 * Returns a new map; the input is left untouched.
 */
public final class SessionContextBounds {

    public static final String MESSAGE_HISTORY = "message_history";
    public static final String TRACE_HISTORY = "trace_history";

    private static final Pattern STEP_KEY = Pattern.compile("^step_(\\d+)_result$");

    private SessionContextBounds() {
    }

    public static Map<String, Object> apply(Map<String, Object> context,
                                            int maxMessages, int maxTraces, int maxStepResults) {
        Map<String, Object> bounded = new LinkedHashMap<>(context);
        trimList(bounded, MESSAGE_HISTORY, maxMessages);
        trimList(bounded, TRACE_HISTORY, maxTraces);
        trimStepResults(bounded, maxStepResults);
        return bounded;
    }

    private static void trimList(Map<String, Object> context, String key, int max) {
        if (!(context.get(key) instanceof List<?> list) || list.size() <= max) return;
        context.put(key, new ArrayList<>(list.subList(list.size() - max, list.size())));
    }

    /** Keeps the highest-numbered step_N_result keys. */
    private static void trimStepResults(Map<String, Object> context, int max) {
        List<String> stepKeys = context.keySet().stream()
                .filter(k -> STEP_KEY.matcher(k).matches())
                .sorted(Comparator.comparingInt(SessionContextBounds::stepIndex))
                .toList();
        if (stepKeys.size() <= max) return;
        stepKeys.subList(0, stepKeys.size() - max).forEach(context::remove);
    }

    private static int stepIndex(String key) {
        Matcher m = STEP_KEY.matcher(key);
        if (!m.matches()) return -1;
        try {
            return Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            return Integer.MAX_VALUE;
        }
    }
}
