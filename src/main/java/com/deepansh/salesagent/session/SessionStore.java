package com.deepansh.salesagent.session;

import java.util.Map;

/**
 * Per-(user, session) context store. The context is an open JSON object;
 * the engine owns a handful of keys (last_message, last_intent,
 * message_history, trace_history, step_N_result) and leaves the rest alone.
 */
public interface SessionStore {

    /** Never null; a missing, expired or unreadable entry is an empty mutable map. */
    Map<String, Object> get(String userId, String sessionId);

    /** Bounds the context and overwrites the stored entry. */
    void put(String userId, String sessionId, Map<String, Object> context);

    void clear(String userId, String sessionId);
}
