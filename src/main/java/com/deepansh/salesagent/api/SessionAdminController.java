package com.deepansh.salesagent.api;

import com.deepansh.salesagent.core.SessionLockRegistry;
import com.deepansh.salesagent.session.SessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Operator access to a session context.
 *
 * GET    /api/v1/admin/session/{userId}/{sessionId}  — current context (empty object if none)
 * PUT    /api/v1/admin/session/{userId}/{sessionId}  — replace the context (history bounds still apply)
 * DELETE /api/v1/admin/session/{userId}/{sessionId}  — forget the session
 *
 * Writes take the session lock, so they wait for an in-flight run to finish.
 */
@RestController
@RequestMapping("/api/v1/admin/session")
@RequiredArgsConstructor
@Slf4j
public class SessionAdminController {

    private final SessionStore sessionStore;
    private final SessionLockRegistry lockRegistry;

    @GetMapping("/{userId}/{sessionId}")
    public ResponseEntity<Map<String, Object>> get(@PathVariable String userId, @PathVariable String sessionId) {
        return ResponseEntity.ok(sessionStore.get(userId, sessionId));
    }

    @PutMapping("/{userId}/{sessionId}")
    public ResponseEntity<Map<String, Object>> replace(@PathVariable String userId,
                                                       @PathVariable String sessionId,
                                                       @RequestBody Map<String, Object> context) {
        log.info("Admin replacing session context [userId={}, sessionId={}, keys={}]",
                userId, sessionId, context.keySet());
        lockRegistry.acquire(userId, sessionId);
        try {
            sessionStore.put(userId, sessionId, context);
            return ResponseEntity.ok(sessionStore.get(userId, sessionId));
        } finally {
            lockRegistry.release(userId, sessionId);
        }
    }

    @DeleteMapping("/{userId}/{sessionId}")
    public ResponseEntity<Void> clear(@PathVariable String userId, @PathVariable String sessionId) {
        log.info("Admin clearing session [userId={}, sessionId={}]", userId, sessionId);
        lockRegistry.acquire(userId, sessionId);
        try {
            sessionStore.clear(userId, sessionId);
        } finally {
            lockRegistry.release(userId, sessionId);
        }
        return ResponseEntity.noContent().build();
    }
}
