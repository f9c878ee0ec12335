package com.deepansh.salesagent.api;

import com.deepansh.salesagent.observability.PlanRunTrace;
import com.deepansh.salesagent.observability.TraceService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Read-only access to plan run traces.
 *
 * GET /api/v1/traces/{userId}?limit=50         — newest traces for a user
 * GET /api/v1/traces/session/{sessionId}       — traces for one session
 * GET /api/v1/traces/{userId}/analytics        — latency, 24h volume, status breakdown
 */
@RestController
@RequestMapping("/api/v1/traces")
@RequiredArgsConstructor
public class ObservabilityController {

    private static final int MAX_LIMIT = 500;

    private final TraceService traceService;

    @GetMapping("/{userId}")
    public ResponseEntity<List<PlanRunTrace>> userTraces(@PathVariable String userId,
                                                         @RequestParam(defaultValue = "50") int limit) {
        int bounded = Math.max(1, Math.min(limit, MAX_LIMIT));
        return ResponseEntity.ok(traceService.getTracesForUser(userId).stream().limit(bounded).toList());
    }

    @GetMapping("/session/{sessionId}")
    public ResponseEntity<List<PlanRunTrace>> sessionTraces(@PathVariable String sessionId) {
        return ResponseEntity.ok(traceService.getTracesForSession(sessionId));
    }

    @GetMapping("/{userId}/analytics")
    public ResponseEntity<Map<String, Object>> analytics(@PathVariable String userId) {
        return ResponseEntity.ok(traceService.getAnalytics(userId));
    }
}
