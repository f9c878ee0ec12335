package com.deepansh.salesagent.api;

import com.deepansh.salesagent.core.SalesAgentOrchestrator;
import com.deepansh.salesagent.model.SalesAgentRequest;
import com.deepansh.salesagent.model.SalesAgentResponse;
import com.deepansh.salesagent.resilience.IdempotencyService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.Optional;

/**
 * Sales agent endpoint with idempotency support.
 *
 * POST /api/v1/sales-agent
 *   Optional header: Idempotency-Key: <uuid>
 *   Duplicate turns within 24h return the cached reply.
 *   A duplicate arriving while the first is still running gets 409.
 *
 * GET /api/v1/sales-agent/health
 */
@RestController
@RequestMapping("/api/v1/sales-agent")
@RequiredArgsConstructor
@Slf4j
public class SalesAgentController {

    static final String IN_FLIGHT_REPLY =
            "This request is still being processed. Please retry shortly with the same Idempotency-Key.";

    private final SalesAgentOrchestrator orchestrator;
    private final IdempotencyService idempotencyService;

    @PostMapping
    public ResponseEntity<SalesAgentResponse> handle(
            @Valid @RequestBody SalesAgentRequest request,
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey) {

        log.info("Sales agent request [sessionId={}, userId={}, idempotencyKey={}]",
                request.getSessionId(), request.getUserId(), idempotencyKey);

        boolean idempotent = idempotencyKey != null && !idempotencyKey.isBlank();
        if (idempotent) {
            Optional<SalesAgentResponse> cached =
                    idempotencyService.findCompleted(request.getUserId(), idempotencyKey);
            if (cached.isPresent()) {
                return ResponseEntity.ok(cached.get());
            }
            if (!idempotencyService.claim(request.getUserId(), idempotencyKey)) {
                log.warn("Duplicate request while original in flight [userId={}, idempotencyKey={}]",
                        request.getUserId(), idempotencyKey);
                return ResponseEntity.status(HttpStatus.CONFLICT).body(SalesAgentResponse.builder()
                        .sessionId(request.getSessionId())
                        .response(IN_FLIGHT_REPLY)
                        .build());
            }
        }

        SalesAgentResponse response;
        try {
            response = orchestrator.handle(request);
        } catch (RuntimeException e) {
            if (idempotent) {
                idempotencyService.release(request.getUserId(), idempotencyKey);
            }
            throw e;
        }

        if (idempotent) {
            idempotencyService.store(request.getUserId(), idempotencyKey, response);
        }
        return ResponseEntity.ok(response);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }
}
