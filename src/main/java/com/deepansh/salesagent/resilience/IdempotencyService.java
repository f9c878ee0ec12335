package com.deepansh.salesagent.resilience;

import com.deepansh.salesagent.model.SalesAgentResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed replay protection for sales agent turns.
 *
 * A client that retries a turn (timeout, dropped connection) sends the same
 * Idempotency-Key; the first completed reply is cached and replayed, so the
 * plan does not run twice against the session context.
 *
 * Key pattern: sales:idempotency:{userId}:{idempotencyKey}
 * TTL: 24 hours
 *
 * Opt-in: turns without a key always run.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IdempotencyService {

    private static final String KEY_PREFIX = "sales:idempotency:";
    private static final Duration TTL = Duration.ofHours(24);
    // Stored while the first request is still running
    static final String IN_FLIGHT_SENTINEL = "__IN_FLIGHT__";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    /**
     * Returns the cached reply for this key, if a completed one exists.
     * An in-flight or unreadable entry counts as a miss.
     */
    public Optional<SalesAgentResponse> findCompleted(String userId, String idempotencyKey) {
        String existing = redisTemplate.opsForValue().get(buildKey(userId, idempotencyKey));
        if (existing == null) {
            return Optional.empty();
        }
        if (IN_FLIGHT_SENTINEL.equals(existing)) {
            log.info("Idempotency key still in flight [userId={}, key={}]", userId, idempotencyKey);
            return Optional.empty();
        }
        try {
            log.info("Idempotency hit [userId={}, key={}]", userId, idempotencyKey);
            return Optional.of(objectMapper.readValue(existing, SalesAgentResponse.class));
        } catch (JsonProcessingException e) {
            log.warn("Cached reply unreadable, running fresh [key={}]: {}", idempotencyKey, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /** SET NX with the in-flight sentinel. False when another request already holds the key. */
    public boolean claim(String userId, String idempotencyKey) {
        Boolean claimed = redisTemplate.opsForValue()
                .setIfAbsent(buildKey(userId, idempotencyKey), IN_FLIGHT_SENTINEL, TTL);
        return Boolean.TRUE.equals(claimed);
    }

    public void store(String userId, String idempotencyKey, SalesAgentResponse response) {
        try {
            redisTemplate.opsForValue().set(buildKey(userId, idempotencyKey),
                    objectMapper.writeValueAsString(response), TTL);
            log.debug("Stored idempotent reply [key={}]", idempotencyKey);
        } catch (JsonProcessingException e) {
            log.warn("Could not cache reply for idempotency key={}: {}", idempotencyKey, e.getOriginalMessage());
            release(userId, idempotencyKey);
        }
    }

    /** Frees the key after a failed run so the client can retry. */
    public void release(String userId, String idempotencyKey) {
        redisTemplate.delete(buildKey(userId, idempotencyKey));
        log.debug("Released idempotency key={}", idempotencyKey);
    }

    private static String buildKey(String userId, String idempotencyKey) {
        return KEY_PREFIX + userId + ":" + idempotencyKey;
    }
}
