package com.deepansh.salesagent.session;

import com.deepansh.salesagent.config.EngineProperties;
import com.deepansh.salesagent.exception.SalesAgentException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Redis-backed session context store.
 *
 * Design decisions:
 * - Key pattern: sales:user:{userId}:session:{sessionId}
 * - One JSON object per key (atomic read/write of a whole context)
 * - TTL reset on every write — idle sessions expire on their own
 * - History lists and step results are bounded before every write
 *
 * Callers serialize read-modify-write per key (SessionLockRegistry);
 * this class does no locking of its own.
 */
@Component
@Slf4j
public class RedisSessionStore implements SessionStore {

    private static final String KEY_PREFIX = "sales:user:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final EngineProperties.Session props;

    public RedisSessionStore(StringRedisTemplate redisTemplate,
                             ObjectMapper objectMapper,
                             EngineProperties engineProperties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.props = engineProperties.getSession();
    }

    @Override
    public Map<String, Object> get(String userId, String sessionId) {
        String json = redisTemplate.opsForValue().get(buildKey(userId, sessionId));

        if (json == null) {
            log.debug("No session context [userId={}, sessionId={}]", userId, sessionId);
            return new LinkedHashMap<>();
        }

        try {
            Map<String, Object> context = objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() {});
            log.debug("Loaded session context with {} keys [userId={}, sessionId={}]",
                    context.size(), userId, sessionId);
            return context;
        } catch (JsonProcessingException e) {
            log.error("Unreadable session context, starting empty [userId={}, sessionId={}]",
                    userId, sessionId, e);
            return new LinkedHashMap<>();
        }
    }

    @Override
    public void put(String userId, String sessionId, Map<String, Object> context) {
        Map<String, Object> bounded = SessionContextBounds.apply(context,
                props.getMaxMessageHistory(), props.getMaxTraceHistory(), props.getMaxStepResults());

        String json;
        try {
            json = objectMapper.writeValueAsString(bounded);
        } catch (JsonProcessingException e) {
            throw new SalesAgentException("Session context is not serializable: " + e.getOriginalMessage(), e);
        }

        redisTemplate.opsForValue().set(buildKey(userId, sessionId), json, Duration.ofMinutes(props.getTtlMinutes()));
        log.debug("Saved session context with {} keys [userId={}, sessionId={}, ttl={}m]",
                bounded.size(), userId, sessionId, props.getTtlMinutes());
    }

    @Override
    public void clear(String userId, String sessionId) {
        redisTemplate.delete(buildKey(userId, sessionId));
        log.info("Cleared session context [userId={}, sessionId={}]", userId, sessionId);
    }

    private String buildKey(String userId, String sessionId) {
        return KEY_PREFIX + userId + ":session:" + sessionId;
    }
}
