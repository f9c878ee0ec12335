package com.deepansh.salesagent.session;

import com.deepansh.salesagent.config.EngineProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisSessionStoreTest {

    private static final String KEY = "sales:user:001:session:s1";

    private StringRedisTemplate redisTemplate;
    private ValueOperations<String, String> valueOps;
    private RedisSessionStore store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        valueOps = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        store = new RedisSessionStore(redisTemplate, new ObjectMapper(), new EngineProperties());
    }

    @Test
    void get_missingKey_emptyMutableMap() {
        Map<String, Object> context = store.get("001", "s1");

        assertThat(context).isEmpty();
        context.put("k", "v");
    }

    @Test
    void get_corruptJson_emptyMap() {
        when(valueOps.get(KEY)).thenReturn("{not json");

        assertThat(store.get("001", "s1")).isEmpty();
    }

    @Test
    void get_storedContext_decoded() {
        when(valueOps.get(KEY)).thenReturn("{\"last_intent\":\"recommend\",\"budget\":1500}");

        assertThat(store.get("001", "s1"))
                .containsEntry("last_intent", "recommend")
                .containsEntry("budget", 1500);
    }

    @Test
    void put_boundsHistoryAndSetsTtl() {
        Map<String, Object> context = new HashMap<>();
        context.put("trace_history", List.of(1, 2, 3, 4, 5, 6, 7));

        store.put("001", "s1", context);

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOps).set(eq(KEY), json.capture(), eq(Duration.ofMinutes(1440)));
        assertThat(json.getValue()).isEqualTo("{\"trace_history\":[3,4,5,6,7]}");
    }

    @Test
    void clear_deletesKey() {
        store.clear("001", "s1");

        verify(redisTemplate).delete(KEY);
    }
}
