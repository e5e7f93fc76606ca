package com.lyz.trainplan.service.component;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.lyz.trainplan.model.vo.PlanDetailVO;
import com.lyz.trainplan.model.vo.PlanSummaryVO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class PlanDetailCacheTest {

    private StringRedisTemplate redisTemplate;
    private ValueOperations<String, String> valueOps;
    private ObjectMapper objectMapper;
    private PlanDetailCache cache;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        valueOps = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        cache = new PlanDetailCache(redisTemplate, objectMapper, 5);
    }

    @Test
    void put_then_get_uses_prefixed_key() throws Exception {
        PlanSummaryVO summary = new PlanSummaryVO();
        summary.setId(7L);
        summary.setStartDate(LocalDate.of(2024, 6, 3));
        PlanDetailVO detail = new PlanDetailVO();
        detail.setSummary(summary);
        detail.setTasks(List.of());

        cache.put(7L, detail);
        verify(valueOps).set(eq("trainplan:plan:detail:7"), anyString(), eq(Duration.ofMinutes(5)));

        when(valueOps.get("trainplan:plan:detail:7")).thenReturn(objectMapper.writeValueAsString(detail));
        PlanDetailVO loaded = cache.get(7L);
        assertNotNull(loaded);
        assertEquals(LocalDate.of(2024, 6, 3), loaded.getSummary().getStartDate());
    }

    @Test
    void miss_returns_null() {
        when(valueOps.get("trainplan:plan:detail:1")).thenReturn(null);

        assertNull(cache.get(1L));
    }

    @Test
    void redis_outage_degrades_to_miss() {
        when(valueOps.get(anyString())).thenThrow(new RedisConnectionFailureException("down"));
        when(redisTemplate.delete(anyString())).thenThrow(new RedisConnectionFailureException("down"));

        assertNull(cache.get(3L));
        assertDoesNotThrow(() -> cache.evict(3L));
    }

    @Test
    void corrupt_entry_is_treated_as_miss() {
        when(valueOps.get("trainplan:plan:detail:4")).thenReturn("{not json");

        assertNull(cache.get(4L));
    }
}
