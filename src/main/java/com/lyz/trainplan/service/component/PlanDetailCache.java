package com.lyz.trainplan.service.component;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lyz.trainplan.model.vo.PlanDetailVO;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 计划详情缓存
 * Redis 不可用时只记日志，读写都退回数据库
 */
@Slf4j
@Component
public class PlanDetailCache {

    private static final String CACHE_KEY_PREFIX = "trainplan:plan:detail:";

    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public PlanDetailCache(StringRedisTemplate stringRedisTemplate,
                           ObjectMapper objectMapper,
                           @Value("${trainplan.cache.plan-detail-ttl-minutes:10}") long ttlMinutes) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.objectMapper = objectMapper;
        this.ttl = Duration.ofMinutes(ttlMinutes);
    }

    public PlanDetailVO get(Long planId) {
        try {
            String cached = stringRedisTemplate.opsForValue().get(key(planId));
            if (StringUtils.isBlank(cached)) {
                return null;
            }
            return objectMapper.readValue(cached, PlanDetailVO.class);
        } catch (Exception e) {
            log.warn("读取计划详情缓存失败, planId={}: {}", planId, e.getMessage());
            return null;
        }
    }

    public void put(Long planId, PlanDetailVO detail) {
        try {
            stringRedisTemplate.opsForValue().set(key(planId), objectMapper.writeValueAsString(detail), ttl);
        } catch (Exception e) {
            log.warn("写入计划详情缓存失败, planId={}: {}", planId, e.getMessage());
        }
    }

    public void evict(Long planId) {
        try {
            stringRedisTemplate.delete(key(planId));
        } catch (Exception e) {
            log.warn("清除计划详情缓存失败, planId={}: {}", planId, e.getMessage());
        }
    }

    private String key(Long planId) {
        return CACHE_KEY_PREFIX + planId;
    }
}
