package com.wangbin.telemetry.core.store.tier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wangbin.telemetry.core.store.AbstractMetricsTier;
import com.wangbin.telemetry.core.store.TierLevel;
import com.wangbin.telemetry.core.store.TrafficPoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Redis存储层级
 * <p>
 * 每个资源一个有序集合，score 为毫秒时间戳，成员为数据点的 JSON。
 * 键格式：{@code <prefix><tier>:<resourceId>}
 */
@Slf4j
public class RedisMetricsTier extends AbstractMetricsTier {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;

    private final AtomicLong totalDecodeErrors = new AtomicLong(0);

    public RedisMetricsTier(TierLevel level,
                            Duration retention,
                            StringRedisTemplate redisTemplate,
                            ObjectMapper objectMapper,
                            String keyPrefix) {
        super(level, retention);
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = keyPrefix != null ? keyPrefix : "";
        log.info("Redis存储层级初始化完成: tier={}, retention={}s, keyPrefix={}",
                level, retention.getSeconds(), this.keyPrefix);
    }

    String buildRedisKey(String resourceId) {
        return keyPrefix + level.name().toLowerCase(Locale.ROOT) + ":" + resourceId;
    }

    @Override
    protected void doAppend(String resourceId, TrafficPoint point, long expireBefore) throws JsonProcessingException {
        String redisKey = buildRedisKey(resourceId);
        String member = objectMapper.writeValueAsString(point);

        ZSetOperations<String, String> zSet = redisTemplate.opsForZSet();
        zSet.add(redisKey, member, point.getTimestamp());
        zSet.removeRangeByScore(redisKey, Double.NEGATIVE_INFINITY, expireBefore - 1);
        // 资源停止写入后整条序列随保留期过期
        redisTemplate.expire(redisKey, retention);
    }

    @Override
    protected List<TrafficPoint> doRange(String resourceId, long start, long end) {
        if (start > end) {
            return List.of();
        }
        String redisKey = buildRedisKey(resourceId);
        Set<String> members = redisTemplate.opsForZSet().rangeByScore(redisKey, start, end);
        if (members == null || members.isEmpty()) {
            return List.of();
        }

        List<TrafficPoint> points = new ArrayList<>(members.size());
        for (String member : members) {
            try {
                points.add(objectMapper.readValue(member, TrafficPoint.class));
            } catch (JsonProcessingException e) {
                totalDecodeErrors.incrementAndGet();
                log.warn("[{}] 数据点反序列化失败，已跳过: key={}, error={}", level, redisKey, e.getOriginalMessage());
            }
        }
        return points;
    }

    @Override
    protected Map<String, Object> getMediumStatistics() {
        return Map.of("keyPrefix", keyPrefix, "totalDecodeErrors", totalDecodeErrors.get());
    }
}
