package com.wangbin.telemetry.core.store.tier;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.wangbin.telemetry.core.store.AbstractMetricsTier;
import com.wangbin.telemetry.core.store.TierLevel;
import com.wangbin.telemetry.core.store.TrafficPoint;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * 本地存储层级（基于Caffeine）
 * <p>
 * 每个资源一条按时间排序的序列；超过保留期没有写入的资源整体过期。
 */
@Slf4j
public class LocalMetricsTier extends AbstractMetricsTier {

    private final Cache<String, NavigableMap<Long, TrafficPoint>> series;

    public LocalMetricsTier(TierLevel level, Duration retention, long maxResources) {
        super(level, retention);
        this.series = Caffeine.newBuilder()
                .maximumSize(maxResources)
                .expireAfterWrite(retention)
                .recordStats()
                .build();
        log.info("本地存储层级初始化完成: tier={}, retention={}s, maxResources={}",
                level, retention.getSeconds(), maxResources);
    }

    @Override
    protected void doAppend(String resourceId, TrafficPoint point, long expireBefore) {
        // compute 刷新写入时间，活跃资源不会整体过期
        series.asMap().compute(resourceId, (id, existing) -> {
            NavigableMap<Long, TrafficPoint> target = existing != null ? existing : new ConcurrentSkipListMap<>();
            target.put(point.getTimestamp(), point);
            target.headMap(expireBefore, false).clear();
            return target;
        });
    }

    @Override
    protected List<TrafficPoint> doRange(String resourceId, long start, long end) {
        NavigableMap<Long, TrafficPoint> points = series.getIfPresent(resourceId);
        if (points == null || start > end) {
            return List.of();
        }
        return new ArrayList<>(points.subMap(start, true, end, true).values());
    }

    @Override
    protected Map<String, Object> getMediumStatistics() {
        CacheStats stats = series.stats();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("resources", series.estimatedSize());
        result.put("evictionCount", stats.evictionCount());
        result.put("hitRate", stats.hitRate());
        return result;
    }
}
