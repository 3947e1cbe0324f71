package com.wangbin.telemetry.core.store;

import com.wangbin.telemetry.common.exception.TelemetryException;
import com.wangbin.telemetry.common.utils.DurationUtil;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 分层历史存储
 * <p>
 * 写入同时进入所有层级（各层级自行汇总到自己的分辨率）；
 * 查询按起点年龄只选一个层级，结果超过上限时降采样。
 */
@Slf4j
public class TieredMetricsStore {

    public static final int DEFAULT_MAX_POINTS = 500;

    private final Map<TierLevel, MetricsTier> tiers = new EnumMap<>(TierLevel.class);
    private final Clock clock;
    private final int maxPoints;

    public TieredMetricsStore(Collection<? extends MetricsTier> tiers, Clock clock, int maxPoints) {
        for (MetricsTier tier : tiers) {
            if (this.tiers.put(tier.getLevel(), tier) != null) {
                throw new IllegalArgumentException("重复的存储层级: " + tier.getLevel());
            }
        }
        for (TierLevel level : TierLevel.values()) {
            if (!this.tiers.containsKey(level)) {
                throw new IllegalArgumentException("缺少存储层级: " + level);
            }
        }
        if (maxPoints <= 0) {
            throw new IllegalArgumentException("maxPoints must be positive: " + maxPoints);
        }
        this.clock = clock;
        this.maxPoints = maxPoints;
    }

    /**
     * 记录一个原始采样
     */
    public void record(String resourceId, TrafficPoint point) {
        if (resourceId == null || point == null) {
            return;
        }
        for (MetricsTier tier : tiers.values()) {
            try {
                tier.write(resourceId, point);
            } catch (RuntimeException e) {
                log.warn("写入存储层级失败: tier={}, resource={}, error={}", tier.getLevel(), resourceId, e.getMessage());
            }
        }
    }

    /**
     * 查询历史序列
     *
     * @param interval 步长，如 {@code 10s}、{@code 5m}、{@code PT1H}
     * @throws TelemetryException 步长无法解析、时间范围非法或存储读取失败
     */
    public HistorySeries getHistory(String resourceId, Instant start, Instant end, String interval) {
        Duration step = DurationUtil.parsePositive(interval);
        if (resourceId == null || resourceId.isBlank()) {
            throw TelemetryException.invalidTimeRange(resourceId, "资源ID不能为空");
        }
        if (start == null || end == null) {
            throw TelemetryException.invalidTimeRange(resourceId, "查询起止时间不能为空");
        }
        if (start.isAfter(end)) {
            throw TelemetryException.invalidTimeRange(resourceId, "查询起点晚于终点: start=" + start + ", end=" + end);
        }

        TierLevel level = selectTier(start);
        MetricsTier tier = tiers.get(level);

        List<TrafficPoint> points;
        try {
            points = tier.query(resourceId, start.toEpochMilli(), end.toEpochMilli(), step);
        } catch (RuntimeException e) {
            log.error("历史查询失败: tier={}, resource={}", level, resourceId, e);
            throw TelemetryException.storageFailure(resourceId, "历史查询失败: " + e.getMessage(), e);
        }

        boolean downsampled = points.size() > maxPoints;
        if (downsampled) {
            log.debug("历史数据降采样: resource={}, tier={}, {} -> ≤{}", resourceId, level, points.size(), maxPoints);
            points = Downsampler.downsample(points, maxPoints);
        }

        return HistorySeries.builder()
                .resourceId(resourceId)
                .tier(level)
                .start(start.toEpochMilli())
                .end(end.toEpochMilli())
                .intervalMillis(step.toMillis())
                .downsampled(downsampled)
                .points(List.copyOf(points))
                .build();
    }

    /**
     * 按查询起点距现在的时长选择层级
     */
    public TierLevel selectTier(Instant start) {
        Duration age = Duration.between(start, clock.instant());
        return TierLevel.forAge(age);
    }

    public int getMaxPoints() {
        return maxPoints;
    }

    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("maxPoints", maxPoints);
        for (MetricsTier tier : tiers.values()) {
            stats.put(tier.getLevel().name().toLowerCase(), tier.getStatistics());
        }
        return stats;
    }
}
