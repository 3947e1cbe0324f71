package com.wangbin.telemetry.core.store;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 存储层级模板
 * <p>
 * 负责按层级分辨率汇总写入、查询时合并未封口的桶以及按步长重新分桶，
 * 子类只实现介质相关的追加与区间读取。
 */
@Slf4j
public abstract class AbstractMetricsTier implements MetricsTier {

    protected final TierLevel level;
    protected final Duration retention;

    // 每个资源当前未封口的汇总桶，guarded by rollupLock
    private final Map<String, RollupAccumulator> openBuckets = new HashMap<>();
    private final Object rollupLock = new Object();
    // 最近一次清理闲置桶时的桶起点，guarded by rollupLock
    private long lastSweepBucket = Long.MIN_VALUE;

    // 统计信息
    protected final AtomicLong totalWrites = new AtomicLong(0);
    protected final AtomicLong totalAppends = new AtomicLong(0);
    protected final AtomicLong totalQueries = new AtomicLong(0);
    protected final AtomicLong totalLateSamples = new AtomicLong(0);
    protected final AtomicLong totalErrors = new AtomicLong(0);

    protected AbstractMetricsTier(TierLevel level, Duration retention) {
        if (retention == null || retention.isNegative() || retention.isZero()) {
            throw new IllegalArgumentException("retention must be positive: " + level);
        }
        this.level = level;
        this.retention = retention;
    }

    @Override
    public TierLevel getLevel() {
        return level;
    }

    @Override
    public void write(String resourceId, TrafficPoint point) {
        if (resourceId == null || point == null) {
            log.warn("[{}] 资源ID或数据点为空，跳过写入", level);
            return;
        }
        totalWrites.incrementAndGet();

        if (level.isRawResolution()) {
            appendSafely(resourceId, point);
            return;
        }

        long resolution = level.getResolution().toMillis();
        long bucketStart = alignToBucket(point.getTimestamp(), resolution);
        RollupAccumulator completed = null;
        List<Map.Entry<String, RollupAccumulator>> idle = List.of();
        synchronized (rollupLock) {
            if (bucketStart > lastSweepBucket) {
                lastSweepBucket = bucketStart;
                idle = removeIdleBuckets(resourceId, bucketStart - resolution);
            }
            RollupAccumulator current = openBuckets.get(resourceId);
            if (current != null && bucketStart < current.getBucketStart()) {
                totalLateSamples.incrementAndGet();
                log.debug("[{}] 迟到的采样被忽略: resource={}, timestamp={}", level, resourceId, point.getTimestamp());
            } else {
                if (current == null || bucketStart > current.getBucketStart()) {
                    completed = current;
                    current = new RollupAccumulator(bucketStart);
                    openBuckets.put(resourceId, current);
                }
                current.add(point);
            }
        }

        if (completed != null) {
            appendSafely(resourceId, completed.toPoint());
        }
        for (Map.Entry<String, RollupAccumulator> entry : idle) {
            appendSafely(entry.getKey(), entry.getValue().toPoint());
        }
    }

    /**
     * 取出已停止上报的资源的未封口桶（桶起点早于 before），由调用方写入介质；
     * 每个分辨率周期最多扫描一次，调用方持有 rollupLock
     */
    private List<Map.Entry<String, RollupAccumulator>> removeIdleBuckets(String activeResource, long before) {
        List<Map.Entry<String, RollupAccumulator>> idle = new ArrayList<>();
        Iterator<Map.Entry<String, RollupAccumulator>> it = openBuckets.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, RollupAccumulator> entry = it.next();
            if (!entry.getKey().equals(activeResource) && entry.getValue().getBucketStart() < before) {
                idle.add(Map.entry(entry.getKey(), entry.getValue()));
                it.remove();
            }
        }
        if (!idle.isEmpty()) {
            log.debug("[{}] 封存闲置资源的汇总桶: count={}", level, idle.size());
        }
        return idle;
    }

    @Override
    public List<TrafficPoint> query(String resourceId, long start, long end, Duration interval) {
        totalQueries.incrementAndGet();

        List<TrafficPoint> points = new ArrayList<>(doRange(resourceId, start, end));

        // 未封口的桶也参与查询，否则最近一个分辨率周期内的数据不可见
        if (!level.isRawResolution()) {
            TrafficPoint pending = null;
            synchronized (rollupLock) {
                RollupAccumulator open = openBuckets.get(resourceId);
                if (open != null && open.getBucketStart() >= start && open.getBucketStart() <= end) {
                    pending = open.toPoint();
                }
            }
            if (pending != null
                    && (points.isEmpty() || points.get(points.size() - 1).getTimestamp() < pending.getTimestamp())) {
                points.add(pending);
            }
        }

        return aggregate(points, interval);
    }

    /**
     * 按步长分桶取平均；步长不超过层级分辨率时原样返回，空桶不补点
     */
    protected List<TrafficPoint> aggregate(List<TrafficPoint> points, Duration interval) {
        if (points.isEmpty() || interval == null || interval.compareTo(level.getResolution()) <= 0) {
            return points;
        }
        long step = interval.toMillis();
        Map<Long, List<TrafficPoint>> buckets = new LinkedHashMap<>();
        for (TrafficPoint point : points) {
            buckets.computeIfAbsent(alignToBucket(point.getTimestamp(), step), k -> new ArrayList<>()).add(point);
        }
        List<TrafficPoint> result = new ArrayList<>(buckets.size());
        for (Map.Entry<Long, List<TrafficPoint>> entry : buckets.entrySet()) {
            result.add(TrafficPoint.average(entry.getValue(), entry.getKey()));
        }
        return result;
    }

    private void appendSafely(String resourceId, TrafficPoint point) {
        try {
            doAppend(resourceId, point, point.getTimestamp() - retention.toMillis());
            totalAppends.incrementAndGet();
        } catch (Exception e) {
            totalErrors.incrementAndGet();
            log.warn("[{}] 数据点写入失败: resource={}, error={}", level, resourceId, e.getMessage());
        }
    }

    static long alignToBucket(long timestamp, long step) {
        return Math.floorDiv(timestamp, step) * step;
    }

    @Override
    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("tier", level.name());
        stats.put("retentionSeconds", retention.getSeconds());
        stats.put("totalWrites", totalWrites.get());
        stats.put("totalAppends", totalAppends.get());
        stats.put("totalQueries", totalQueries.get());
        stats.put("totalLateSamples", totalLateSamples.get());
        stats.put("totalErrors", totalErrors.get());
        synchronized (rollupLock) {
            stats.put("openBuckets", openBuckets.size());
        }
        stats.putAll(getMediumStatistics());
        return stats;
    }

    protected Map<String, Object> getMediumStatistics() {
        return Map.of();
    }

    /**
     * 追加一个数据点，并清理早于 expireBefore 的数据
     */
    protected abstract void doAppend(String resourceId, TrafficPoint point, long expireBefore) throws Exception;

    /**
     * 读取 [start, end] 闭区间内的数据点，按时间升序
     */
    protected abstract List<TrafficPoint> doRange(String resourceId, long start, long end);
}
