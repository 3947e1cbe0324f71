package com.wangbin.telemetry.core.store;

import java.util.ArrayList;
import java.util.List;

/**
 * 序列降采样
 * <p>
 * 按 {@code ceil(n / maxPoints)} 大小的连续桶取平均，时间戳取桶中间那个真实样本的时间。
 * 速率字段同样取平均，突发峰值会被抹平。
 */
public final class Downsampler {

    private Downsampler() {
    }

    public static List<TrafficPoint> downsample(List<TrafficPoint> points, int maxPoints) {
        if (maxPoints <= 0) {
            throw new IllegalArgumentException("maxPoints must be positive: " + maxPoints);
        }
        if (points.size() <= maxPoints) {
            return points;
        }

        int bucketSize = (points.size() + maxPoints - 1) / maxPoints;
        List<TrafficPoint> result = new ArrayList<>((points.size() + bucketSize - 1) / bucketSize);
        for (int from = 0; from < points.size(); from += bucketSize) {
            List<TrafficPoint> bucket = points.subList(from, Math.min(from + bucketSize, points.size()));
            long timestamp = bucket.get(bucket.size() / 2).getTimestamp();
            result.add(TrafficPoint.average(bucket, timestamp));
        }
        return result;
    }
}
