package com.wangbin.telemetry.core.store;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 历史序列中的一个数据点（计数器与速率，时间戳为毫秒）
 */
@Value
@Builder
@Jacksonized
public class TrafficPoint {

    long timestamp;

    long txBytes;
    long rxBytes;
    long txPackets;
    long rxPackets;
    long txErrors;
    long rxErrors;

    double txBytesPerSec;
    double rxBytesPerSec;
    double txPacketsPerSec;
    double rxPacketsPerSec;

    /**
     * 对每个数值字段取算术平均，时间戳由调用方指定
     */
    public static TrafficPoint average(List<TrafficPoint> points, long timestamp) {
        if (points == null || points.isEmpty()) {
            throw new IllegalArgumentException("points must not be empty");
        }
        RollupAccumulator accumulator = new RollupAccumulator(timestamp);
        for (TrafficPoint point : points) {
            accumulator.add(point);
        }
        return accumulator.toPoint();
    }
}
