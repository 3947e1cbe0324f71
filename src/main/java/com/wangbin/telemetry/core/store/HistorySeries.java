package com.wangbin.telemetry.core.store;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 历史查询结果
 */
@Value
@Builder
public class HistorySeries {

    String resourceId;

    /**
     * 实际提供数据的层级
     */
    TierLevel tier;

    long start;
    long end;

    /**
     * 请求的步长（毫秒）
     */
    long intervalMillis;

    /**
     * 是否经过降采样；降采样后速率峰值会被平均抹平
     */
    boolean downsampled;

    List<TrafficPoint> points;

    public int size() {
        return points.size();
    }
}
