package com.wangbin.telemetry.core.stats;

import com.wangbin.telemetry.core.store.TrafficPoint;

/**
 * 可写入历史存储的采样
 */
public interface TrafficSample {

    /**
     * 历史存储中使用的资源ID
     */
    String getHistoryResourceId();

    TrafficPoint toTrafficPoint();
}
