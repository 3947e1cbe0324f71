package com.wangbin.telemetry.core.store;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * 单个存储层级，各层接口一致，只在源分辨率与存储介质上不同
 */
public interface MetricsTier {

    TierLevel getLevel();

    /**
     * 写入一个原始采样；非原始分辨率的层级自行按桶汇总
     */
    void write(String resourceId, TrafficPoint point);

    /**
     * 查询 [start, end]（毫秒，闭区间）内的数据点，按时间升序
     *
     * @param interval 结果步长；比层级分辨率更粗时按步长分桶取平均
     */
    List<TrafficPoint> query(String resourceId, long start, long end, Duration interval);

    /**
     * 层级运行统计
     */
    Map<String, Object> getStatistics();
}
