package com.wangbin.telemetry.api.controller;

import com.wangbin.telemetry.common.web.result.ApiResult;
import com.wangbin.telemetry.core.polling.PollingSessionMultiplexer;
import com.wangbin.telemetry.core.stats.InterfaceStats;
import com.wangbin.telemetry.core.stats.ServiceTrafficStats;
import com.wangbin.telemetry.core.store.HistorySeries;
import com.wangbin.telemetry.core.store.TieredMetricsStore;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 遥测查询接口
 */
@RestController
@RequestMapping("/telemetry")
@RequiredArgsConstructor
public class TelemetryController {

    private final TieredMetricsStore tieredMetricsStore;
    private final PollingSessionMultiplexer<InterfaceStats> interfaceStatsMultiplexer;
    private final PollingSessionMultiplexer<ServiceTrafficStats> serviceTrafficMultiplexer;
    private final Clock telemetryClock;

    /**
     * 历史序列查询
     * <p>
     * 只查询起点所在的一个层级；点数超过上限时按桶平均降采样，速率峰值会被抹平。
     */
    @GetMapping("/history/{resourceId}")
    public ApiResult<HistorySeries> history(@PathVariable String resourceId,
                                            @RequestParam(required = false) Instant start,
                                            @RequestParam(required = false) Instant end,
                                            @RequestParam(defaultValue = "1m") String interval) {
        Instant queryEnd = end != null ? end : telemetryClock.instant();
        Instant queryStart = start != null ? start : queryEnd.minus(Duration.ofHours(1));
        return ApiResult.success(tieredMetricsStore.getHistory(resourceId, queryStart, queryEnd, interval));
    }

    @GetMapping("/sessions")
    public ApiResult<Map<String, Object>> sessions() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(interfaceStatsMultiplexer.getName(), describe(interfaceStatsMultiplexer));
        result.put(serviceTrafficMultiplexer.getName(), describe(serviceTrafficMultiplexer));
        return ApiResult.success(result);
    }

    @GetMapping("/store/statistics")
    public ApiResult<Map<String, Object>> storeStatistics() {
        return ApiResult.success(tieredMetricsStore.getStatistics());
    }

    private static Map<String, Object> describe(PollingSessionMultiplexer<?> multiplexer) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("activeSessions", multiplexer.getActiveSessionCount());
        info.put("totalSubscribers", multiplexer.getTotalSubscriberCount());
        info.put("sessionKeys", multiplexer.getSessionKeys());
        info.put("lastFetchAt", multiplexer.getLastFetchTimes());
        return info;
    }
}
