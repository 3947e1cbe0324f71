package com.wangbin.telemetry.api.controller;

import com.wangbin.telemetry.common.web.result.ApiResult;
import com.wangbin.telemetry.core.health.HealthCheckConfig;
import com.wangbin.telemetry.core.health.WanHealthMonitor;
import com.wangbin.telemetry.core.stats.ResourceKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * WAN链路健康检查接口
 */
@Slf4j
@RestController
@RequestMapping("/wan/{routerId}/{wanId}/health")
@RequiredArgsConstructor
public class WanHealthController {

    private final WanHealthMonitor wanHealthMonitor;

    @PutMapping
    public ApiResult<Map<String, Object>> configure(@PathVariable String routerId,
                                                    @PathVariable String wanId,
                                                    @RequestBody HealthCheckConfig config) {
        String linkKey = ResourceKey.of(routerId, wanId).asKey();
        log.info("配置链路健康检查: link={}, enabled={}, targets={}", linkKey, config.isEnabled(), config.getTargets());
        wanHealthMonitor.configureHealthCheck(linkKey, config);
        return ApiResult.success(describe(linkKey));
    }

    @GetMapping
    public ApiResult<Map<String, Object>> status(@PathVariable String routerId, @PathVariable String wanId) {
        return ApiResult.success(describe(ResourceKey.of(routerId, wanId).asKey()));
    }

    @DeleteMapping
    public ApiResult<Map<String, Object>> stop(@PathVariable String routerId, @PathVariable String wanId) {
        String linkKey = ResourceKey.of(routerId, wanId).asKey();
        wanHealthMonitor.stopMonitoring(linkKey);
        return ApiResult.success(describe(linkKey));
    }

    private Map<String, Object> describe(String linkKey) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("linkKey", linkKey);
        result.put("status", wanHealthMonitor.getHealthStatus(linkKey));
        result.put("monitoring", wanHealthMonitor.isMonitoring(linkKey));
        return result;
    }
}
