package com.wangbin.telemetry.common.exception;

import com.wangbin.telemetry.common.web.result.ResultCode;
import lombok.Getter;

/**
 * 遥测子系统异常，携带出错的资源键（会话键、链路键或资源ID）
 */
@Getter
public class TelemetryException extends BusinessException {

    private final String resourceKey;

    public TelemetryException(ResultCode resultCode, String message, String resourceKey) {
        super(resultCode, message);
        this.resourceKey = resourceKey;
    }

    public TelemetryException(ResultCode resultCode, String message, String resourceKey, Throwable cause) {
        super(resultCode, message, cause);
        this.resourceKey = resourceKey;
    }

    // 时间间隔无法解析
    public static TelemetryException invalidInterval(String interval) {
        return new TelemetryException(ResultCode.INVALID_INTERVAL, "无效的时间间隔: " + interval, null);
    }

    // 查询时间范围非法
    public static TelemetryException invalidTimeRange(String resourceId, String message) {
        return new TelemetryException(ResultCode.INVALID_TIME_RANGE, message, resourceId);
    }

    // 配置异常
    public static TelemetryException configException(String resourceKey, String message) {
        return new TelemetryException(ResultCode.CONFIG_INVALID, message, resourceKey);
    }

    // 设备命令执行失败
    public static TelemetryException probeFailure(String resourceKey, String message, Throwable cause) {
        return new TelemetryException(ResultCode.PROBE_FAILED, message, resourceKey, cause);
    }

    // 历史存储读写失败
    public static TelemetryException storageFailure(String resourceId, String message, Throwable cause) {
        return new TelemetryException(ResultCode.STORAGE_ERROR, message, resourceId, cause);
    }

    // 组件已停止
    public static TelemetryException stopped(String component, String resourceKey) {
        return new TelemetryException(ResultCode.SERVICE_UNAVAILABLE, component + " 已停止", resourceKey);
    }
}
