package com.wangbin.telemetry.core.stats;

import com.wangbin.telemetry.common.exception.TelemetryException;
import lombok.Value;

/**
 * 会话键 {@code routerId:resourceId}
 */
@Value
public class ResourceKey {

    private static final char SEPARATOR = ':';

    String routerId;
    String resourceId;

    public static ResourceKey of(String routerId, String resourceId) {
        if (routerId == null || routerId.isBlank() || resourceId == null || resourceId.isBlank()) {
            throw TelemetryException.configException(routerId + SEPARATOR + resourceId, "routerId 与资源ID不能为空");
        }
        return new ResourceKey(routerId, resourceId);
    }

    /**
     * 以第一个冒号拆分，资源ID中可以继续包含冒号
     */
    public static ResourceKey parse(String key) {
        int index = key == null ? -1 : key.indexOf(SEPARATOR);
        if (index <= 0 || index == key.length() - 1) {
            throw TelemetryException.configException(key, "会话键格式应为 routerId:resourceId");
        }
        return new ResourceKey(key.substring(0, index), key.substring(index + 1));
    }

    public String asKey() {
        return routerId + SEPARATOR + resourceId;
    }

    @Override
    public String toString() {
        return asKey();
    }
}
