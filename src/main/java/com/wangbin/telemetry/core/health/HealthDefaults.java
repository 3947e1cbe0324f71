package com.wangbin.telemetry.core.health;

import lombok.Value;

/**
 * 健康检查配置的默认值
 */
@Value
public class HealthDefaults {

    public static final HealthDefaults STANDARD = new HealthDefaults(10, 2, 3);

    int intervalSec;
    int timeoutSec;
    int failureThreshold;
}
