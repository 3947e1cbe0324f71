package com.wangbin.telemetry.core.health;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 单条WAN链路的健康检查配置
 * <p>
 * 数值字段为 null 时使用监控器的默认值；显式给出的非正数视为配置错误。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthCheckConfig {

    private boolean enabled;

    /**
     * 探测目标（主机名或IP），每个目标对应一个设备侧探针
     */
    private List<String> targets;

    /**
     * 探测间隔（秒），同时也是本地轮询间隔
     */
    private Integer intervalSec;

    /**
     * 单次探测超时（秒）
     */
    private Integer timeoutSec;

    /**
     * 设备侧探针判定 down 的连续失败次数，仅下发给设备，本地聚合不使用
     */
    private Integer failureThreshold;

    public static HealthCheckConfig disabled() {
        return HealthCheckConfig.builder().enabled(false).build();
    }

    /**
     * 用默认值补齐未设置的数值字段，返回新对象
     */
    public HealthCheckConfig withDefaults(int defaultIntervalSec, int defaultTimeoutSec, int defaultFailureThreshold) {
        return HealthCheckConfig.builder()
                .enabled(enabled)
                .targets(targets == null ? null : new ArrayList<>(targets))
                .intervalSec(intervalSec != null ? intervalSec : defaultIntervalSec)
                .timeoutSec(timeoutSec != null ? timeoutSec : defaultTimeoutSec)
                .failureThreshold(failureThreshold != null ? failureThreshold : defaultFailureThreshold)
                .build();
    }
}
