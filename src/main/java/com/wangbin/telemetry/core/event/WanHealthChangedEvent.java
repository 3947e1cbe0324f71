package com.wangbin.telemetry.core.event;

import com.wangbin.telemetry.core.health.HealthVerdict;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * WAN链路健康状态变化事件，仅在状态发生迁移时发布
 */
@Getter
@ToString(callSuper = true)
public class WanHealthChangedEvent extends TelemetryEvent {

    public static final String TYPE = "wan.health.changed";

    private final String linkKey;
    private final HealthVerdict healthStatus;
    private final HealthVerdict previousHealthStatus;
    private final int reachableTargets;
    private final int totalTargets;
    private final List<String> targets;
    private final long lastCheckTime;

    public WanHealthChangedEvent(String linkKey,
                                 HealthVerdict healthStatus,
                                 HealthVerdict previousHealthStatus,
                                 int reachableTargets,
                                 int totalTargets,
                                 List<String> targets) {
        super(TYPE, EventPriority.NORMAL, "wan-health-monitor");
        this.linkKey = linkKey;
        this.healthStatus = healthStatus;
        this.previousHealthStatus = previousHealthStatus;
        this.reachableTargets = reachableTargets;
        this.totalTargets = totalTargets;
        this.targets = targets == null ? List.of() : List.copyOf(targets);
        this.lastCheckTime = getTimestamp();
    }
}
