package com.wangbin.telemetry.core.event;

import com.wangbin.telemetry.core.stats.ServiceTrafficStats;
import lombok.Getter;
import lombok.ToString;

/**
 * 服务实例流量周期更新事件
 */
@Getter
@ToString(callSuper = true)
public class ServiceTrafficUpdateEvent extends TelemetryEvent {

    public static final String TYPE = "service.traffic.update";

    private final String routerId;
    private final String instanceId;
    private final double uploadRate;
    private final double downloadRate;
    private final long uploadTotal;
    private final long downloadTotal;

    public ServiceTrafficUpdateEvent(ServiceTrafficStats stats, String source) {
        super(TYPE, EventPriority.BACKGROUND, source);
        this.routerId = stats.getRouterId();
        this.instanceId = stats.getInstanceId();
        this.uploadRate = stats.getTxBytesPerSec();
        this.downloadRate = stats.getRxBytesPerSec();
        this.uploadTotal = stats.getTxBytes();
        this.downloadTotal = stats.getRxBytes();
    }
}
