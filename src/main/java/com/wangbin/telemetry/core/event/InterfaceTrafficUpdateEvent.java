package com.wangbin.telemetry.core.event;

import com.wangbin.telemetry.core.stats.InterfaceStats;
import lombok.Getter;
import lombok.ToString;

/**
 * 接口流量周期更新事件
 */
@Getter
@ToString(callSuper = true)
public class InterfaceTrafficUpdateEvent extends TelemetryEvent {

    public static final String TYPE = "interface.traffic.update";

    private final String routerId;
    private final String interfaceId;
    private final String interfaceName;
    private final double txRate;
    private final double rxRate;
    private final long txTotal;
    private final long rxTotal;

    public InterfaceTrafficUpdateEvent(InterfaceStats stats, String source) {
        super(TYPE, EventPriority.BACKGROUND, source);
        this.routerId = stats.getRouterId();
        this.interfaceId = stats.getInterfaceId();
        this.interfaceName = stats.getInterfaceName();
        this.txRate = stats.getTxBytesPerSec();
        this.rxRate = stats.getRxBytesPerSec();
        this.txTotal = stats.getTxBytes();
        this.rxTotal = stats.getRxBytes();
    }
}
