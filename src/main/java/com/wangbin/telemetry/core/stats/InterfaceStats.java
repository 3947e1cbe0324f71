package com.wangbin.telemetry.core.stats;

import com.wangbin.telemetry.core.store.TrafficPoint;
import lombok.Builder;
import lombok.Value;

/**
 * 接口计数器快照，由一次采集生成，广播后不再修改
 */
@Value
@Builder
public class InterfaceStats implements TrafficSample {

    String routerId;
    String interfaceId;
    String interfaceName;

    long txBytes;
    long rxBytes;
    long txPackets;
    long rxPackets;
    long txErrors;
    long rxErrors;
    long txDrops;
    long rxDrops;

    double txBytesPerSec;
    double rxBytesPerSec;
    double txPacketsPerSec;
    double rxPacketsPerSec;

    long timestamp;

    @Override
    public String getHistoryResourceId() {
        return ResourceKey.of(routerId, interfaceId).asKey();
    }

    @Override
    public TrafficPoint toTrafficPoint() {
        return TrafficPoint.builder()
                .timestamp(timestamp)
                .txBytes(txBytes)
                .rxBytes(rxBytes)
                .txPackets(txPackets)
                .rxPackets(rxPackets)
                .txErrors(txErrors)
                .rxErrors(rxErrors)
                .txBytesPerSec(txBytesPerSec)
                .rxBytesPerSec(rxBytesPerSec)
                .txPacketsPerSec(txPacketsPerSec)
                .rxPacketsPerSec(rxPacketsPerSec)
                .build();
    }
}
