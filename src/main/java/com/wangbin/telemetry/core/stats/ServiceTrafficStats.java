package com.wangbin.telemetry.core.stats;

import com.wangbin.telemetry.core.store.TrafficPoint;
import lombok.Builder;
import lombok.Value;

/**
 * 服务实例流量快照（上行为 tx，下行为 rx）
 */
@Value
@Builder
public class ServiceTrafficStats implements TrafficSample {

    String routerId;
    String instanceId;

    long txBytes;
    long rxBytes;
    long txPackets;
    long rxPackets;

    double txBytesPerSec;
    double rxBytesPerSec;
    double txPacketsPerSec;
    double rxPacketsPerSec;

    long timestamp;

    @Override
    public String getHistoryResourceId() {
        return ResourceKey.of(routerId, ServiceTrafficSource.queueName(instanceId)).asKey();
    }

    @Override
    public TrafficPoint toTrafficPoint() {
        return TrafficPoint.builder()
                .timestamp(timestamp)
                .txBytes(txBytes)
                .rxBytes(rxBytes)
                .txPackets(txPackets)
                .rxPackets(rxPackets)
                .txBytesPerSec(txBytesPerSec)
                .rxBytesPerSec(rxBytesPerSec)
                .txPacketsPerSec(txPacketsPerSec)
                .rxPacketsPerSec(rxPacketsPerSec)
                .build();
    }
}
