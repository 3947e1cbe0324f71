package com.wangbin.telemetry.core.stats;

import com.wangbin.telemetry.core.device.DeviceCommand;
import com.wangbin.telemetry.core.event.InterfaceTrafficUpdateEvent;
import com.wangbin.telemetry.core.event.TelemetryEvent;
import com.wangbin.telemetry.core.polling.PollingSource;

import java.util.List;
import java.util.Map;

/**
 * 接口计数器数据源，会话键为 {@code routerId:interfaceId}
 */
public class InterfaceStatsSource implements PollingSource<InterfaceStats> {

    public static final String NAME = "interface-stats";

    static final String PATH = "/interface";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public DeviceCommand buildCommand(String key) {
        ResourceKey resource = ResourceKey.parse(key);
        return DeviceCommand.builder()
                .routerId(resource.getRouterId())
                .path(PATH)
                .action(DeviceCommand.ACTION_PRINT)
                .where(".id", resource.getResourceId())
                .build();
    }

    @Override
    public InterfaceStats buildPoint(String key,
                                     List<Map<String, String>> records,
                                     InterfaceStats previous,
                                     long timestamp) {
        ResourceKey resource = ResourceKey.parse(key);
        Map<String, String> record = findRecord(records, resource.getResourceId());
        if (record == null) {
            return null;
        }

        long txBytes = RecordValues.requireCounter(record, "tx-byte");
        long rxBytes = RecordValues.requireCounter(record, "rx-byte");
        long txPackets = RecordValues.requireCounter(record, "tx-packet");
        long rxPackets = RecordValues.requireCounter(record, "rx-packet");

        InterfaceStats.InterfaceStatsBuilder builder = InterfaceStats.builder()
                .routerId(resource.getRouterId())
                .interfaceId(resource.getResourceId())
                .interfaceName(record.getOrDefault("name", resource.getResourceId()))
                .txBytes(txBytes)
                .rxBytes(rxBytes)
                .txPackets(txPackets)
                .rxPackets(rxPackets)
                .txErrors(RecordValues.parseCounter(record, "tx-error"))
                .rxErrors(RecordValues.parseCounter(record, "rx-error"))
                .txDrops(RecordValues.parseCounter(record, "tx-drop"))
                .rxDrops(RecordValues.parseCounter(record, "rx-drop"))
                .timestamp(timestamp);

        if (previous != null) {
            double seconds = RateCalculator.elapsedSeconds(timestamp, previous.getTimestamp());
            builder.txBytesPerSec(RateCalculator.calculateRate(txBytes, previous.getTxBytes(), seconds))
                    .rxBytesPerSec(RateCalculator.calculateRate(rxBytes, previous.getRxBytes(), seconds))
                    .txPacketsPerSec(RateCalculator.calculateRate(txPackets, previous.getTxPackets(), seconds))
                    .rxPacketsPerSec(RateCalculator.calculateRate(rxPackets, previous.getRxPackets(), seconds));
        }
        return builder.build();
    }

    @Override
    public TelemetryEvent toEvent(InterfaceStats point) {
        return new InterfaceTrafficUpdateEvent(point, NAME);
    }

    private Map<String, String> findRecord(List<Map<String, String>> records, String interfaceId) {
        for (Map<String, String> record : records) {
            if (interfaceId.equals(record.get(".id")) || interfaceId.equals(record.get("name"))) {
                return record;
            }
        }
        // 设备已按 .id 过滤，只返回一条时直接使用
        return records.size() == 1 ? records.get(0) : null;
    }
}
