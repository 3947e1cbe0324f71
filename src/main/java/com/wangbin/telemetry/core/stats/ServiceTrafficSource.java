package com.wangbin.telemetry.core.stats;

import com.wangbin.telemetry.core.device.DeviceCommand;
import com.wangbin.telemetry.core.event.ServiceTrafficUpdateEvent;
import com.wangbin.telemetry.core.event.TelemetryEvent;
import com.wangbin.telemetry.core.polling.PollingSource;

import java.util.List;
import java.util.Map;

/**
 * 服务实例流量数据源，会话键为 {@code routerId:instanceId}
 * <p>
 * 每个服务实例在设备上对应一条名为 {@code svc-<instanceId>} 的简单队列，
 * 其 bytes/packets 字段为 {@code 上行/下行} 计数。
 */
public class ServiceTrafficSource implements PollingSource<ServiceTrafficStats> {

    public static final String NAME = "service-traffic";

    static final String PATH = "/queue/simple";
    static final String QUEUE_PREFIX = "svc-";

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
                .where("name", queueName(resource.getResourceId()))
                .build();
    }

    @Override
    public ServiceTrafficStats buildPoint(String key,
                                          List<Map<String, String>> records,
                                          ServiceTrafficStats previous,
                                          long timestamp) {
        ResourceKey resource = ResourceKey.parse(key);
        String queueName = queueName(resource.getResourceId());
        Map<String, String> record = records.stream()
                .filter(r -> queueName.equals(r.get("name")))
                .findFirst()
                .orElse(null);
        if (record == null) {
            return null;
        }

        long[] bytes = RecordValues.requireCounterPair(record, "bytes");
        long[] packets = RecordValues.requireCounterPair(record, "packets");

        ServiceTrafficStats.ServiceTrafficStatsBuilder builder = ServiceTrafficStats.builder()
                .routerId(resource.getRouterId())
                .instanceId(resource.getResourceId())
                .txBytes(bytes[0])
                .rxBytes(bytes[1])
                .txPackets(packets[0])
                .rxPackets(packets[1])
                .timestamp(timestamp);

        if (previous != null) {
            double seconds = RateCalculator.elapsedSeconds(timestamp, previous.getTimestamp());
            builder.txBytesPerSec(RateCalculator.calculateRate(bytes[0], previous.getTxBytes(), seconds))
                    .rxBytesPerSec(RateCalculator.calculateRate(bytes[1], previous.getRxBytes(), seconds))
                    .txPacketsPerSec(RateCalculator.calculateRate(packets[0], previous.getTxPackets(), seconds))
                    .rxPacketsPerSec(RateCalculator.calculateRate(packets[1], previous.getRxPackets(), seconds));
        }
        return builder.build();
    }

    @Override
    public TelemetryEvent toEvent(ServiceTrafficStats point) {
        return new ServiceTrafficUpdateEvent(point, NAME);
    }

    static String queueName(String instanceId) {
        return QUEUE_PREFIX + instanceId;
    }
}
