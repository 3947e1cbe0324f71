package com.wangbin.telemetry.core.health;

import com.wangbin.telemetry.common.utils.DurationUtil;
import com.wangbin.telemetry.core.device.DeviceCommand;

import java.time.Duration;
import java.util.Map;

/**
 * 设备侧可达性探针（netwatch）命令
 */
final class NetwatchCommands {

    static final String PATH = "/tool/netwatch";
    static final String FIELD_ID = ".id";
    static final String FIELD_STATUS = "status";
    static final String FIELD_COMMENT = "comment";
    static final String STATUS_UP = "up";

    private NetwatchCommands() {
    }

    static DeviceCommand list(String routerId, String tag) {
        return DeviceCommand.builder()
                .routerId(routerId)
                .path(PATH)
                .action(DeviceCommand.ACTION_PRINT)
                .where(FIELD_COMMENT, tag)
                .build();
    }

    static DeviceCommand remove(String routerId, String probeId) {
        return DeviceCommand.remove(routerId, PATH, probeId);
    }

    static DeviceCommand add(String routerId, String host, HealthCheckConfig config, String tag) {
        return DeviceCommand.builder()
                .routerId(routerId)
                .path(PATH)
                .action(DeviceCommand.ACTION_ADD)
                .arg("host", host)
                .arg("interval", DurationUtil.toSeconds(Duration.ofSeconds(config.getIntervalSec())))
                .arg("timeout", DurationUtil.toSeconds(Duration.ofSeconds(config.getTimeoutSec())))
                .arg("thr-loss-count", String.valueOf(config.getFailureThreshold()))
                .arg(FIELD_COMMENT, tag)
                .build();
    }

    static boolean isUp(Map<String, String> record) {
        return STATUS_UP.equalsIgnoreCase(record.get(FIELD_STATUS));
    }
}
