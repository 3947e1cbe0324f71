package com.wangbin.telemetry.core.device;

import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * 设备命令执行结果
 */
@Value
public class ProbeResult {

    List<Map<String, String>> records;
    boolean success;
    String error;

    /**
     * records 为 null 时视为空结果
     */
    public ProbeResult(List<Map<String, String>> records, boolean success, String error) {
        this.records = records == null ? List.of() : records;
        this.success = success;
        this.error = error;
    }

    public static ProbeResult ok(List<Map<String, String>> records) {
        return new ProbeResult(records == null ? List.of() : List.copyOf(records), true, null);
    }

    public static ProbeResult failed(String error) {
        return new ProbeResult(List.of(), false, error);
    }

    public boolean hasRecords() {
        return success && !records.isEmpty();
    }
}
