package com.wangbin.telemetry.core.polling;

import com.wangbin.telemetry.core.device.DeviceCommand;
import com.wangbin.telemetry.core.event.TelemetryEvent;

import java.util.List;
import java.util.Map;

/**
 * 轮询数据源：决定某个会话键要执行的命令，以及如何把返回记录构建成数据点
 *
 * @param <T> 数据点类型
 */
public interface PollingSource<T> {

    /**
     * 数据源名称，用于日志与线程命名
     */
    String getName();

    /**
     * 会话键对应的采集命令
     */
    DeviceCommand buildCommand(String key);

    /**
     * 由一次成功采集的记录构建数据点
     *
     * @param key       会话键
     * @param records   设备返回的记录（非空）
     * @param previous  同一会话上一次成功构建的数据点，首次采集为 null
     * @param timestamp 采集时间（毫秒）
     * @return 数据点；记录中找不到目标资源时返回 null，本次采集视为失败
     * @throws IllegalArgumentException 记录缺少必需字段时抛出，本次采集同样视为失败，上一个样本保持不变
     */
    T buildPoint(String key, List<Map<String, String>> records, T previous, long timestamp);

    /**
     * 数据点对应的事件，不需要转发时返回 null
     */
    TelemetryEvent toEvent(T point);
}
