package com.wangbin.telemetry.core.event;

/**
 * 事件出口（消息总线、发布订阅通道等）
 * <p>
 * 尽力而为：发布失败以异常形式返回给调用方，由调用方记录日志，不影响轮询。
 */
public interface EventSink {

    void publish(TelemetryEvent event) throws Exception;
}
