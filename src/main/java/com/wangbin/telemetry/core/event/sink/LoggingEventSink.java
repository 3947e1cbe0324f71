package com.wangbin.telemetry.core.event.sink;

import com.wangbin.telemetry.core.event.EventPriority;
import com.wangbin.telemetry.core.event.EventSink;
import com.wangbin.telemetry.core.event.TelemetryEvent;
import lombok.extern.slf4j.Slf4j;

/**
 * 仅写日志的事件出口，用于未接入消息总线的部署
 */
@Slf4j
public class LoggingEventSink implements EventSink {

    @Override
    public void publish(TelemetryEvent event) {
        if (event.getPriority() == EventPriority.BACKGROUND) {
            log.debug("event {} {}", event.getType(), event);
        } else {
            log.info("event {} {}", event.getType(), event);
        }
    }
}
