package com.wangbin.telemetry.core.event;

import lombok.Getter;
import lombok.ToString;

import java.util.UUID;

/**
 * 遥测事件基类
 */
@Getter
@ToString
public abstract class TelemetryEvent {

    private final String id;
    private final String type;
    private final EventPriority priority;
    private final long timestamp;
    private final String source;

    protected TelemetryEvent(String type, EventPriority priority, String source) {
        this.id = UUID.randomUUID().toString();
        this.type = type;
        this.priority = priority;
        this.timestamp = System.currentTimeMillis();
        this.source = source;
    }
}
