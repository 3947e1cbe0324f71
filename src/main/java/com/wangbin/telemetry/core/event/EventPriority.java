package com.wangbin.telemetry.core.event;

/**
 * 事件优先级
 */
public enum EventPriority {
    IMMEDIATE,
    CRITICAL,
    NORMAL,
    BACKGROUND
}
