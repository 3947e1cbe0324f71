package com.wangbin.telemetry.core.health;

/**
 * WAN链路健康结论
 */
public enum HealthVerdict {

    HEALTHY,
    DEGRADED,
    DOWN,
    UNKNOWN;

    /**
     * 按可达目标数推导结论；直接反映最近一次探测，不做防抖
     */
    public static HealthVerdict aggregate(int reachable, int total) {
        if (total <= 0) {
            return UNKNOWN;
        }
        if (reachable >= total) {
            return HEALTHY;
        }
        if (reachable <= 0) {
            return DOWN;
        }
        return DEGRADED;
    }
}
