package com.wangbin.telemetry.core.store;

import java.time.Duration;

/**
 * 存储层级：按数据年龄划分，层级越冷源分辨率越粗
 */
public enum TierLevel {

    /**
     * 年龄 ≤ 1h，原始分辨率
     */
    HOT(Duration.ZERO, Duration.ofHours(1)),

    /**
     * 1h < 年龄 ≤ 24h，5 分钟分辨率
     */
    WARM(Duration.ofMinutes(5), Duration.ofHours(24)),

    /**
     * 年龄 > 24h，1 小时分辨率
     */
    COLD(Duration.ofHours(1), null);

    private final Duration resolution;
    private final Duration maxAge;

    TierLevel(Duration resolution, Duration maxAge) {
        this.resolution = resolution;
        this.maxAge = maxAge;
    }

    public Duration getResolution() {
        return resolution;
    }

    public boolean isRawResolution() {
        return resolution.isZero();
    }

    /**
     * 按查询起点的年龄选择层级，边界值归入较热的一层（恰好 1h 为 HOT，恰好 24h 为 WARM）
     */
    public static TierLevel forAge(Duration age) {
        for (TierLevel level : values()) {
            if (level.maxAge == null || age.compareTo(level.maxAge) <= 0) {
                return level;
            }
        }
        return COLD;
    }
}
