package com.wangbin.telemetry.core.stats;

/**
 * 计数器速率计算
 */
public final class RateCalculator {

    private RateCalculator() {
    }

    /**
     * {@code (current - previous) / intervalSeconds}
     * <p>
     * 差值为负（设备重启导致计数器归零）或间隔不为正时返回 0，结果永远不为负。
     */
    public static double calculateRate(long current, long previous, double intervalSeconds) {
        if (intervalSeconds <= 0 || Double.isNaN(intervalSeconds)) {
            return 0;
        }
        long delta = current - previous;
        if (delta < 0) {
            return 0;
        }
        return delta / intervalSeconds;
    }

    /**
     * 两个采样时间戳（毫秒）之间的秒数
     */
    public static double elapsedSeconds(long currentMillis, long previousMillis) {
        return (currentMillis - previousMillis) / 1000.0;
    }
}
