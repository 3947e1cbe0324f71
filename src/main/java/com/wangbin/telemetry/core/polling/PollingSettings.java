package com.wangbin.telemetry.core.polling;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * 一个多路复用器实例的轮询参数
 */
@Value
@Builder
public class PollingSettings {

    Duration minInterval;
    Duration maxInterval;
    Duration defaultInterval;

    /**
     * 单次采集超时，必须小于会话自身的生命周期
     */
    @Builder.Default
    Duration fetchTimeout = Duration.ofSeconds(5);

    /**
     * 每个订阅者的缓冲队列容量
     */
    @Builder.Default
    int queueCapacity = 10;

    /**
     * 把请求的间隔限制在 [min, max] 内；未指定时使用默认值
     */
    public Duration clamp(Duration requested) {
        if (requested == null || requested.isZero() || requested.isNegative()) {
            return defaultInterval;
        }
        if (requested.compareTo(minInterval) < 0) {
            return minInterval;
        }
        if (requested.compareTo(maxInterval) > 0) {
            return maxInterval;
        }
        return requested;
    }
}
