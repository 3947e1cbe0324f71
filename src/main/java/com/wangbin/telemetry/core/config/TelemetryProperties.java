package com.wangbin.telemetry.core.config;

import com.wangbin.telemetry.core.polling.PollingSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 遥测子系统配置
 */
@Data
@Component
@ConfigurationProperties(prefix = "telemetry")
public class TelemetryProperties {

    /**
     * 接口计数器轮询
     */
    private Polling interfaceStats = new Polling(Duration.ofSeconds(1), Duration.ofSeconds(30), Duration.ofSeconds(5));

    /**
     * 服务流量轮询
     */
    private Polling serviceTraffic = new Polling(Duration.ofSeconds(5), Duration.ofSeconds(60), Duration.ofSeconds(10));

    private Health health = new Health();

    private Store store = new Store();

    private Events events = new Events();

    @Data
    public static class Polling {

        private Duration minInterval;
        private Duration maxInterval;
        private Duration defaultInterval;

        /**
         * 单次采集超时
         */
        private Duration fetchTimeout = Duration.ofSeconds(5);

        /**
         * 订阅者队列容量，满时丢弃新数据
         */
        private int queueCapacity = 10;

        public Polling() {
        }

        public Polling(Duration minInterval, Duration maxInterval, Duration defaultInterval) {
            this.minInterval = minInterval;
            this.maxInterval = maxInterval;
            this.defaultInterval = defaultInterval;
        }

        public PollingSettings toSettings() {
            return PollingSettings.builder()
                    .minInterval(minInterval)
                    .maxInterval(maxInterval)
                    .defaultInterval(defaultInterval)
                    .fetchTimeout(fetchTimeout)
                    .queueCapacity(queueCapacity)
                    .build();
        }
    }

    @Data
    public static class Health {

        /**
         * 配置未指定时的探测间隔（秒）
         */
        private int intervalSec = 10;

        /**
         * 配置未指定时的探测超时（秒）
         */
        private int timeoutSec = 2;

        /**
         * 配置未指定时的失败阈值
         */
        private int failureThreshold = 3;

        /**
         * 单条设备命令的超时
         */
        private Duration commandTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Store {

        /**
         * 存储介质：local / redis
         */
        private String type = "local";

        /**
         * 单次查询返回的最大点数，超过则降采样
         */
        private int maxPoints = 500;

        private Duration hotRetention = Duration.ofHours(2);
        private Duration warmRetention = Duration.ofHours(25);
        private Duration coldRetention = Duration.ofDays(30);

        /**
         * 本地存储每层最多保留的资源数
         */
        private long maxResources = 10000;

        private String redisKeyPrefix = "telemetry:history:";
    }

    @Data
    public static class Events {

        /**
         * 事件出口：log / redis
         */
        private String sink = "log";

        private int queueCapacity = 1000;

        private int batchSize = 100;

        private String redisChannelPrefix = "telemetry:events:";
    }
}
