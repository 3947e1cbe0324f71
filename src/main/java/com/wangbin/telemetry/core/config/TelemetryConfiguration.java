package com.wangbin.telemetry.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wangbin.telemetry.core.device.DeviceProbe;
import com.wangbin.telemetry.core.event.AsyncEventPublisher;
import com.wangbin.telemetry.core.event.EventSink;
import com.wangbin.telemetry.core.event.sink.LoggingEventSink;
import com.wangbin.telemetry.core.event.sink.RedisEventSink;
import com.wangbin.telemetry.core.health.HealthDefaults;
import com.wangbin.telemetry.core.health.WanHealthMonitor;
import com.wangbin.telemetry.core.polling.PollingSessionMultiplexer;
import com.wangbin.telemetry.core.polling.PollingSource;
import com.wangbin.telemetry.core.stats.InterfaceStats;
import com.wangbin.telemetry.core.stats.InterfaceStatsSource;
import com.wangbin.telemetry.core.stats.ServiceTrafficSource;
import com.wangbin.telemetry.core.stats.ServiceTrafficStats;
import com.wangbin.telemetry.core.stats.TrafficSample;
import com.wangbin.telemetry.core.store.MetricsTier;
import com.wangbin.telemetry.core.store.TierLevel;
import com.wangbin.telemetry.core.store.TieredMetricsStore;
import com.wangbin.telemetry.core.store.tier.LocalMetricsTier;
import com.wangbin.telemetry.core.store.tier.RedisMetricsTier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * 遥测组件装配
 * <p>
 * 宿主必须提供 {@link DeviceProbe} Bean，缺失时启动失败。
 */
@Slf4j
@Configuration
public class TelemetryConfiguration {

    @Bean
    public Clock telemetryClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(prefix = "telemetry.events", name = "sink", havingValue = "log", matchIfMissing = true)
    public EventSink loggingEventSink() {
        log.info("使用日志事件出口");
        return new LoggingEventSink();
    }

    @Bean
    @ConditionalOnProperty(prefix = "telemetry.events", name = "sink", havingValue = "redis")
    public EventSink redisEventSink(StringRedisTemplate redisTemplate,
                                    ObjectMapper objectMapper,
                                    TelemetryProperties properties) {
        log.info("使用Redis事件出口: channelPrefix={}", properties.getEvents().getRedisChannelPrefix());
        return new RedisEventSink(redisTemplate, objectMapper, properties.getEvents().getRedisChannelPrefix());
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public AsyncEventPublisher telemetryEventPublisher(EventSink eventSink, TelemetryProperties properties) {
        TelemetryProperties.Events events = properties.getEvents();
        return new AsyncEventPublisher(eventSink, events.getQueueCapacity(), events.getBatchSize());
    }

    @Bean
    public TieredMetricsStore tieredMetricsStore(List<MetricsTier> tiers,
                                                 Clock telemetryClock,
                                                 TelemetryProperties properties) {
        return new TieredMetricsStore(tiers, telemetryClock, properties.getStore().getMaxPoints());
    }

    @Bean(destroyMethod = "stop")
    public PollingSessionMultiplexer<InterfaceStats> interfaceStatsMultiplexer(
            DeviceProbe deviceProbe,
            AsyncEventPublisher telemetryEventPublisher,
            TieredMetricsStore tieredMetricsStore,
            TelemetryProperties properties,
            @Qualifier("pollingLoopExecutor") Executor pollingLoopExecutor,
            @Qualifier("probeExecutor") Executor probeExecutor) {
        return buildMultiplexer(new InterfaceStatsSource(), properties.getInterfaceStats(), deviceProbe,
                telemetryEventPublisher, tieredMetricsStore, pollingLoopExecutor, probeExecutor);
    }

    @Bean(destroyMethod = "stop")
    public PollingSessionMultiplexer<ServiceTrafficStats> serviceTrafficMultiplexer(
            DeviceProbe deviceProbe,
            AsyncEventPublisher telemetryEventPublisher,
            TieredMetricsStore tieredMetricsStore,
            TelemetryProperties properties,
            @Qualifier("pollingLoopExecutor") Executor pollingLoopExecutor,
            @Qualifier("probeExecutor") Executor probeExecutor) {
        return buildMultiplexer(new ServiceTrafficSource(), properties.getServiceTraffic(), deviceProbe,
                telemetryEventPublisher, tieredMetricsStore, pollingLoopExecutor, probeExecutor);
    }

    @Bean(destroyMethod = "shutdown")
    public WanHealthMonitor wanHealthMonitor(DeviceProbe deviceProbe,
                                             AsyncEventPublisher telemetryEventPublisher,
                                             TelemetryProperties properties,
                                             @Qualifier("healthLoopExecutor") Executor healthLoopExecutor,
                                             @Qualifier("probeExecutor") Executor probeExecutor) {
        TelemetryProperties.Health health = properties.getHealth();
        return new WanHealthMonitor(deviceProbe, telemetryEventPublisher, healthLoopExecutor, probeExecutor,
                health.getCommandTimeout(),
                new HealthDefaults(health.getIntervalSec(), health.getTimeoutSec(), health.getFailureThreshold()));
    }

    private static <T extends TrafficSample> PollingSessionMultiplexer<T> buildMultiplexer(
            PollingSource<T> source,
            TelemetryProperties.Polling polling,
            DeviceProbe deviceProbe,
            AsyncEventPublisher eventPublisher,
            TieredMetricsStore store,
            Executor loopExecutor,
            Executor probeExecutor) {
        PollingSessionMultiplexer<T> multiplexer = new PollingSessionMultiplexer<>(
                deviceProbe, source, polling.toSettings(), loopExecutor, probeExecutor, eventPublisher);
        multiplexer.addSampleListener(sample -> store.record(sample.getHistoryResourceId(), sample.toTrafficPoint()));
        log.info("多路复用器已创建: {}, interval=[{}s, {}s], default={}s", source.getName(),
                polling.getMinInterval().getSeconds(), polling.getMaxInterval().getSeconds(),
                polling.getDefaultInterval().getSeconds());
        return multiplexer;
    }

    /**
     * 本地存储层级（默认）
     */
    @Configuration
    @ConditionalOnProperty(prefix = "telemetry.store", name = "type", havingValue = "local", matchIfMissing = true)
    static class LocalTierConfiguration {

        @Bean
        public MetricsTier hotMetricsTier(TelemetryProperties properties) {
            return local(TierLevel.HOT, properties.getStore().getHotRetention(), properties);
        }

        @Bean
        public MetricsTier warmMetricsTier(TelemetryProperties properties) {
            return local(TierLevel.WARM, properties.getStore().getWarmRetention(), properties);
        }

        @Bean
        public MetricsTier coldMetricsTier(TelemetryProperties properties) {
            return local(TierLevel.COLD, properties.getStore().getColdRetention(), properties);
        }

        private static MetricsTier local(TierLevel level, Duration retention, TelemetryProperties properties) {
            return new LocalMetricsTier(level, retention, properties.getStore().getMaxResources());
        }
    }

    /**
     * Redis存储层级
     */
    @Configuration
    @ConditionalOnProperty(prefix = "telemetry.store", name = "type", havingValue = "redis")
    static class RedisTierConfiguration {

        @Bean
        public MetricsTier hotMetricsTier(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                                          TelemetryProperties properties) {
            return redis(TierLevel.HOT, properties.getStore().getHotRetention(), redisTemplate, objectMapper, properties);
        }

        @Bean
        public MetricsTier warmMetricsTier(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                                           TelemetryProperties properties) {
            return redis(TierLevel.WARM, properties.getStore().getWarmRetention(), redisTemplate, objectMapper, properties);
        }

        @Bean
        public MetricsTier coldMetricsTier(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                                           TelemetryProperties properties) {
            return redis(TierLevel.COLD, properties.getStore().getColdRetention(), redisTemplate, objectMapper, properties);
        }

        private static MetricsTier redis(TierLevel level, Duration retention, StringRedisTemplate redisTemplate,
                                         ObjectMapper objectMapper, TelemetryProperties properties) {
            return new RedisMetricsTier(level, retention, redisTemplate, objectMapper,
                    properties.getStore().getRedisKeyPrefix());
        }
    }
}
