package com.wangbin.telemetry.core.event.sink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wangbin.telemetry.core.event.EventSink;
import com.wangbin.telemetry.core.event.TelemetryEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * 通过 Redis 发布订阅通道发出事件，通道名为 {@code <prefix><eventType>}
 */
@Slf4j
public class RedisEventSink implements EventSink {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String channelPrefix;

    public RedisEventSink(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, String channelPrefix) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.channelPrefix = channelPrefix;
    }

    @Override
    public void publish(TelemetryEvent event) throws Exception {
        String payload = objectMapper.writeValueAsString(event);
        redisTemplate.convertAndSend(channelPrefix + event.getType(), payload);
        log.trace("事件已发布到Redis: channel={}{}, id={}", channelPrefix, event.getType(), event.getId());
    }
}
