package com.shortener.telemetry;

import com.shortener.config.TelemetryProperties;
import com.shortener.model.TelemetryEvent;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "shortener.telemetry.sink", havingValue = "redis-stream")
public class RedisStreamTelemetrySink implements TelemetrySink {

    private static final Logger log = LoggerFactory.getLogger(RedisStreamTelemetrySink.class);

    private final StringRedisTemplate redisTemplate;
    private final String streamKey;

    public RedisStreamTelemetrySink(StringRedisTemplate redisTemplate, TelemetryProperties properties) {
        this.redisTemplate = redisTemplate;
        this.streamKey = properties.streamKey();
    }

    @Override
    public void record(TelemetryEvent event) {
        Map<String, String> messageBody = new HashMap<>();
        messageBody.put("stack", event.stack());
        messageBody.put("level", event.level());
        messageBody.put("package", event.pkg());
        messageBody.put("message", event.message());
        messageBody.put("timestamp", event.timestamp().toString());

        RecordId messageId = redisTemplate.opsForStream().add(streamKey, messageBody);
        log.debug("Published telemetry event to stream {} with ID {}", streamKey, messageId);
    }
}
