package com.shortener.telemetry;

import com.shortener.config.TelemetryProperties;
import com.shortener.model.TelemetryEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StreamOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class RedisStreamTelemetrySinkTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private StreamOperations<String, Object, Object> streamOperationsMock;

    @Captor
    private ArgumentCaptor<Map<Object, Object>> messageCaptor;

    @BeforeEach
    void setUp() {
        lenient().when(redisTemplate.opsForStream()).thenReturn(streamOperationsMock);
    }

    @Test
    void record_shouldAddEventToConfiguredStream() {
        TelemetryProperties properties = new TelemetryProperties(true, "redis-stream", null, null, null, "streams:audit", 1);
        RedisStreamTelemetrySink sink = new RedisStreamTelemetrySink(redisTemplate, properties);
        Instant timestamp = Instant.parse("2026-04-01T10:15:30Z");

        sink.record(new TelemetryEvent("backend", "warn", "repository", "slow query", timestamp));

        verify(streamOperationsMock).add(eq("streams:audit"), messageCaptor.capture());
        assertThat(messageCaptor.getValue())
                .containsEntry("stack", "backend")
                .containsEntry("level", "warn")
                .containsEntry("package", "repository")
                .containsEntry("message", "slow query")
                .containsEntry("timestamp", "2026-04-01T10:15:30Z");
    }
}
