package com.shortener.telemetry;

import com.shortener.config.TelemetryProperties;
import com.shortener.model.TelemetryEvent;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Fire-and-forget front of the configured {@link TelemetrySink}.
 *
 * <p>Events are handed to a dedicated executor. Whatever happens downstream
 * (sink failure, full queue) ends in a local fallback log line and never
 * reaches the caller.
 */
@Component
public class TelemetryPublisher {

    private static final Logger log = LoggerFactory.getLogger(TelemetryPublisher.class);

    private final TelemetrySink sink;
    private final Executor executor;
    private final TelemetryProperties properties;
    private final Clock clock;

    public TelemetryPublisher(TelemetrySink sink,
                              @Qualifier("telemetryExecutor") Executor executor,
                              TelemetryProperties properties,
                              Clock clock) {
        this.sink = sink;
        this.executor = executor;
        this.properties = properties;
        this.clock = clock;
    }

    public void info(String pkg, String message) {
        publish("info", pkg, message);
    }

    public void warn(String pkg, String message) {
        publish("warn", pkg, message);
    }

    public void error(String pkg, String message) {
        publish("error", pkg, message);
    }

    public void record(TelemetryEvent event) {
        if (!properties.enabled()) {
            return;
        }
        try {
            executor.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            fallback(event, "executor rejected event");
        }
    }

    private void publish(String level, String pkg, String message) {
        record(new TelemetryEvent(properties.stack(), level, pkg, message, Instant.now(clock)));
    }

    private void deliver(TelemetryEvent event) {
        try {
            sink.record(event);
        } catch (RuntimeException e) {
            fallback(event, e.getMessage());
        }
    }

    private void fallback(TelemetryEvent event, String reason) {
        log.warn("Failed to send telemetry event ({}); [{}] [{}] [{}]: {}",
                reason, event.level().toUpperCase(Locale.ROOT), event.stack(), event.pkg(), event.message());
    }
}
