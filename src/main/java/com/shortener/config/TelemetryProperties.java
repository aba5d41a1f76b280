package com.shortener.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "shortener.telemetry")
public record TelemetryProperties(
        Boolean enabled,
        String sink,
        String stack,
        String endpoint,
        String token,
        String streamKey,
        int executorThreads) {

    public TelemetryProperties {
        enabled = enabled == null ? Boolean.TRUE : enabled;
        sink = sink == null || sink.isBlank() ? "log" : sink;
        stack = stack == null || stack.isBlank() ? "backend" : stack;
        endpoint = endpoint == null ? "" : endpoint;
        token = token == null ? "" : token;
        streamKey = streamKey == null || streamKey.isBlank() ? "streams:telemetry" : streamKey;
        executorThreads = executorThreads <= 0 ? 2 : executorThreads;
    }

    public static TelemetryProperties defaults() {
        return new TelemetryProperties(null, null, null, null, null, null, 0);
    }
}
