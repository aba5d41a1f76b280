package com.shortener.telemetry;

import com.shortener.model.TelemetryEvent;

/**
 * Destination for telemetry events. Implementations may block and may throw;
 * {@link TelemetryPublisher} keeps both away from request threads.
 */
public interface TelemetrySink {

    void record(TelemetryEvent event);
}
