package com.shortener.model;

import java.time.Instant;

/**
 * One observability event. {@code pkg} names the emitting area of the service
 * (service, handler, repository) and is shipped as {@code package}.
 */
public record TelemetryEvent(String stack, String level, String pkg, String message, Instant timestamp) {
}
