package com.shortener.telemetry;

import com.shortener.model.TelemetryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "shortener.telemetry.sink", havingValue = "log", matchIfMissing = true)
public class LogTelemetrySink implements TelemetrySink {

    private static final Logger log = LoggerFactory.getLogger("telemetry");

    @Override
    public void record(TelemetryEvent event) {
        switch (event.level()) {
            case "error" -> log.error("[{}] [{}]: {}", event.stack(), event.pkg(), event.message());
            case "warn" -> log.warn("[{}] [{}]: {}", event.stack(), event.pkg(), event.message());
            case "debug" -> log.debug("[{}] [{}]: {}", event.stack(), event.pkg(), event.message());
            default -> log.info("[{}] [{}]: {}", event.stack(), event.pkg(), event.message());
        }
    }
}
