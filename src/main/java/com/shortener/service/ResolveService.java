package com.shortener.service;

import com.shortener.exception.NotFoundException;
import com.shortener.exception.ShortenerException;
import com.shortener.model.UrlRecord;
import com.shortener.repository.UrlRecordStore;
import com.shortener.telemetry.TelemetryPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Follows short codes. Every successful resolution counts as one access.
 */
@Service
public class ResolveService {

    private static final Logger log = LoggerFactory.getLogger(ResolveService.class);

    private static final String TELEMETRY_PACKAGE = "service";

    private final UrlRecordStore store;
    private final TelemetryPublisher telemetry;
    private final ShortenerMetrics metrics;

    public ResolveService(UrlRecordStore store, TelemetryPublisher telemetry, ShortenerMetrics metrics) {
        this.store = store;
        this.telemetry = telemetry;
        this.metrics = metrics;
    }

    /**
     * Increments the access count in one atomic store operation and returns the
     * record as it stands after the increment.
     *
     * @throws NotFoundException if no record has the code
     */
    public UrlRecord resolve(String shortCode) {
        telemetry.info(TELEMETRY_PACKAGE, "Redirect requested: " + shortCode);
        try {
            if (shortCode == null || shortCode.isBlank()) {
                throw new NotFoundException(String.valueOf(shortCode));
            }
            UrlRecord record = store.incrementAccessCount(shortCode)
                    .orElseThrow(() -> new NotFoundException(shortCode));
            metrics.recordResolve();
            log.debug("Resolved {} -> {} (access count {})", shortCode, record.originalUrl(), record.accessCount());
            telemetry.info(TELEMETRY_PACKAGE, "Redirecting: " + shortCode + " -> " + record.originalUrl());
            return record;
        } catch (ShortenerException e) {
            telemetry.error(TELEMETRY_PACKAGE, "Resolve failed for " + shortCode + ": " + e.getMessage());
            throw e;
        }
    }
}
