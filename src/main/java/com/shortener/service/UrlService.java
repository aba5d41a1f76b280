package com.shortener.service;

import com.shortener.config.ShortenerProperties;
import com.shortener.exception.CodeExhaustionException;
import com.shortener.exception.DuplicateCodeException;
import com.shortener.exception.NotFoundException;
import com.shortener.exception.ShortenerException;
import com.shortener.exception.ValidationException;
import com.shortener.model.ShortenResult;
import com.shortener.model.UrlPage;
import com.shortener.model.UrlRecord;
import com.shortener.repository.UrlRecordStore;
import com.shortener.telemetry.TelemetryPublisher;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Creates short URLs and answers read-only queries about them.
 *
 * <p>Holds no state between calls. Short code uniqueness is guaranteed by
 * {@link UrlRecordStore#insert}; the lookup before each insert only keeps the
 * number of failed inserts low.
 */
@Service
public class UrlService {

    private static final Logger log = LoggerFactory.getLogger(UrlService.class);

    static final Pattern URL_PATTERN = Pattern.compile("^https?://.+");
    private static final String TELEMETRY_PACKAGE = "service";

    private final UrlRecordStore store;
    private final CodeGenerator codeGenerator;
    private final ShortenerProperties properties;
    private final TelemetryPublisher telemetry;
    private final ShortenerMetrics metrics;
    private final Clock clock;

    public UrlService(UrlRecordStore store,
                      CodeGenerator codeGenerator,
                      ShortenerProperties properties,
                      TelemetryPublisher telemetry,
                      ShortenerMetrics metrics,
                      Clock clock) {
        this.store = store;
        this.codeGenerator = codeGenerator;
        this.properties = properties;
        this.telemetry = telemetry;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Returns the canonical record for the URL, creating it on first submission.
     *
     * @throws ValidationException     if the URL is blank or not http/https
     * @throws CodeExhaustionException if no free code was found within the attempt budget
     */
    public UrlRecord shorten(String originalUrl) {
        return shortenUrl(originalUrl).record();
    }

    /**
     * Same as {@link #shorten(String)} but also reports whether a new record was created.
     */
    public ShortenResult shortenUrl(String originalUrl) {
        telemetry.info(TELEMETRY_PACKAGE, "Shorten requested for " + originalUrl);
        try {
            String url = validateUrl(originalUrl);

            Optional<UrlRecord> existing = store.findByOriginalUrl(url);
            if (existing.isPresent()) {
                metrics.recordShorten("existing");
                telemetry.info(TELEMETRY_PACKAGE, "URL already shortened: " + url);
                return new ShortenResult(existing.get(), false);
            }

            UrlRecord created = createWithUniqueCode(url);
            metrics.recordShorten("created");
            log.info("Shortened {} -> {}", url, created.shortCode());
            telemetry.info(TELEMETRY_PACKAGE, "URL shortened successfully: " + url + " -> " + created.shortCode());
            return new ShortenResult(created, true);
        } catch (ShortenerException e) {
            telemetry.error(TELEMETRY_PACKAGE, "Shorten failed for " + originalUrl + ": " + e.getMessage());
            throw e;
        }
    }

    /**
     * Read-only view of a record; never touches the access count.
     *
     * @throws NotFoundException if no record has the code
     */
    public UrlRecord lookup(String shortCode) {
        telemetry.info(TELEMETRY_PACKAGE, "URL info requested: " + shortCode);
        try {
            UrlRecord record = findExisting(shortCode);
            telemetry.info(TELEMETRY_PACKAGE, "URL info retrieved: " + shortCode);
            return record;
        } catch (ShortenerException e) {
            telemetry.error(TELEMETRY_PACKAGE, "Lookup failed for " + shortCode + ": " + e.getMessage());
            throw e;
        }
    }

    /**
     * One page of records, newest first. {@code limit} is capped at the configured
     * maximum page size; a page past the end is empty.
     *
     * @throws ValidationException if page or limit is not positive
     */
    public UrlPage list(int page, int limit) {
        telemetry.info(TELEMETRY_PACKAGE, "Listing requested: page " + page + ", limit " + limit);
        try {
            if (page < 1) {
                throw new ValidationException("page must be a positive integer");
            }
            if (limit < 1) {
                throw new ValidationException("limit must be a positive integer");
            }
            int effectiveLimit = Math.min(limit, properties.maxPageSize());
            long skip = (long) (page - 1) * effectiveLimit;

            List<UrlRecord> records = store.queryPage(skip, effectiveLimit);
            long totalCount = store.count();
            telemetry.info(TELEMETRY_PACKAGE, "Retrieved " + records.size() + " URLs (page " + page + ")");
            return new UrlPage(records, totalCount, page, effectiveLimit);
        } catch (ShortenerException e) {
            telemetry.error(TELEMETRY_PACKAGE, "Listing failed: " + e.getMessage());
            throw e;
        }
    }

    private UrlRecord createWithUniqueCode(String url) {
        int maxAttempts = properties.maxAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String candidate = codeGenerator.generate();
            if (store.findByShortCode(candidate).isPresent()) {
                metrics.recordCollision();
                log.debug("Short code {} already in use (attempt {}/{})", candidate, attempt, maxAttempts);
                continue;
            }

            UrlRecord record = UrlRecord.newRecord(url, candidate, now());
            try {
                store.insert(record);
                return record;
            } catch (DuplicateCodeException e) {
                // another writer took the code between the check and the insert
                metrics.recordCollision();
                log.debug("Lost insert race for short code {} (attempt {}/{})", candidate, attempt, maxAttempts);
            }
        }

        metrics.recordExhaustion();
        log.error("No free short code after {} attempts; code space may be near saturation", maxAttempts);
        throw new CodeExhaustionException(maxAttempts);
    }

    // microsecond precision, the resolution the Redis creation index keeps
    private Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
    }

    private UrlRecord findExisting(String shortCode) {
        if (shortCode == null || shortCode.isBlank()) {
            throw new NotFoundException(String.valueOf(shortCode));
        }
        return store.findByShortCode(shortCode)
                .orElseThrow(() -> new NotFoundException(shortCode));
    }

    static String validateUrl(String originalUrl) {
        if (originalUrl == null || originalUrl.isBlank()) {
            throw new ValidationException("originalUrl is required");
        }
        String url = originalUrl.trim();
        if (!URL_PATTERN.matcher(url).find()) {
            throw new ValidationException("Invalid URL format. Must be a valid HTTP or HTTPS URL");
        }
        try {
            new URI(url);
        } catch (URISyntaxException e) {
            throw new ValidationException("Invalid URL format: " + e.getReason());
        }
        return url;
    }
}
