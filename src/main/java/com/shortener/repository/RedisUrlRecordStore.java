package com.shortener.repository;

import com.shortener.exception.DuplicateCodeException;
import com.shortener.exception.StoreUnavailableException;
import com.shortener.model.UrlRecord;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

/**
 * Redis layout:
 * <ul>
 *   <li>{@code url:{shortCode}} hash with original_url, created_at, access_count</li>
 *   <li>{@code urls:by-created} sorted set of short codes scored by creation time in epoch micros</li>
 *   <li>{@code urls:by-original} hash from original URL to its canonical short code</li>
 * </ul>
 */
@Repository
@ConditionalOnProperty(name = "shortener.store", havingValue = "redis", matchIfMissing = true)
public class RedisUrlRecordStore implements UrlRecordStore {

    private static final Logger log = LoggerFactory.getLogger(RedisUrlRecordStore.class);

    static final String URL_KEY_PREFIX = "url:";
    static final String BY_CREATED_KEY = "urls:by-created";
    static final String BY_ORIGINAL_KEY = "urls:by-original";

    private static final String FIELD_ORIGINAL_URL = "original_url";
    private static final String FIELD_CREATED_AT = "created_at";
    private static final String FIELD_ACCESS_COUNT = "access_count";

    private final StringRedisTemplate redisTemplate;

    public RedisUrlRecordStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Optional<UrlRecord> findByOriginalUrl(String originalUrl) {
        Object shortCode = execute("findByOriginalUrl",
                () -> redisTemplate.opsForHash().get(BY_ORIGINAL_KEY, originalUrl));
        if (shortCode == null) {
            return Optional.empty();
        }
        return findByShortCode(shortCode.toString());
    }

    @Override
    public Optional<UrlRecord> findByShortCode(String shortCode) {
        Map<Object, Object> fields = execute("findByShortCode",
                () -> redisTemplate.opsForHash().entries(urlKey(shortCode)));
        return toRecord(shortCode, fields);
    }

    @Override
    public void insert(UrlRecord record) {
        Long inserted = execute("insert", () -> redisTemplate.execute(
                RedisScripts.INSERT,
                List.of(urlKey(record.shortCode()), BY_CREATED_KEY, BY_ORIGINAL_KEY),
                record.shortCode(),
                record.originalUrl(),
                record.createdAt().toString(),
                String.valueOf(creationScore(record.createdAt()))));
        if (inserted == null) {
            throw new StoreUnavailableException("Redis returned no reply for insert", null);
        }
        if (inserted == 0L) {
            throw new DuplicateCodeException(record.shortCode());
        }
        log.debug("Stored record {} -> {}", record.shortCode(), record.originalUrl());
    }

    @Override
    public Optional<UrlRecord> incrementAccessCount(String shortCode) {
        Long newCount = execute("incrementAccessCount", () -> redisTemplate.execute(
                RedisScripts.INCREMENT_ACCESS_COUNT,
                List.of(urlKey(shortCode))));
        if (newCount == null || newCount < 0) {
            return Optional.empty();
        }
        // only access_count is mutable, so the remaining fields can be read afterwards
        return findByShortCode(shortCode).map(record -> record.withAccessCount(newCount));
    }

    @Override
    public List<UrlRecord> queryPage(long skip, int limit) {
        Set<String> shortCodes = execute("queryPage",
                () -> redisTemplate.opsForZSet().reverseRange(BY_CREATED_KEY, skip, skip + limit - 1));
        if (shortCodes == null || shortCodes.isEmpty()) {
            return List.of();
        }
        List<UrlRecord> records = new ArrayList<>(shortCodes.size());
        for (String shortCode : shortCodes) {
            findByShortCode(shortCode).ifPresent(records::add);
        }
        return records;
    }

    @Override
    public long count() {
        Long size = execute("count", () -> redisTemplate.opsForZSet().zCard(BY_CREATED_KEY));
        return size == null ? 0L : size;
    }

    static String urlKey(String shortCode) {
        return URL_KEY_PREFIX + shortCode;
    }

    // epoch micros stay below 2^53, so the sorted-set double holds them exactly
    static long creationScore(Instant createdAt) {
        return ChronoUnit.MICROS.between(Instant.EPOCH, createdAt);
    }

    private Optional<UrlRecord> toRecord(String shortCode, Map<Object, Object> fields) {
        if (fields == null || fields.isEmpty()) {
            return Optional.empty();
        }
        Object originalUrl = fields.get(FIELD_ORIGINAL_URL);
        Object createdAt = fields.get(FIELD_CREATED_AT);
        if (originalUrl == null || createdAt == null) {
            log.warn("Ignoring incomplete record hash for short code {}: {}", shortCode, fields);
            return Optional.empty();
        }
        Object accessCount = fields.get(FIELD_ACCESS_COUNT);
        return Optional.of(new UrlRecord(
                originalUrl.toString(),
                shortCode,
                Instant.parse(createdAt.toString()),
                accessCount == null ? 0L : Long.parseLong(accessCount.toString())));
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("Redis {} failed: {}", operation, e.getMessage());
            throw new StoreUnavailableException("Record store unavailable during " + operation, e);
        }
    }
}
