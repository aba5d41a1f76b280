package com.shortener.repository;

import com.shortener.exception.DuplicateCodeException;
import com.shortener.model.UrlRecord;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

/**
 * Process-local store backed by concurrent maps. Used for local runs and tests.
 */
@Repository
@ConditionalOnProperty(name = "shortener.store", havingValue = "memory")
public class InMemoryUrlRecordStore implements UrlRecordStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryUrlRecordStore.class);

    // newest first; insertion sequence breaks ties between equal timestamps
    private static final Comparator<Entry> NEWEST_FIRST =
            Comparator.comparing((Entry e) -> e.record().createdAt())
                    .thenComparingLong(Entry::sequence)
                    .reversed();

    private final ConcurrentMap<String, Entry> byShortCode = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> codeByOriginalUrl = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public Optional<UrlRecord> findByOriginalUrl(String originalUrl) {
        String shortCode = codeByOriginalUrl.get(originalUrl);
        if (shortCode == null) {
            return Optional.empty();
        }
        return findByShortCode(shortCode);
    }

    @Override
    public Optional<UrlRecord> findByShortCode(String shortCode) {
        Entry entry = byShortCode.get(shortCode);
        return entry == null ? Optional.empty() : Optional.of(entry.record());
    }

    @Override
    public void insert(UrlRecord record) {
        Entry entry = new Entry(record, sequence.incrementAndGet());
        if (byShortCode.putIfAbsent(record.shortCode(), entry) != null) {
            throw new DuplicateCodeException(record.shortCode());
        }
        if (codeByOriginalUrl.putIfAbsent(record.originalUrl(), record.shortCode()) != null) {
            log.warn("Second record {} created for already shortened URL {}", record.shortCode(), record.originalUrl());
        }
    }

    @Override
    public Optional<UrlRecord> incrementAccessCount(String shortCode) {
        Entry updated = byShortCode.computeIfPresent(shortCode,
                (code, entry) -> new Entry(entry.record().withAccessCount(entry.record().accessCount() + 1), entry.sequence()));
        return updated == null ? Optional.empty() : Optional.of(updated.record());
    }

    @Override
    public List<UrlRecord> queryPage(long skip, int limit) {
        return byShortCode.values().stream()
                .sorted(NEWEST_FIRST)
                .skip(skip)
                .limit(limit)
                .map(Entry::record)
                .toList();
    }

    @Override
    public long count() {
        return byShortCode.size();
    }

    private record Entry(UrlRecord record, long sequence) {
    }
}
