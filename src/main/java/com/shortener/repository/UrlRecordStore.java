package com.shortener.repository;

import com.shortener.exception.DuplicateCodeException;
import com.shortener.model.UrlRecord;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage of {@link UrlRecord}s. Implementations are the final authority
 * on short code uniqueness and on access counting; callers never read-modify-write.
 *
 * <p>Every method may throw {@link com.shortener.exception.StoreUnavailableException}
 * when the backing storage cannot be reached.
 */
public interface UrlRecordStore {

    /**
     * Returns the canonical record for the URL, which is the first one inserted for it.
     */
    Optional<UrlRecord> findByOriginalUrl(String originalUrl);

    Optional<UrlRecord> findByShortCode(String shortCode);

    /**
     * Inserts the record atomically.
     *
     * @throws DuplicateCodeException if another record already holds the short code;
     *                                the stored record is left untouched
     */
    void insert(UrlRecord record);

    /**
     * Atomically adds one to the access count.
     *
     * @return the record as it stands after the increment, or empty for an unknown code
     */
    Optional<UrlRecord> incrementAccessCount(String shortCode);

    /**
     * Records ordered by creation time, newest first. A window past the end is empty.
     */
    List<UrlRecord> queryPage(long skip, int limit);

    long count();
}
