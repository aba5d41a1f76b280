package com.shortener.model;

import java.time.Instant;

/**
 * A shortened URL as held by the record store.
 * Only {@code accessCount} ever changes after creation, and only upwards.
 */
public record UrlRecord(String originalUrl, String shortCode, Instant createdAt, long accessCount) {

    public static UrlRecord newRecord(String originalUrl, String shortCode, Instant createdAt) {
        return new UrlRecord(originalUrl, shortCode, createdAt, 0L);
    }

    public UrlRecord withAccessCount(long newAccessCount) {
        return new UrlRecord(originalUrl, shortCode, createdAt, newAccessCount);
    }
}
