package com.shortener.dto;

import java.time.Instant;

// Everything known about one short URL, including its access count
public record UrlInfoResponse(String originalUrl, String shortCode, String shortUrl, Instant createdAt, long accessCount) {
}
