package com.shortener.dto;

import java.time.Instant;

public record ShortenUrlResponse(String message, String originalUrl, String shortCode, String shortUrl, Instant createdAt) {
}
