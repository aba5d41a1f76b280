package com.shortener.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the shortening core. Missing or non-positive values fall back to defaults.
 *
 * @param baseUrl     prefix prepended to a short code when rendering the full short URL
 * @param codeLength  number of characters in a generated short code
 * @param maxAttempts how many candidate codes {@code shorten} tries before giving up
 * @param maxPageSize upper bound for the page size accepted by {@code list}
 * @param store       record store backend, {@code redis} or {@code memory}
 */
@ConfigurationProperties(prefix = "shortener")
public record ShortenerProperties(
        String baseUrl,
        int codeLength,
        int maxAttempts,
        int maxPageSize,
        String store) {

    public static final int DEFAULT_CODE_LENGTH = 7;
    public static final int DEFAULT_MAX_ATTEMPTS = 10;
    public static final int DEFAULT_MAX_PAGE_SIZE = 100;

    public ShortenerProperties {
        baseUrl = baseUrl == null || baseUrl.isBlank() ? "http://localhost:8080/" : baseUrl;
        if (!baseUrl.endsWith("/")) {
            baseUrl = baseUrl + "/";
        }
        codeLength = codeLength <= 0 ? DEFAULT_CODE_LENGTH : codeLength;
        if (codeLength < 4 || codeLength > 32) {
            throw new IllegalArgumentException("shortener.code-length must be between 4 and 32");
        }
        maxAttempts = maxAttempts <= 0 ? DEFAULT_MAX_ATTEMPTS : maxAttempts;
        maxPageSize = maxPageSize <= 0 ? DEFAULT_MAX_PAGE_SIZE : maxPageSize;
        store = store == null || store.isBlank() ? "redis" : store;
    }

    public static ShortenerProperties defaults() {
        return new ShortenerProperties(null, 0, 0, 0, null);
    }
}
