package com.shortener.exception;

/**
 * Raised by a record store when an insert collides with a short code that is
 * already taken. The shortening loop retries on it; it is never returned to callers.
 */
public class DuplicateCodeException extends ShortenerException {

    private final String shortCode;

    public DuplicateCodeException(String shortCode) {
        super("Short code already in use: " + shortCode);
        this.shortCode = shortCode;
    }

    public String getShortCode() {
        return shortCode;
    }
}
