package com.shortener.exception;

public class NotFoundException extends ShortenerException {

    private final String shortCode;

    public NotFoundException(String shortCode) {
        super("Short URL not found: " + shortCode);
        this.shortCode = shortCode;
    }

    public String getShortCode() {
        return shortCode;
    }
}
