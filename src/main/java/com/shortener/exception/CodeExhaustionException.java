package com.shortener.exception;

/**
 * No free short code was found within the attempt budget. Usually means the
 * code space is close to saturation for the configured code length.
 */
public class CodeExhaustionException extends ShortenerException {

    private final int attempts;

    public CodeExhaustionException(int attempts) {
        super("Failed to generate unique short URL after " + attempts + " attempts");
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
