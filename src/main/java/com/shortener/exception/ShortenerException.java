package com.shortener.exception;

/**
 * Base type for every failure the shortener core reports to its callers.
 */
public abstract class ShortenerException extends RuntimeException {

    protected ShortenerException(String message) {
        super(message);
    }

    protected ShortenerException(String message, Throwable cause) {
        super(message, cause);
    }
}
