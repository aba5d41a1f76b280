package com.shortener.exception;

// Malformed client input: unusable URL or paging arguments.
public class ValidationException extends ShortenerException {

    public ValidationException(String message) {
        super(message);
    }
}
