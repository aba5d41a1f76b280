package com.shortener.exception;

public class StoreUnavailableException extends ShortenerException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
