package com.shortener.dto;

// Body of every error response
public record ApiErrorResponse(String code, String message) {
}
