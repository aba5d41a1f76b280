package com.shortener.dto;

import jakarta.validation.constraints.NotBlank;

public record ShortenUrlRequest(@NotBlank(message = "originalUrl is required in request body") String originalUrl) {
}
