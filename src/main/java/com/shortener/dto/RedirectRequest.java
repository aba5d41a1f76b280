package com.shortener.dto;

import jakarta.validation.constraints.NotBlank;

public record RedirectRequest(@NotBlank(message = "shortCode is required in request body") String shortCode) {
}
