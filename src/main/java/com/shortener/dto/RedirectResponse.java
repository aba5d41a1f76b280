package com.shortener.dto;

public record RedirectResponse(String redirectUrl, long accessCount) {
}
