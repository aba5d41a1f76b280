package com.shortener.model;

// created is false when the canonical record for the URL already existed
public record ShortenResult(UrlRecord record, boolean created) {
}
