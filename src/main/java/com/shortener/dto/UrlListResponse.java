package com.shortener.dto;

import java.util.List;

public record UrlListResponse(List<UrlInfoResponse> urls, Pagination pagination) {

    public record Pagination(int currentPage, long totalPages, long totalUrls, int limit) {
    }
}
