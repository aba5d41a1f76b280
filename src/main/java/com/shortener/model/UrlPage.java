package com.shortener.model;

import java.util.List;

/**
 * One window of the record listing.
 *
 * @param records    records in the window, newest first
 * @param totalCount number of records in the whole store
 * @param page       1-based page number that was requested
 * @param limit      page size actually applied
 */
public record UrlPage(List<UrlRecord> records, long totalCount, int page, int limit) {

    public UrlPage {
        records = List.copyOf(records);
    }

    public long totalPages() {
        return (totalCount + limit - 1) / limit;
    }
}
