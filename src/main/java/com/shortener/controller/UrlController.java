package com.shortener.controller;

import com.shortener.config.ShortenerProperties;
import com.shortener.dto.RedirectRequest;
import com.shortener.dto.RedirectResponse;
import com.shortener.dto.ShortenUrlRequest;
import com.shortener.dto.ShortenUrlResponse;
import com.shortener.dto.UrlInfoResponse;
import com.shortener.dto.UrlListResponse;
import com.shortener.model.ShortenResult;
import com.shortener.model.UrlPage;
import com.shortener.model.UrlRecord;
import com.shortener.service.ResolveService;
import com.shortener.service.UrlService;
import jakarta.validation.Valid;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP front of the shortener. Handlers only translate between wire types and
 * service calls; failures are mapped by {@link ApiExceptionHandler}.
 */
@RestController
public class UrlController {

    private static final Logger log = LoggerFactory.getLogger(UrlController.class);

    private final UrlService urlService;
    private final ResolveService resolveService;
    private final String baseUrl;

    public UrlController(UrlService urlService, ResolveService resolveService, ShortenerProperties properties) {
        this.urlService = urlService;
        this.resolveService = resolveService;
        this.baseUrl = properties.baseUrl();
    }

    @PostMapping("/api/urls")
    public ResponseEntity<ShortenUrlResponse> shortenUrl(@Valid @RequestBody ShortenUrlRequest request) {
        log.info("Received shortenUrl request: {}", request);

        ShortenResult result = urlService.shortenUrl(request.originalUrl());
        UrlRecord record = result.record();
        String message = result.created() ? "URL shortened successfully" : "URL already shortened";
        ShortenUrlResponse response = new ShortenUrlResponse(
                message, record.originalUrl(), record.shortCode(), shortUrl(record), record.createdAt());
        HttpStatus status = result.created() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(response);
    }

    @GetMapping("/api/urls/{shortCode}")
    public UrlInfoResponse getUrlInfo(@PathVariable String shortCode) {
        return toInfo(urlService.lookup(shortCode));
    }

    @GetMapping("/api/urls")
    public UrlListResponse listUrls(@RequestParam(defaultValue = "1") int page,
                                    @RequestParam(defaultValue = "10") int limit) {
        UrlPage urlPage = urlService.list(page, limit);
        return new UrlListResponse(
                urlPage.records().stream().map(this::toInfo).toList(),
                new UrlListResponse.Pagination(urlPage.page(), urlPage.totalPages(), urlPage.totalCount(), urlPage.limit()));
    }

    @PostMapping("/api/redirect")
    public RedirectResponse redirectInfo(@Valid @RequestBody RedirectRequest request) {
        UrlRecord record = resolveService.resolve(request.shortCode());
        return new RedirectResponse(record.originalUrl(), record.accessCount());
    }

    @GetMapping("/{shortCode}")
    public ResponseEntity<Void> redirectToOriginalUrl(@PathVariable String shortCode) {
        UrlRecord record = resolveService.resolve(shortCode);
        return ResponseEntity.status(HttpStatus.FOUND)
                .location(URI.create(record.originalUrl()))
                .build();
    }

    private UrlInfoResponse toInfo(UrlRecord record) {
        return new UrlInfoResponse(
                record.originalUrl(), record.shortCode(), shortUrl(record), record.createdAt(), record.accessCount());
    }

    private String shortUrl(UrlRecord record) {
        return baseUrl + record.shortCode();
    }
}
