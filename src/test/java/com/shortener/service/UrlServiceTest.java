package com.shortener.service;

import com.shortener.config.ShortenerProperties;
import com.shortener.exception.CodeExhaustionException;
import com.shortener.exception.DuplicateCodeException;
import com.shortener.exception.NotFoundException;
import com.shortener.exception.StoreUnavailableException;
import com.shortener.exception.ValidationException;
import com.shortener.model.ShortenResult;
import com.shortener.model.UrlPage;
import com.shortener.model.UrlRecord;
import com.shortener.repository.UrlRecordStore;
import com.shortener.telemetry.TelemetryPublisher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UrlServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");
    private static final String LONG_URL = "https://example.com/very/long/path";
    private static final int MAX_ATTEMPTS = 3;

    @Mock
    private UrlRecordStore store;

    @Mock
    private CodeGenerator codeGenerator;

    @Mock
    private TelemetryPublisher telemetry;

    private SimpleMeterRegistry meterRegistry;
    private UrlService urlService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        ShortenerProperties properties = new ShortenerProperties("http://sho.rt/", 7, MAX_ATTEMPTS, 50, "memory");
        urlService = new UrlService(store, codeGenerator, properties, telemetry,
                new ShortenerMetrics(meterRegistry), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // --- shorten ---

    @Test
    void shorten_whenUrlAlreadyShortened_shouldReturnExistingRecordWithoutNewCode() {
        // Arrange
        UrlRecord existing = new UrlRecord(LONG_URL, "abc1234", NOW.minusSeconds(60), 5);
        when(store.findByOriginalUrl(LONG_URL)).thenReturn(Optional.of(existing));

        // Act
        ShortenResult result = urlService.shortenUrl(LONG_URL);

        // Assert
        assertThat(result.created()).isFalse();
        assertThat(result.record()).isEqualTo(existing);
        verifyNoInteractions(codeGenerator);
        verify(store, never()).insert(any());
        verify(store, never()).incrementAccessCount(anyString());
        assertThat(meterRegistry.get("shortener.shorten.total").tag("result", "existing").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shorten_whenUrlIsNew_shouldInsertRecordWithZeroAccessCount() {
        // Arrange
        when(store.findByOriginalUrl(LONG_URL)).thenReturn(Optional.empty());
        when(codeGenerator.generate()).thenReturn("fresh01");
        when(store.findByShortCode("fresh01")).thenReturn(Optional.empty());
        ArgumentCaptor<UrlRecord> inserted = ArgumentCaptor.forClass(UrlRecord.class);
        doNothing().when(store).insert(inserted.capture());

        // Act
        ShortenResult result = urlService.shortenUrl(LONG_URL);

        // Assert
        assertThat(result.created()).isTrue();
        assertThat(inserted.getValue()).isEqualTo(new UrlRecord(LONG_URL, "fresh01", NOW, 0));
        assertThat(result.record()).isEqualTo(inserted.getValue());
        verify(telemetry).info(eq("service"), eq("URL shortened successfully: " + LONG_URL + " -> fresh01"));
    }

    @Test
    void shorten_shouldStoreCreationTimeAtMicrosecondPrecision() {
        UrlService service = new UrlService(store, codeGenerator,
                new ShortenerProperties("http://sho.rt/", 7, MAX_ATTEMPTS, 50, "memory"), telemetry,
                new ShortenerMetrics(meterRegistry),
                Clock.fixed(Instant.parse("2026-03-01T10:15:07.801705286Z"), ZoneOffset.UTC));
        when(store.findByOriginalUrl(LONG_URL)).thenReturn(Optional.empty());
        when(codeGenerator.generate()).thenReturn("micro01");
        when(store.findByShortCode("micro01")).thenReturn(Optional.empty());

        UrlRecord created = service.shorten(LONG_URL);

        assertThat(created.createdAt()).isEqualTo(Instant.parse("2026-03-01T10:15:07.801705Z"));
    }

    @Test
    void shorten_shouldTrimSurroundingWhitespace() {
        when(store.findByOriginalUrl(LONG_URL)).thenReturn(Optional.empty());
        when(codeGenerator.generate()).thenReturn("trim001");
        when(store.findByShortCode("trim001")).thenReturn(Optional.empty());

        UrlRecord record = urlService.shorten("  " + LONG_URL + "\n");

        assertThat(record.originalUrl()).isEqualTo(LONG_URL);
    }

    @Test
    void shorten_whenCandidateAlreadyUsed_shouldRetryWithNextCandidate() {
        // Arrange
        when(store.findByOriginalUrl(LONG_URL)).thenReturn(Optional.empty());
        when(codeGenerator.generate()).thenReturn("taken01", "free002");
        when(store.findByShortCode("taken01"))
                .thenReturn(Optional.of(new UrlRecord("https://other.com", "taken01", NOW, 0)));
        when(store.findByShortCode("free002")).thenReturn(Optional.empty());

        // Act
        UrlRecord record = urlService.shorten(LONG_URL);

        // Assert
        assertThat(record.shortCode()).isEqualTo("free002");
        verify(store, times(1)).insert(any());
        assertThat(meterRegistry.get("shortener.code.collision.total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shorten_whenInsertLosesRace_shouldRetryInsteadOfFailing() {
        // Arrange: pre-check says free, but a concurrent writer took the code before our insert
        when(store.findByOriginalUrl(LONG_URL)).thenReturn(Optional.empty());
        when(codeGenerator.generate()).thenReturn("raced01", "free002");
        when(store.findByShortCode(anyString())).thenReturn(Optional.empty());
        doThrow(new DuplicateCodeException("raced01")).doNothing().when(store).insert(any());

        // Act
        UrlRecord record = urlService.shorten(LONG_URL);

        // Assert
        assertThat(record.shortCode()).isEqualTo("free002");
        verify(store, times(2)).insert(any());
    }

    @Test
    void shorten_whenEveryCandidateIsTaken_shouldThrowCodeExhaustionAfterMaxAttempts() {
        // Arrange: generator stubbed to always return an already used code
        when(store.findByOriginalUrl(LONG_URL)).thenReturn(Optional.empty());
        when(codeGenerator.generate()).thenReturn("used001");
        when(store.findByShortCode("used001"))
                .thenReturn(Optional.of(new UrlRecord("https://other.com", "used001", NOW, 0)));

        // Act & Assert
        assertThatThrownBy(() -> urlService.shorten(LONG_URL))
                .isInstanceOfSatisfying(CodeExhaustionException.class,
                        e -> assertThat(e.getAttempts()).isEqualTo(MAX_ATTEMPTS));

        verify(codeGenerator, times(MAX_ATTEMPTS)).generate();
        verify(store, never()).insert(any());
        assertThat(meterRegistry.get("shortener.code.exhaustion.total").counter().count()).isEqualTo(1.0);
        verify(telemetry).error(eq("service"), anyString());
    }

    @Test
    void shorten_whenEveryInsertCollides_shouldThrowCodeExhaustion() {
        when(store.findByOriginalUrl(LONG_URL)).thenReturn(Optional.empty());
        when(codeGenerator.generate()).thenReturn("c1", "c2", "c3");
        when(store.findByShortCode(anyString())).thenReturn(Optional.empty());
        doThrow(new DuplicateCodeException("any")).when(store).insert(any());

        assertThatThrownBy(() -> urlService.shorten(LONG_URL))
                .isInstanceOf(CodeExhaustionException.class);

        verify(store, times(MAX_ATTEMPTS)).insert(any());
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "not-a-url", "ftp://x.com", "http://", "mailto:someone@example.com", "www.example.com",
            "https://example.com/a b", "http://a\nb", "https://example.com/<script>"})
    void shorten_withInvalidUrl_shouldThrowValidationWithoutTouchingStore(String url) {
        assertThatThrownBy(() -> urlService.shorten(url))
                .isInstanceOf(ValidationException.class);

        verifyNoInteractions(store);
        verifyNoInteractions(codeGenerator);
    }

    @Test
    void shorten_whenStoreUnavailable_shouldPropagateWithoutRetry() {
        StoreUnavailableException failure =
                new StoreUnavailableException("down", new QueryTimeoutException("timeout"));
        when(store.findByOriginalUrl(LONG_URL)).thenThrow(failure);

        assertThatThrownBy(() -> urlService.shorten(LONG_URL)).isSameAs(failure);

        verify(store, times(1)).findByOriginalUrl(LONG_URL);
        verifyNoInteractions(codeGenerator);
    }

    @Test
    void validateUrl_shouldAcceptWhatTheRedirectCanParse() {
        assertThat(UrlService.validateUrl("https://example.com/a%20b?q=1#frag")).isEqualTo("https://example.com/a%20b?q=1#frag");
        assertThat(UrlService.validateUrl("http://localhost:3000")).isEqualTo("http://localhost:3000");
    }

    @Test
    void validateUrl_withUnparseableUrl_shouldExplainTheProblem() {
        assertThatThrownBy(() -> UrlService.validateUrl("https://example.com/a b"))
                .isInstanceOf(ValidationException.class)
                .hasMessageStartingWith("Invalid URL format: ");
    }

    // --- lookup ---

    @Test
    void lookup_whenCodeExists_shouldReturnRecordWithoutCountingAccess() {
        UrlRecord record = new UrlRecord(LONG_URL, "look001", NOW, 3);
        when(store.findByShortCode("look001")).thenReturn(Optional.of(record));

        assertThat(urlService.lookup("look001")).isEqualTo(record);

        verify(store, never()).incrementAccessCount(anyString());
        verify(telemetry).info(eq("service"), eq("URL info requested: look001"));
        verify(telemetry).info(eq("service"), eq("URL info retrieved: look001"));
    }

    @Test
    void lookup_whenCodeUnknown_shouldThrowNotFound() {
        when(store.findByShortCode("doesnotexist")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> urlService.lookup("doesnotexist"))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("doesnotexist");
    }

    @Test
    void lookup_whenCodeBlank_shouldThrowNotFoundWithoutStoreCall() {
        assertThatThrownBy(() -> urlService.lookup(" "))
                .isInstanceOf(NotFoundException.class);

        verifyNoInteractions(store);
    }

    // --- list ---

    @Test
    void list_shouldTranslatePageIntoOffsetWindow() {
        List<UrlRecord> window = List.of(new UrlRecord(LONG_URL, "page001", NOW, 0));
        when(store.queryPage(20L, 10)).thenReturn(window);
        when(store.count()).thenReturn(21L);

        UrlPage page = urlService.list(3, 10);

        assertThat(page.records()).isEqualTo(window);
        assertThat(page.totalCount()).isEqualTo(21L);
        assertThat(page.page()).isEqualTo(3);
        assertThat(page.limit()).isEqualTo(10);
        assertThat(page.totalPages()).isEqualTo(3L);
        verify(telemetry).info(eq("service"), eq("Listing requested: page 3, limit 10"));
    }

    @Test
    void list_shouldCapLimitAtConfiguredMaximum() {
        when(store.queryPage(50L, 50)).thenReturn(List.of());
        when(store.count()).thenReturn(0L);

        UrlPage page = urlService.list(2, 1_000);

        assertThat(page.limit()).isEqualTo(50);
        assertThat(page.records()).isEmpty();
    }

    @Test
    void list_withNonPositiveArguments_shouldThrowValidation() {
        assertThatThrownBy(() -> urlService.list(0, 10)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> urlService.list(1, 0)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> urlService.list(-1, -1)).isInstanceOf(ValidationException.class);

        verifyNoInteractions(store);
    }
}
