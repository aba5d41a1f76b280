package com.shortener.telemetry;

import com.shortener.config.TelemetryProperties;
import com.shortener.model.TelemetryEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class TelemetryPublisherTest {

    private static final Instant NOW = Instant.parse("2026-04-01T10:15:30Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @Mock
    private TelemetrySink sink;

    private TelemetryPublisher publisher(Executor executor, TelemetryProperties properties) {
        return new TelemetryPublisher(sink, executor, properties, CLOCK);
    }

    @Test
    void info_shouldBuildEventFromConfiguredStackAndClock() {
        TelemetryProperties properties = new TelemetryProperties(true, "log", "edge", null, null, null, 1);

        publisher(Runnable::run, properties).info("service", "Shorten requested for https://example.com");

        ArgumentCaptor<TelemetryEvent> captor = ArgumentCaptor.forClass(TelemetryEvent.class);
        verify(sink).record(captor.capture());
        assertThat(captor.getValue())
                .isEqualTo(new TelemetryEvent("edge", "info", "service", "Shorten requested for https://example.com", NOW));
    }

    @Test
    void publish_shouldRunOnTheGivenExecutor() {
        List<Runnable> queued = new ArrayList<>();
        TelemetryPublisher publisher = publisher(queued::add, TelemetryProperties.defaults());

        publisher.error("handler", "boom");

        verifyNoInteractions(sink);
        assertThat(queued).hasSize(1);

        queued.get(0).run();
        verify(sink).record(new TelemetryEvent("backend", "error", "handler", "boom", NOW));
    }

    @Test
    void publish_whenSinkThrows_shouldNotPropagate() {
        doThrow(new IllegalStateException("collector down")).when(sink).record(any());

        assertThatCode(() -> publisher(Runnable::run, TelemetryProperties.defaults()).warn("service", "slow"))
                .doesNotThrowAnyException();
        verify(sink).record(any());
    }

    @Test
    void publish_whenExecutorRejects_shouldNotPropagate() {
        Executor saturated = command -> {
            throw new RejectedExecutionException("queue full");
        };

        assertThatCode(() -> publisher(saturated, TelemetryProperties.defaults()).info("service", "dropped"))
                .doesNotThrowAnyException();
        verifyNoInteractions(sink);
    }

    @Test
    void publish_whenDisabled_shouldDoNothing() {
        TelemetryProperties disabled = new TelemetryProperties(false, null, null, null, null, null, 0);

        publisher(Runnable::run, disabled).info("service", "ignored");

        verifyNoInteractions(sink);
    }
}
