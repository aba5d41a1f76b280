package com.shortener.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
public class ShortenerMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter collisionCounter;
    private final Counter exhaustionCounter;
    private final Counter resolveCounter;
    private final ConcurrentMap<String, Counter> shortenCounters = new ConcurrentHashMap<>();

    public ShortenerMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.collisionCounter = Counter.builder("shortener.code.collision.total")
                .description("Candidate short codes rejected because they were already in use")
                .register(meterRegistry);
        this.exhaustionCounter = Counter.builder("shortener.code.exhaustion.total")
                .description("Shorten calls that ran out of attempts to find a free code")
                .register(meterRegistry);
        this.resolveCounter = Counter.builder("shortener.resolve.total")
                .description("Successful short code resolutions")
                .register(meterRegistry);
    }

    // result is "created" or "existing"
    public void recordShorten(String result) {
        shortenCounters.computeIfAbsent(result, this::registerShortenCounter).increment();
    }

    public void recordCollision() {
        collisionCounter.increment();
    }

    public void recordExhaustion() {
        exhaustionCounter.increment();
    }

    public void recordResolve() {
        resolveCounter.increment();
    }

    private Counter registerShortenCounter(String result) {
        return Counter.builder("shortener.shorten.total")
                .tags(Tags.of("result", result))
                .register(meterRegistry);
    }
}
