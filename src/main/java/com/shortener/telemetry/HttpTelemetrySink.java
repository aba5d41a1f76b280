package com.shortener.telemetry;

import com.shortener.config.TelemetryProperties;
import com.shortener.model.TelemetryEvent;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * Ships events as JSON to an external log collection endpoint.
 */
@Component
@ConditionalOnProperty(name = "shortener.telemetry.sink", havingValue = "http")
public class HttpTelemetrySink implements TelemetrySink {

    private static final Logger log = LoggerFactory.getLogger(HttpTelemetrySink.class);

    private final RestClient restClient;
    private final TelemetryProperties properties;

    public HttpTelemetrySink(RestClient.Builder builder, TelemetryProperties properties) {
        if (properties.endpoint().isBlank()) {
            throw new IllegalStateException("shortener.telemetry.endpoint is required for the http sink");
        }
        this.restClient = builder.build();
        this.properties = properties;
    }

    @Override
    public void record(TelemetryEvent event) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("stack", event.stack());
        body.put("level", event.level());
        body.put("package", event.pkg());
        body.put("message", event.message());

        RestClient.RequestBodySpec request = restClient.post()
                .uri(properties.endpoint())
                .contentType(MediaType.APPLICATION_JSON);
        if (!properties.token().isBlank()) {
            request.header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.token());
        }
        request.body(body).retrieve().toBodilessEntity();
        log.trace("Shipped telemetry event to {}: {}", properties.endpoint(), body);
    }
}
