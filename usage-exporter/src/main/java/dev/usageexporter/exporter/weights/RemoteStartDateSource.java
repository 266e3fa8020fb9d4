package dev.usageexporter.exporter.weights;

import com.fasterxml.jackson.databind.JsonNode;
import dev.usageexporter.core.Instants;
import dev.usageexporter.core.SourceUnavailableException;
import dev.usageexporter.core.StartDateSource;
import dev.usageexporter.exporter.JsonHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fetches {@code {"start_date": ".."}} from an HTTP endpoint. Until the first successful fetch,
 * and whenever the endpoint fails, the last known start date is returned.
 */
public class RemoteStartDateSource implements StartDateSource {
    private static final Logger logger = LoggerFactory.getLogger(RemoteStartDateSource.class);

    private final JsonHttpClient http;
    private final URI endpoint;
    private final AtomicReference<Instant> cached;

    public RemoteStartDateSource(JsonHttpClient http, URI endpoint, Instant fallback) {
        this.http = http;
        this.endpoint = endpoint;
        this.cached = new AtomicReference<>(fallback);
    }

    @Override
    public Instant current() {
        try {
            Instant fetched = parse(http.get(endpoint));
            cached.set(fetched);
            return fetched;
        } catch (SourceUnavailableException e) {
            Instant stale = cached.get();
            logger.warn("Start date endpoint unavailable, keeping {}: {}", stale, e.getMessage());
            return stale;
        }
    }

    static Instant parse(JsonNode body) throws SourceUnavailableException {
        JsonNode value = body.path("start_date");
        if (!value.isTextual()) {
            throw new SourceUnavailableException("Start date response lacks start_date: " + body);
        }
        try {
            return Instants.parse(value.asText());
        } catch (IllegalArgumentException e) {
            throw new SourceUnavailableException(e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "remote(" + endpoint + ")";
    }
}
