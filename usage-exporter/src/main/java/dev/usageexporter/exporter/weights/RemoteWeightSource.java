package dev.usageexporter.exporter.weights;

import com.fasterxml.jackson.databind.JsonNode;
import dev.usageexporter.core.SourceUnavailableException;
import dev.usageexporter.core.WeightSource;
import dev.usageexporter.core.WeightTable;
import dev.usageexporter.exporter.JsonHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fetches {@code {"mb_weight": .., "vcpu_weight": ..}} from an HTTP endpoint on every call.
 * When the endpoint fails, the last table fetched successfully (initially neutral) is returned.
 */
public class RemoteWeightSource implements WeightSource {
    private static final Logger logger = LoggerFactory.getLogger(RemoteWeightSource.class);

    private final JsonHttpClient http;
    private final URI endpoint;
    private final AtomicReference<WeightTable> cached = new AtomicReference<>(WeightTable.NEUTRAL);

    public RemoteWeightSource(JsonHttpClient http, URI endpoint) {
        this.http = http;
        this.endpoint = endpoint;
    }

    @Override
    public WeightTable current() {
        try {
            WeightTable fetched = parse(http.get(endpoint));
            cached.set(fetched);
            return fetched;
        } catch (SourceUnavailableException e) {
            WeightTable stale = cached.get();
            logger.warn("Weight endpoint unavailable, keeping {}: {}", stale, e.getMessage());
            return stale;
        }
    }

    static WeightTable parse(JsonNode body) throws SourceUnavailableException {
        JsonNode mb = body.path("mb_weight");
        JsonNode vcpu = body.path("vcpu_weight");
        if (!mb.isNumber() || !vcpu.isNumber()) {
            throw new SourceUnavailableException("Weight response lacks numeric mb_weight/vcpu_weight: " + body);
        }
        try {
            return new WeightTable(mb.asDouble(), vcpu.asDouble());
        } catch (IllegalArgumentException e) {
            throw new SourceUnavailableException(e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "remote(" + endpoint + ")";
    }
}
