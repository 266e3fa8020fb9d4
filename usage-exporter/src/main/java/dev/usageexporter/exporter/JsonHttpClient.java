package dev.usageexporter.exporter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.usageexporter.core.SourceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Blocking JSON GET client shared by every remote source. Each request is bounded by the
 * configured timeout; transport errors, timeouts, non-2xx answers and unparseable bodies all
 * surface as {@link SourceUnavailableException}.
 */
public class JsonHttpClient {
    private static final Logger logger = LoggerFactory.getLogger(JsonHttpClient.class);

    private final HttpClient client;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Duration timeout;

    public JsonHttpClient(Duration timeout) {
        this.timeout = timeout;
        this.client = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    public JsonNode get(URI uri) throws SourceUnavailableException {
        return get(uri, Map.of());
    }

    public JsonNode get(URI uri, Map<String, String> headers) throws SourceUnavailableException {
        HttpRequest.Builder request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET();
        headers.forEach(request::header);

        long startNanos = System.nanoTime();
        try {
            HttpResponse<String> response = client.send(request.build(), HttpResponse.BodyHandlers.ofString());
            logger.debug("GET {} -> {} in {}ms", uri, response.statusCode(),
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw new SourceUnavailableException("HTTP " + response.statusCode() + " from " + uri);
            }
            return objectMapper.readTree(response.body());
        } catch (SourceUnavailableException e) {
            throw e;
        } catch (IOException e) {
            throw new SourceUnavailableException("GET " + uri + " failed: " + e, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException("Interrupted while calling " + uri, e);
        }
    }
}
