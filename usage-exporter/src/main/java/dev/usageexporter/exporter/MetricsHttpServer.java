package dev.usageexporter.exporter;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import dev.usageexporter.core.UsageScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * HTTP endpoint scraped by Prometheus.
 * Serves the latest snapshot on /metrics and a liveness check on /health.
 */
public class MetricsHttpServer {
    private static final Logger logger = LoggerFactory.getLogger(MetricsHttpServer.class);
    private final HttpServer server;
    private final ExecutorService executor;
    private final MetricsRegistry registry;
    private final Supplier<UsageScheduler.Status> status;

    /**
     * @param port   port to bind, 0 for an ephemeral one
     * @param status scheduler counters for the self gauges; may return {@code null}
     */
    public MetricsHttpServer(int port, MetricsRegistry registry, Supplier<UsageScheduler.Status> status)
            throws IOException {
        this.registry = registry;
        this.status = status;
        this.server = HttpServer.create(new InetSocketAddress(port), 0);

        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/health", new HealthHandler());

        this.executor = Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "metrics-http");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        logger.info("MetricsHttpServer created on port {}", port());
    }

    public void start() {
        server.start();
        logger.info("MetricsHttpServer started");
    }

    public void stop() {
        server.stop(1);
        executor.shutdown();
        logger.info("MetricsHttpServer stopped");
    }

    /** Bound port, resolved when 0 was requested. */
    public int port() {
        return server.getAddress().getPort();
    }

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equals(exchange.getRequestMethod()) && !"HEAD".equals(exchange.getRequestMethod())) {
                exchange.getResponseHeaders().set("Allow", "GET, HEAD");
                respond(exchange, 405, "text/plain; charset=utf-8", "Method Not Allowed");
                return;
            }
            if (!"/metrics".equals(exchange.getRequestURI().getPath())) {
                respond(exchange, 404, "text/plain; charset=utf-8", "Not Found");
                return;
            }
            try {
                String body = PrometheusTextFormat.render(registry.current(), status.get());
                respond(exchange, 200, PrometheusTextFormat.CONTENT_TYPE, body);
            } catch (RuntimeException e) {
                logger.error("Error handling metrics request", e);
                respond(exchange, 500, "text/plain; charset=utf-8", "Internal server error");
            }
        }
    }

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            respond(exchange, 200, "text/plain; charset=utf-8", "OK");
        }
    }

    private static void respond(HttpExchange exchange, int status, String contentType, String body)
            throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        if ("HEAD".equals(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(status, -1);
            exchange.close();
            return;
        }
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
