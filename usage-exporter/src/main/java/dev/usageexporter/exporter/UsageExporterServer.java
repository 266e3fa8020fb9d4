package dev.usageexporter.exporter;

import dev.usageexporter.core.Aggregator;
import dev.usageexporter.core.ConfigurationException;
import dev.usageexporter.core.DomainFilter;
import dev.usageexporter.core.UsageScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Project usage exporter: periodically collects per-project usage, applies the current weights
 * and serves the result to Prometheus.
 *
 * Configuration comes from command-line flags and environment variables, see
 * {@link ExporterConfig#USAGE}.
 */
public class UsageExporterServer {
    private static final Logger logger = LoggerFactory.getLogger(UsageExporterServer.class);

    private final ExporterConfig config;
    private final Clock clock;
    private final MetricsRegistry registry = new MetricsRegistry();
    private UsageScheduler scheduler;
    private MetricsHttpServer metricsServer;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public UsageExporterServer(ExporterConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /**
     * Build the sources, bind the scrape port and start polling.
     *
     * @throws ConfigurationException if a source cannot be built from the configuration
     * @throws IOException            if the scrape port cannot be bound
     */
    public void start() throws IOException {
        JsonHttpClient http = new JsonHttpClient(config.requestTimeout);
        SourceFactory factory = new SourceFactory(config, http);

        scheduler = new UsageScheduler(
                factory.usageSource(),
                factory.weightSource(),
                factory.startDateSource(),
                DomainFilter.of(config.domainId, config.domainNames),
                new Aggregator(),
                registry,
                config.weightUpdateFrequency,
                config.updateInterval,
                clock);

        metricsServer = new MetricsHttpServer(config.port, registry, scheduler::status);
        metricsServer.start();
        scheduler.start();

        logger.info("UsageExporterServer started: {}", config);
        logger.info("Metrics available at http://localhost:{}/metrics", metricsServer.port());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down UsageExporterServer...");
            UsageExporterServer.this.stop();
        }));
    }

    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        if (scheduler != null) {
            scheduler.stop();
        }
        if (metricsServer != null) {
            metricsServer.stop();
        }
    }

    public void blockUntilShutdown() throws InterruptedException {
        if (scheduler != null) {
            scheduler.awaitTermination();
        }
    }

    MetricsRegistry registry() {
        return registry;
    }

    int port() {
        return metricsServer.port();
    }

    public static void main(String[] args) throws InterruptedException {
        ExporterConfig config;
        try {
            config = ExporterConfig.resolve(args, System.getenv(), Instant.now());
        } catch (ConfigurationException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            System.err.println(e.getMessage());
            System.err.println();
            System.err.println(ExporterConfig.USAGE);
            System.exit(2);
            return;
        }
        if (config.helpRequested) {
            System.out.println(ExporterConfig.USAGE);
            return;
        }

        UsageExporterServer server = new UsageExporterServer(config, Clock.systemUTC());
        try {
            server.start();
        } catch (ConfigurationException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            server.stop();
            System.exit(2);
        } catch (IOException e) {
            logger.error("Failed to bind metrics port {}: {}", config.port, e.getMessage());
            server.stop();
            System.exit(1);
        }
        server.blockUntilShutdown();
    }
}
