package dev.usageexporter.exporter;

import dev.usageexporter.core.MetricsSink;
import dev.usageexporter.core.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the latest published snapshot. Scrapes read it lock-free; a publish replaces it whole,
 * so a scrape sees either the old or the new snapshot.
 */
public class MetricsRegistry implements MetricsSink {
    private static final Logger logger = LoggerFactory.getLogger(MetricsRegistry.class);

    private final AtomicReference<Snapshot> current = new AtomicReference<>(Snapshot.empty());

    @Override
    public void publish(Snapshot snapshot) {
        Snapshot previous = current.getAndSet(snapshot);
        logger.debug("Published {} (replacing {})", snapshot, previous);
    }

    public Snapshot current() {
        return current.get();
    }
}
