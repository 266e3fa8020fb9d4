package dev.usageexporter.core;

/**
 * Receives each completed snapshot. Publishing replaces the previous snapshot as a whole.
 */
@FunctionalInterface
public interface MetricsSink {
    void publish(Snapshot snapshot);
}
