package dev.usageexporter.core;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable result of one completed tick. Readers get the whole snapshot or the previous one,
 * never a mix.
 */
public final class Snapshot {
    private static final Snapshot EMPTY = new Snapshot(List.of(), WeightTable.NEUTRAL, Instant.EPOCH);

    private final List<ExportedMetric> metrics;
    private final WeightTable weights;
    private final Instant createdAt;

    public Snapshot(List<ExportedMetric> metrics, WeightTable weights, Instant createdAt) {
        this.metrics = List.copyOf(metrics);
        this.weights = Objects.requireNonNull(weights, "weights");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    /** Placeholder published before the first tick completes. */
    public static Snapshot empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return metrics.isEmpty();
    }

    public List<ExportedMetric> metrics() {
        return metrics;
    }

    public WeightTable weights() {
        return weights;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Optional<ExportedMetric> find(String projectName, UsageMetric metric) {
        return metrics.stream()
                .filter(m -> m.metric == metric && m.project.projectName.equals(projectName))
                .findFirst();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Snapshot)) return false;
        Snapshot other = (Snapshot) o;
        return metrics.equals(other.metrics)
                && weights.equals(other.weights)
                && createdAt.equals(other.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metrics, weights, createdAt);
    }

    @Override
    public String toString() {
        return String.format("Snapshot[%d metrics, %s, at %s]", metrics.size(), weights, createdAt);
    }
}
