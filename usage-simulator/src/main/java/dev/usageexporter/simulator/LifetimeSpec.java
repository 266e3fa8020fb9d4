package dev.usageexporter.simulator;

import dev.usageexporter.core.Project;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One simulated machine: its size and the interval during which it exists.
 * An absent {@code endedAt} means the machine is still running.
 */
public final class LifetimeSpec {
    public final Project project;
    public final String instanceId;
    public final double memoryMb;
    public final double vcpus;
    public final Instant startedAt;
    private final Instant endedAt;
    public final Map<String, String> metadata;

    public LifetimeSpec(Project project, String instanceId, double memoryMb, double vcpus,
                        Instant startedAt, Instant endedAt, Map<String, String> metadata) {
        this.project = Objects.requireNonNull(project, "project");
        this.instanceId = Objects.requireNonNull(instanceId, "instanceId");
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
        if (memoryMb <= 0 || vcpus <= 0) {
            throw new IllegalArgumentException("memory_mb and vcpus must be positive");
        }
        if (endedAt != null && endedAt.isBefore(startedAt)) {
            throw new IllegalArgumentException("ended_at " + endedAt + " lies before started_at " + startedAt);
        }
        this.memoryMb = memoryMb;
        this.vcpus = vcpus;
        this.endedAt = endedAt;
        this.metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public Optional<Instant> endedAt() {
        return Optional.ofNullable(endedAt);
    }

    /** True while {@code startedAt <= at < endedAt}. */
    public boolean isActiveAt(Instant at) {
        return !startedAt.isAfter(at) && (endedAt == null || endedAt.isAfter(at));
    }

    @Override
    public String toString() {
        return String.format("%s[%s, mb=%s, vcpus=%s, %s..%s]", instanceId, project.projectName,
                memoryMb, vcpus, startedAt, endedAt == null ? "ongoing" : endedAt);
    }
}
