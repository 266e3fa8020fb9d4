package dev.usageexporter.core;

import java.util.Map;
import java.util.Objects;

/**
 * Usage of a single server (instance) inside a project, together with its metadata.
 */
public final class InstanceUsage {
    public final String instanceId;
    public final double memoryMbUsage;
    public final double vcpuUsage;
    public final Map<String, String> metadata;

    public InstanceUsage(String instanceId, double memoryMbUsage, double vcpuUsage,
                         Map<String, String> metadata) {
        this.instanceId = Objects.requireNonNull(instanceId, "instanceId");
        this.memoryMbUsage = memoryMbUsage;
        this.vcpuUsage = vcpuUsage;
        this.metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    @Override
    public String toString() {
        return String.format("%s: mb=%.3f, vcpu=%.3f, metadata=%s",
                instanceId, memoryMbUsage, vcpuUsage, metadata);
    }
}
