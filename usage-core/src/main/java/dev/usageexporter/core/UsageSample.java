package dev.usageexporter.core;

import java.util.Objects;

/**
 * Raw, unweighted usage reading for one project.
 */
public final class UsageSample {
    public final Project project;
    public final double memoryMbUsage;
    public final double vcpuUsage;

    public UsageSample(Project project, double memoryMbUsage, double vcpuUsage) {
        this.project = Objects.requireNonNull(project, "project");
        this.memoryMbUsage = memoryMbUsage;
        this.vcpuUsage = vcpuUsage;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UsageSample)) return false;
        UsageSample other = (UsageSample) o;
        return project.equals(other.project)
                && Double.compare(memoryMbUsage, other.memoryMbUsage) == 0
                && Double.compare(vcpuUsage, other.vcpuUsage) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(project, memoryMbUsage, vcpuUsage);
    }

    @Override
    public String toString() {
        return String.format("%s: mb=%.3f, vcpu=%.3f", project, memoryMbUsage, vcpuUsage);
    }
}
