package dev.usageexporter.core;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single labeled gauge value ready to be scraped.
 */
public final class ExportedMetric {
    public final Project project;
    public final UsageMetric metric;
    public final double value;

    public ExportedMetric(Project project, UsageMetric metric, double value) {
        this.project = Objects.requireNonNull(project, "project");
        this.metric = Objects.requireNonNull(metric, "metric");
        this.value = value;
    }

    /**
     * Label set in exposition order.
     */
    public Map<String, String> labels() {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put("project_id", project.projectId);
        labels.put("project_name", project.projectName);
        labels.put("domain_name", project.domainName);
        labels.put("domain_id", project.domainId);
        return labels;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExportedMetric)) return false;
        ExportedMetric other = (ExportedMetric) o;
        return project.equals(other.project)
                && metric == other.metric
                && Double.compare(value, other.value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(project, metric, value);
    }

    @Override
    public String toString() {
        return metric.key() + labels() + "=" + value;
    }
}
