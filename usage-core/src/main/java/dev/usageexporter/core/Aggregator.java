package dev.usageexporter.core;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies the weight table to filtered samples and builds the snapshot.
 * Samples sharing a label set are summed so every label set appears once per metric.
 */
public class Aggregator {

    public Snapshot aggregate(List<UsageSample> samples, WeightTable weights) {
        return aggregate(samples, weights, Instant.now());
    }

    public Snapshot aggregate(List<UsageSample> samples, WeightTable weights, Instant createdAt) {
        Map<Project, double[]> totals = new LinkedHashMap<>();
        for (UsageSample sample : samples) {
            double[] total = totals.computeIfAbsent(sample.project, p -> new double[2]);
            total[0] += sample.memoryMbUsage;
            total[1] += sample.vcpuUsage;
        }

        List<ExportedMetric> metrics = new ArrayList<>(totals.size() * 2);
        for (Map.Entry<Project, double[]> entry : totals.entrySet()) {
            double[] total = entry.getValue();
            metrics.add(new ExportedMetric(entry.getKey(), UsageMetric.TOTAL_MEMORY_MB_USAGE,
                    total[0] * weights.mbWeight));
            metrics.add(new ExportedMetric(entry.getKey(), UsageMetric.TOTAL_VCPUS_USAGE,
                    total[1] * weights.vcpuWeight));
        }
        return new Snapshot(metrics, weights, createdAt);
    }
}
