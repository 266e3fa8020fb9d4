package dev.usageexporter.exporter;

import dev.usageexporter.core.ExportedMetric;
import dev.usageexporter.core.Snapshot;
import dev.usageexporter.core.UsageMetric;
import dev.usageexporter.core.UsageScheduler;
import io.prometheus.metrics.expositionformats.PrometheusTextFormatWriter;
import io.prometheus.metrics.model.snapshots.CounterSnapshot;
import io.prometheus.metrics.model.snapshots.GaugeSnapshot;
import io.prometheus.metrics.model.snapshots.Labels;
import io.prometheus.metrics.model.snapshots.MetricSnapshot;
import io.prometheus.metrics.model.snapshots.MetricSnapshots;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maps a snapshot and the scheduler counters onto Prometheus metric snapshots and renders them
 * in the text exposition format, version 0.0.4.
 */
public final class PrometheusTextFormat {
    public static final String CONTENT_TYPE = PrometheusTextFormatWriter.CONTENT_TYPE;

    private static final PrometheusTextFormatWriter WRITER = new PrometheusTextFormatWriter(false);

    private PrometheusTextFormat() {
    }

    /**
     * @param status scheduler counters for the self metrics, or {@code null} to omit them
     */
    public static MetricSnapshots toMetricSnapshots(Snapshot snapshot, UsageScheduler.Status status) {
        List<MetricSnapshot> snapshots = new ArrayList<>();
        for (UsageMetric metric : UsageMetric.values()) {
            GaugeSnapshot.Builder gauge = GaugeSnapshot.builder()
                    .name(metric.gaugeName())
                    .help(metric.help());
            for (ExportedMetric exported : snapshot.metrics()) {
                if (exported.metric == metric) {
                    gauge.dataPoint(GaugeSnapshot.GaugeDataPointSnapshot.builder()
                            .labels(labels(exported.labels()))
                            .value(exported.value)
                            .build());
                }
            }
            snapshots.add(gauge.build());
        }

        if (status != null) {
            snapshots.add(counter("usage_exporter_ticks", "Update cycles started", status.ticks));
            snapshots.add(counter("usage_exporter_failed_ticks", "Update cycles that kept the previous snapshot",
                    status.failedTicks));
            snapshots.add(gauge("usage_exporter_last_success_timestamp_seconds",
                    "Unix time of the last successful update",
                    status.lastSuccess == null ? 0 : status.lastSuccess.toEpochMilli() / 1000.0));
            snapshots.add(gauge("usage_exporter_mb_weight", "Weight currently applied to MB usage",
                    status.weights.mbWeight));
            snapshots.add(gauge("usage_exporter_vcpu_weight", "Weight currently applied to vcpu usage",
                    status.weights.vcpuWeight));
        }
        return new MetricSnapshots(snapshots);
    }

    public static String render(Snapshot snapshot, UsageScheduler.Status status) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            WRITER.write(out, toMetricSnapshots(snapshot, status));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString(StandardCharsets.UTF_8);
    }

    private static Labels labels(Map<String, String> labels) {
        Labels.Builder builder = Labels.builder();
        labels.forEach(builder::label);
        return builder.build();
    }

    private static GaugeSnapshot gauge(String name, String help, double value) {
        return GaugeSnapshot.builder()
                .name(name)
                .help(help)
                .dataPoint(GaugeSnapshot.GaugeDataPointSnapshot.builder().value(value).build())
                .build();
    }

    private static CounterSnapshot counter(String name, String help, double value) {
        return CounterSnapshot.builder()
                .name(name)
                .help(help)
                .dataPoint(CounterSnapshot.CounterDataPointSnapshot.builder().value(value).build())
                .build();
    }
}
