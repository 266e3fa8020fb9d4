package dev.usageexporter.exporter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import dev.usageexporter.core.ExportedMetric;
import dev.usageexporter.core.Project;
import dev.usageexporter.core.Snapshot;
import dev.usageexporter.core.UsageMetric;
import dev.usageexporter.core.UsageScheduler;
import dev.usageexporter.core.WeightTable;

@DisplayName("PrometheusTextFormat")
class PrometheusTextFormatTest {

    private static final Project ALPHA = new Project("p-1", "alpha-project", "d-1", "alpha");

    @Test
    @DisplayName("Should render both gauges with the four project labels")
    void shouldRenderProjectGauges() {
        Snapshot snapshot = new Snapshot(List.of(
                new ExportedMetric(ALPHA, UsageMetric.TOTAL_MEMORY_MB_USAGE, 1024.0),
                new ExportedMetric(ALPHA, UsageMetric.TOTAL_VCPUS_USAGE, 8.0)),
                new WeightTable(0.5, 2.0), Instant.EPOCH);

        String text = PrometheusTextFormat.render(snapshot, null);

        assertEquals(String.join("\n",
                "# HELP project_mb_usage Total MB usage",
                "# TYPE project_mb_usage gauge",
                "project_mb_usage{domain_id=\"d-1\",domain_name=\"alpha\",project_id=\"p-1\",project_name=\"alpha-project\"} 1024.0",
                "# HELP project_vcpu_usage Total vcpu usage",
                "# TYPE project_vcpu_usage gauge",
                "project_vcpu_usage{domain_id=\"d-1\",domain_name=\"alpha\",project_id=\"p-1\",project_name=\"alpha-project\"} 8.0",
                ""), text);
    }

    @Test
    @DisplayName("Should render no project series before any project is exported")
    void shouldRenderEmptySnapshot() {
        String text = PrometheusTextFormat.render(Snapshot.empty(), null);

        assertFalse(text.contains("project_mb_usage{"));
        assertFalse(text.contains("project_vcpu_usage{"));
    }

    @Test
    @DisplayName("Should escape quotes, backslashes and newlines in label values")
    void shouldEscapeLabels() {
        Project odd = new Project("p\"2", "C:\\data", "d-2", "multi\nline");
        Snapshot snapshot = new Snapshot(List.of(new ExportedMetric(odd, UsageMetric.TOTAL_VCPUS_USAGE, 1.5)),
                WeightTable.NEUTRAL, Instant.EPOCH);

        String text = PrometheusTextFormat.render(snapshot, null);

        assertTrue(text.contains(
                "project_vcpu_usage{domain_id=\"d-2\",domain_name=\"multi\\nline\",project_id=\"p\\\"2\",project_name=\"C:\\\\data\"} 1.5"));
    }

    @Test
    @DisplayName("Should append the scheduler self metrics")
    void shouldRenderSelfMetrics() {
        UsageScheduler.Status status = new UsageScheduler.Status(12, 3, new WeightTable(0.5, 2.0),
                Instant.parse("2024-03-01T00:00:00Z"), Instant.ofEpochSecond(1709294400));

        String text = PrometheusTextFormat.render(Snapshot.empty(), status);

        assertTrue(text.contains("\nusage_exporter_ticks_total 12.0\n"));
        assertTrue(text.contains("\nusage_exporter_failed_ticks_total 3.0\n"));
        assertEquals(1709294400.0, sampleValue(text, "usage_exporter_last_success_timestamp_seconds"));
        assertTrue(text.contains("\nusage_exporter_mb_weight 0.5\n"));
        assertTrue(text.contains("\nusage_exporter_vcpu_weight 2.0\n"));
    }

    @Test
    @DisplayName("Should report zero as last success before any update succeeded")
    void shouldReportZeroWithoutSuccess() {
        UsageScheduler.Status status = new UsageScheduler.Status(1, 1, WeightTable.NEUTRAL,
                Instant.parse("2024-03-01T00:00:00Z"), null);

        String text = PrometheusTextFormat.render(Snapshot.empty(), status);

        assertEquals(0.0, sampleValue(text, "usage_exporter_last_success_timestamp_seconds"));
    }

    private static double sampleValue(String text, String name) {
        for (String line : text.split("\n")) {
            if (line.startsWith(name + " ")) {
                return Double.parseDouble(line.substring(name.length() + 1));
            }
        }
        throw new AssertionError(name + " not found in\n" + text);
    }
}
