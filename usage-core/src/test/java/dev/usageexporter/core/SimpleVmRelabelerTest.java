package dev.usageexporter.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SimpleVmRelabeler")
class SimpleVmRelabelerTest {

    private static final Project UMBRELLA = new Project("svm", "simple-vm", "d1", "elixir");

    @Test
    @DisplayName("should only recognise the configured umbrella project")
    void shouldRecogniseUmbrella() {
        SimpleVmRelabeler relabeler = new SimpleVmRelabeler("svm", "project_name");
        assertTrue(relabeler.isUmbrella(UMBRELLA));
        assertFalse(relabeler.isUmbrella(new Project("other", "x", "d1", "elixir")));
        assertFalse(SimpleVmRelabeler.disabled().isUmbrella(UMBRELLA));
    }

    @Test
    @DisplayName("should group tagged instances into sub-projects")
    void shouldGroupByTag() {
        SimpleVmRelabeler relabeler = new SimpleVmRelabeler("svm", "project_name");

        List<UsageSample> samples = relabeler.relabel(UMBRELLA, List.of(
                new InstanceUsage("i1", 1024, 2, Map.of("project_name", "workshop")),
                new InstanceUsage("i2", 2048, 4, Map.of("project_name", "workshop")),
                new InstanceUsage("i3", 512, 1, Map.of("project_name", "thesis")),
                new InstanceUsage("i4", 256, 1, Map.of())));

        assertEquals(List.of(
                new UsageSample(UMBRELLA.withProjectName("workshop"), 3072, 6),
                new UsageSample(UMBRELLA.withProjectName("thesis"), 512, 1),
                new UsageSample(UMBRELLA, 256, 1)), samples);
    }

    @Test
    @DisplayName("should keep an empty umbrella project visible with zero usage")
    void shouldReportEmptyUmbrella() {
        SimpleVmRelabeler relabeler = new SimpleVmRelabeler("svm", "project_name");
        assertEquals(List.of(new UsageSample(UMBRELLA, 0, 0)), relabeler.relabel(UMBRELLA, List.of()));
    }

    @Test
    @DisplayName("should fall back to the default tag when none is configured")
    void shouldDefaultTag() {
        assertEquals(SimpleVmRelabeler.DEFAULT_TAG, new SimpleVmRelabeler("svm", " ").tag());
    }
}
