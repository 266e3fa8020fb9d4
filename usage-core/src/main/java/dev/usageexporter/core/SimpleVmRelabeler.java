package dev.usageexporter.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits the usage of the SimpleVM umbrella project into one sample per hosted sub-project.
 *
 * Each instance of the umbrella project whose metadata carries the configured tag is reported
 * under a project named after the tag's value; untagged instances stay with the umbrella.
 */
public final class SimpleVmRelabeler {
    public static final String DEFAULT_TAG = "project_name";

    private static final SimpleVmRelabeler DISABLED = new SimpleVmRelabeler(null, DEFAULT_TAG);

    private final String umbrellaProjectId;
    private final String tag;

    public SimpleVmRelabeler(String umbrellaProjectId, String tag) {
        this.umbrellaProjectId = umbrellaProjectId == null || umbrellaProjectId.isBlank()
                ? null : umbrellaProjectId;
        this.tag = tag == null || tag.isBlank() ? DEFAULT_TAG : tag;
    }

    public static SimpleVmRelabeler disabled() {
        return DISABLED;
    }

    public boolean isEnabled() {
        return umbrellaProjectId != null;
    }

    public boolean isUmbrella(Project project) {
        return umbrellaProjectId != null && umbrellaProjectId.equals(project.projectId);
    }

    public String tag() {
        return tag;
    }

    /**
     * @return one sample per sub-project; a single zero sample for the umbrella when it has no
     *         instances at all
     */
    public List<UsageSample> relabel(Project umbrella, List<InstanceUsage> instances) {
        if (instances.isEmpty()) {
            return List.of(new UsageSample(umbrella, 0.0, 0.0));
        }
        Map<Project, double[]> grouped = new LinkedHashMap<>();
        for (InstanceUsage instance : instances) {
            String subProject = instance.metadata.get(tag);
            Project target = subProject == null || subProject.isBlank()
                    ? umbrella
                    : umbrella.withProjectName(subProject);
            double[] total = grouped.computeIfAbsent(target, p -> new double[2]);
            total[0] += instance.memoryMbUsage;
            total[1] += instance.vcpuUsage;
        }

        List<UsageSample> samples = new ArrayList<>(grouped.size());
        grouped.forEach((project, total) -> samples.add(new UsageSample(project, total[0], total[1])));
        return samples;
    }

    @Override
    public String toString() {
        return isEnabled() ? "simple_vm_id=" + umbrellaProjectId + ", tag=" + tag : "disabled";
    }
}
