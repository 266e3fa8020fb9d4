package dev.usageexporter.core;

/**
 * The two usage figures exported per project, with the gauge each one is published under.
 */
public enum UsageMetric {
    TOTAL_MEMORY_MB_USAGE("total_memory_mb_usage", "project_mb_usage", "Total MB usage"),
    TOTAL_VCPUS_USAGE("total_vcpus_usage", "project_vcpu_usage", "Total vcpu usage");

    private final String key;
    private final String gaugeName;
    private final String help;

    UsageMetric(String key, String gaugeName, String help) {
        this.key = key;
        this.gaugeName = gaugeName;
        this.help = help;
    }

    /** Field name used by the usage API, e.g. {@code total_memory_mb_usage}. */
    public String key() {
        return key;
    }

    public String gaugeName() {
        return gaugeName;
    }

    public String help() {
        return help;
    }
}
