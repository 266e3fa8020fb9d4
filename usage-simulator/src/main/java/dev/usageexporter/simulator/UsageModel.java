package dev.usageexporter.simulator;

import java.time.Instant;
import java.util.Locale;

/**
 * How a simulated machine translates into usage figures at a given instant.
 */
public interface UsageModel {

    /**
     * @return {@code {memoryMbUsage, vcpuUsage}} for the machine
     */
    double[] usage(LifetimeSpec machine, Instant windowStart, Instant now);

    static UsageModel named(String name) {
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "allocation":
                return new AllocationUsageModel();
            case "integrated":
                return new IntegratedUsageModel();
            default:
                throw new IllegalArgumentException(
                        "Unknown simulation model '" + name + "', expected 'allocation' or 'integrated'");
        }
    }
}
