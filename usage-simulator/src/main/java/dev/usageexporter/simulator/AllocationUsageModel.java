package dev.usageexporter.simulator;

import java.time.Instant;

/**
 * A running machine reports its full declared size; machines not yet started or already ended
 * report nothing. The usage window is irrelevant.
 */
public class AllocationUsageModel implements UsageModel {

    @Override
    public double[] usage(LifetimeSpec machine, Instant windowStart, Instant now) {
        if (!machine.isActiveAt(now)) {
            return new double[] {0.0, 0.0};
        }
        return new double[] {machine.memoryMb, machine.vcpus};
    }

    @Override
    public String toString() {
        return "allocation";
    }
}
