package dev.usageexporter.simulator;

import java.time.Duration;
import java.time.Instant;

/**
 * Size multiplied by the hours the machine existed inside {@code [windowStart, now)}, the same
 * MB-hours and vCPU-hours the compute usage API reports.
 */
public class IntegratedUsageModel implements UsageModel {
    private static final double SECONDS_PER_HOUR = 3600.0;

    @Override
    public double[] usage(LifetimeSpec machine, Instant windowStart, Instant now) {
        Instant from = machine.startedAt.isAfter(windowStart) ? machine.startedAt : windowStart;
        Instant until = machine.endedAt()
                .filter(end -> end.isBefore(now))
                .orElse(now);
        if (!from.isBefore(until)) {
            return new double[] {0.0, 0.0};
        }
        double hours = Duration.between(from, until).toMillis() / 1000.0 / SECONDS_PER_HOUR;
        return new double[] {machine.memoryMb * hours, machine.vcpus * hours};
    }

    @Override
    public String toString() {
        return "integrated";
    }
}
