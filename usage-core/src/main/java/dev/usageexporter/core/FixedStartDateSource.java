package dev.usageexporter.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Start date configured at startup and used for the whole run.
 */
public final class FixedStartDateSource implements StartDateSource {
    private final Instant start;

    public FixedStartDateSource(Instant start) {
        this.start = Objects.requireNonNull(start, "start");
    }

    @Override
    public Instant current() {
        return start;
    }

    @Override
    public String toString() {
        return "fixed(" + start + ")";
    }
}
