package dev.usageexporter.core;

import java.time.Instant;

/**
 * Supplies the start of the usage window. Like {@link WeightSource}, never fails observably.
 */
public interface StartDateSource {

    Instant current();

    static StartDateSource fixed(Instant start) {
        return new FixedStartDateSource(start);
    }
}
