package dev.usageexporter.core;

import java.time.Instant;
import java.util.List;

/**
 * Produces raw per-project usage samples for the window {@code [windowStart, now)}.
 * Projects rejected by the filter must not be queried or returned.
 */
public interface UsageSource {

    List<UsageSample> collect(DomainFilter filter, Instant windowStart, Instant now)
            throws SourceUnavailableException;

    /** Short description for startup logging. */
    default String describe() {
        return getClass().getSimpleName();
    }
}
