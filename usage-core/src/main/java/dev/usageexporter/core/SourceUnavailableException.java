package dev.usageexporter.core;

import java.io.IOException;

/**
 * A usage, weight or start-date source could not be reached, timed out, rejected our
 * credentials or returned something unusable. Scoped to a single tick.
 */
public class SourceUnavailableException extends IOException {

    public SourceUnavailableException(String message) {
        super(message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
