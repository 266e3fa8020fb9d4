package dev.usageexporter.core;

/**
 * Invalid or conflicting startup configuration. Fatal: the exporter exits before serving.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
