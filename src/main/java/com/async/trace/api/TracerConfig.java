package com.async.trace.api;

import java.util.Properties;

/**
 * Configuration for the tracer.
 *
 * @param recordWakeups    whether notifiers emit wakeup events (wakeups are always relayed)
 * @param strictTimestamps whether timestamps are forced to be strictly increasing per thread
 */
public record TracerConfig(boolean recordWakeups, boolean strictTimestamps) {

    public static final String RECORD_WAKEUPS_PROPERTY = "asynctrace.recordWakeups";
    public static final String STRICT_TIMESTAMPS_PROPERTY = "asynctrace.strictTimestamps";

    /**
     * Default configuration: wakeups recorded, strict timestamps.
     */
    public static TracerConfig defaults() {
        return new TracerConfig(true, true);
    }

    /**
     * Reads the configuration from {@code properties}, falling back to the defaults for
     * missing keys.
     *
     * @throws IllegalArgumentException if a value is not {@code true} or {@code false}
     */
    public static TracerConfig fromProperties(Properties properties) {
        TracerConfig defaults = defaults();
        return new TracerConfig(
                readBoolean(properties, RECORD_WAKEUPS_PROPERTY, defaults.recordWakeups()),
                readBoolean(properties, STRICT_TIMESTAMPS_PROPERTY, defaults.strictTimestamps()));
    }

    public static TracerConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    private static boolean readBoolean(Properties properties, String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        String trimmed = value.trim();
        if ("true".equalsIgnoreCase(trimmed)) {
            return true;
        }
        if ("false".equalsIgnoreCase(trimmed)) {
            return false;
        }
        throw new IllegalArgumentException(key + " must be true or false, got '" + value + "'");
    }
}
