package com.hostsentinel.core.model;

import java.util.Locale;

/**
 * Severity of an {@link Alert}.
 *
 * @since 1.0.0
 */
public enum AlertLevel {

    WARNING,
    CRITICAL,

    /** Statistically unusual value relative to the device's own baseline. */
    ANOMALY;

    /**
     * @return lowercase name as stored in the {@code alerts} table
     */
    public String storageName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a stored level name (case-insensitive).
     *
     * @param value stored name
     * @return the level
     * @throws IllegalArgumentException if {@code value} is not a known level
     */
    public static AlertLevel fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Alert level must not be null");
        }
        return AlertLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
