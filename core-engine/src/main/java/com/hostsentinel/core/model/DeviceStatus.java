package com.hostsentinel.core.model;

/**
 * Reachability state of a monitored device.
 *
 * @since 1.0.0
 */
public enum DeviceStatus {

    /** Last connection attempt succeeded. */
    ONLINE,

    /** Last connection attempt failed. */
    CONNECTION_FAILED,

    /** Never contacted, or state could not be restored. */
    UNKNOWN;

    /**
     * Lenient parse used when reading persisted rows.
     *
     * @param value stored name, may be {@code null}
     * @return the matching status, or {@link #UNKNOWN}
     */
    public static DeviceStatus fromString(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        for (DeviceStatus status : values()) {
            if (status.name().equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
