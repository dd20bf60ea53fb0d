package com.hostsentinel.core.alert;

/**
 * Kind of alert state change reported to {@link AlertListener}s.
 *
 * @since 1.0.0
 */
public enum AlertEventType {

    /** First qualifying classification for a device/metric pair. */
    CREATED,

    /** Level changed on an unresolved alert. */
    UPDATED,

    /** A resolved alert qualified again. */
    REOPENED,

    /** Metric returned to normal; the alert was archived. */
    RESOLVED,

    /** An operator acknowledged the alert. */
    ACKNOWLEDGED
}
