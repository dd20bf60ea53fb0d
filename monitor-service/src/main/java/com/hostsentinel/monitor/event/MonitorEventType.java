package com.hostsentinel.monitor.event;

/**
 * Kinds of {@link MonitorEvent}.
 *
 * @since 1.0.0
 */
public enum MonitorEventType {

    /** A device's status, counters or readings changed. */
    DEVICE_UPDATED,

    /** An alert was created, updated, reopened, resolved or acknowledged. */
    ALERT,

    /** A poll cycle finished. */
    CYCLE_COMPLETED,

    /** Free-form log line for the activity panel. */
    LOG
}
