package com.hostsentinel.monitor.scheduler;

import java.util.Locale;

/**
 * Result of one {@link DevicePoller#poll} call.
 *
 * @since 1.0.0
 */
public enum PollOutcome {

    /** Readings collected, evaluated and stored. */
    SUCCESS,

    /** Readings collected and evaluated, but the store rejected a write. */
    PERSISTENCE_FAILED,

    /** The device could not be reached. */
    CONNECTION_FAILED,

    /** The device answered with missing or malformed readings. */
    INVALID_METRICS,

    /** The provider failed while collecting readings. */
    FETCH_FAILED,

    /** The poll was interrupted, usually by its deadline. */
    CANCELLED;

    /**
     * @return lower-case tag value used in metrics
     */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
