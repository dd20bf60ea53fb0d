package com.hostsentinel.core.alert;

import com.hostsentinel.core.model.AlertLevel;

import java.util.Objects;

/**
 * Level assigned to one reading, with the threshold that was crossed and the
 * message to put on the alert.
 *
 * @since 1.0.0
 */
public final class Classification {

    private final AlertLevel level;
    private final double threshold;
    private final String message;

    public Classification(AlertLevel level, double threshold, String message) {
        this.level = Objects.requireNonNull(level, "level must not be null");
        this.threshold = threshold;
        this.message = message;
    }

    public AlertLevel getLevel() {
        return level;
    }

    public double getThreshold() {
        return threshold;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "Classification{level=" + level + ", threshold=" + threshold + ", message='" + message + "'}";
    }
}
