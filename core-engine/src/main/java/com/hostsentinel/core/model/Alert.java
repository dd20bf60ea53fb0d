package com.hostsentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Alert raised for one metric of one device.
 *
 * <p>
 * The id is the composite key {@code deviceId + "_" + metric} (see
 * {@link #keyOf(String, String)}), so a device/metric pair has at most one alert
 * record. The record is updated in place when its level changes and marked
 * resolved when the metric returns to normal; it is not deleted.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code deviceId}, {@code metric}, {@code level} and
 * {@code timestamp} are required; the id is derived from the first two.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Instances are <strong>not</strong> thread-safe. The alert manager never
 * mutates a published instance; it replaces it with a modified
 * {@link #copy()}.
 * </p>
 *
 * @since 1.0.0
 */
public class Alert {

    private String id;
    private String deviceId;
    private String metric;
    private AlertLevel level;
    private double value;

    /** Threshold that was crossed; {@code 0.0} for anomaly alerts. */
    private double threshold;

    private Instant timestamp;
    private boolean acknowledged;
    private boolean resolved;
    private String message;

    public Alert() {
    }

    private Alert(Builder builder) {
        this.deviceId = Objects.requireNonNull(builder.deviceId, "deviceId must not be null");
        this.metric = Objects.requireNonNull(builder.metric, "metric must not be null");
        this.level = Objects.requireNonNull(builder.level, "level must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.id = keyOf(deviceId, metric);
        this.value = builder.value;
        this.threshold = builder.threshold;
        this.acknowledged = builder.acknowledged;
        this.resolved = builder.resolved;
        this.message = builder.message;
    }

    /**
     * Compose the alert key for a device/metric pair.
     *
     * @param deviceId device identity
     * @param metric   metric name
     * @return {@code deviceId + "_" + metric}
     */
    public static String keyOf(String deviceId, String metric) {
        return deviceId + "_" + metric;
    }

    /**
     * @return a field-by-field copy of this alert
     */
    public Alert copy() {
        Alert copy = new Alert();
        copy.id = id;
        copy.deviceId = deviceId;
        copy.metric = metric;
        copy.level = level;
        copy.value = value;
        copy.threshold = threshold;
        copy.timestamp = timestamp;
        copy.acknowledged = acknowledged;
        copy.resolved = resolved;
        copy.message = message;
        return copy;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Alert} instances.
     */
    public static class Builder {
        private String deviceId;
        private String metric;
        private AlertLevel level;
        private double value;
        private double threshold;
        private Instant timestamp;
        private boolean acknowledged;
        private boolean resolved;
        private String message;

        public Builder deviceId(String deviceId) {
            this.deviceId = deviceId;
            return this;
        }

        public Builder metric(String metric) {
            this.metric = metric;
            return this;
        }

        public Builder level(AlertLevel level) {
            this.level = level;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder acknowledged(boolean acknowledged) {
            this.acknowledged = acknowledged;
            return this;
        }

        public Builder resolved(boolean resolved) {
            this.resolved = resolved;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        /**
         * @return a new {@link Alert}
         * @throws NullPointerException if a required field is missing
         */
        public Alert build() {
            return new Alert(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public String getMetric() {
        return metric;
    }

    public AlertLevel getLevel() {
        return level;
    }

    public void setLevel(AlertLevel level) {
        this.level = level;
    }

    public double getValue() {
        return value;
    }

    public void setValue(double value) {
        this.value = value;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public boolean isAcknowledged() {
        return acknowledged;
    }

    public void setAcknowledged(boolean acknowledged) {
        this.acknowledged = acknowledged;
    }

    public boolean isResolved() {
        return resolved;
    }

    public void setResolved(boolean resolved) {
        this.resolved = resolved;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return Objects.equals(id, alert.id)
                && level == alert.level
                && Objects.equals(timestamp, alert.timestamp)
                && resolved == alert.resolved;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, level, timestamp, resolved);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "id='" + id + '\'' +
                ", level=" + level +
                ", value=" + value +
                ", threshold=" + threshold +
                ", timestamp=" + timestamp +
                ", acknowledged=" + acknowledged +
                ", resolved=" + resolved +
                ", message='" + message + '\'' +
                '}';
    }
}
