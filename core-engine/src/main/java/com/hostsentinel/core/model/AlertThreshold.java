package com.hostsentinel.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Warning/critical levels for one metric, loaded from configuration.
 *
 * <p>
 * Values are compared with {@code >=}: a reading equal to the critical level is
 * critical. {@code durationSeconds} is carried for consumers that want to
 * require a sustained breach; the alert manager itself classifies each reading
 * individually.
 * </p>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertThreshold {

    /** Default sustain hint, in seconds. */
    public static final long DEFAULT_DURATION_SECONDS = 300;

    /** Metric name, e.g. {@code cpu}. Normalised to lowercase. */
    private String metric;

    private double warningLevel;
    private double criticalLevel;
    private long durationSeconds = DEFAULT_DURATION_SECONDS;
    private boolean enabled = true;

    public AlertThreshold() {
    }

    public AlertThreshold(String metric, double warningLevel, double criticalLevel) {
        setMetric(metric);
        this.warningLevel = warningLevel;
        this.criticalLevel = criticalLevel;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * @throws IllegalStateException if the threshold is not usable
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (metric == null || metric.isBlank()) {
            errors.add("Threshold 'metric' is required");
        }
        if (Double.isNaN(warningLevel) || Double.isNaN(criticalLevel)) {
            errors.add("Threshold '" + metric + "' levels must be numbers");
        } else if (warningLevel > criticalLevel) {
            errors.add("Threshold '" + metric + "' requires warningLevel <= criticalLevel, got "
                    + warningLevel + " > " + criticalLevel);
        }
        if (durationSeconds < 0) {
            errors.add("Threshold '" + metric + "' requires 'durationSeconds' >= 0");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid AlertThreshold: " + String.join("; ", errors));
        }
    }

    public AlertThreshold copy() {
        AlertThreshold copy = new AlertThreshold(metric, warningLevel, criticalLevel);
        copy.durationSeconds = durationSeconds;
        copy.enabled = enabled;
        return copy;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getMetric() {
        return metric;
    }

    public void setMetric(String metric) {
        this.metric = metric != null ? metric.trim().toLowerCase(Locale.ROOT) : null;
    }

    public double getWarningLevel() {
        return warningLevel;
    }

    public void setWarningLevel(double warningLevel) {
        this.warningLevel = warningLevel;
    }

    public double getCriticalLevel() {
        return criticalLevel;
    }

    public void setCriticalLevel(double criticalLevel) {
        this.criticalLevel = criticalLevel;
    }

    public long getDurationSeconds() {
        return durationSeconds;
    }

    public void setDurationSeconds(long durationSeconds) {
        this.durationSeconds = durationSeconds;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertThreshold that))
            return false;
        return Objects.equals(metric, that.metric)
                && Double.compare(warningLevel, that.warningLevel) == 0
                && Double.compare(criticalLevel, that.criticalLevel) == 0
                && durationSeconds == that.durationSeconds
                && enabled == that.enabled;
    }

    @Override
    public int hashCode() {
        return Objects.hash(metric, warningLevel, criticalLevel, durationSeconds, enabled);
    }

    @Override
    public String toString() {
        return "AlertThreshold{" +
                "metric='" + metric + '\'' +
                ", warningLevel=" + warningLevel +
                ", criticalLevel=" + criticalLevel +
                ", durationSeconds=" + durationSeconds +
                ", enabled=" + enabled +
                '}';
    }
}
