package com.hostsentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A single observed metric value. Immutable.
 *
 * @since 1.0.0
 */
public final class MetricSample {

    private final double value;
    private final Instant timestamp;

    /**
     * @param value     observed value
     * @param timestamp observation time; must not be {@code null}
     */
    public MetricSample(double value, Instant timestamp) {
        this.value = value;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public double getValue() {
        return value;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricSample that))
            return false;
        return Double.compare(value, that.value) == 0 && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, timestamp);
    }

    @Override
    public String toString() {
        return "MetricSample{value=" + value + ", timestamp=" + timestamp + '}';
    }
}
