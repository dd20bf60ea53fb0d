package com.hostsentinel.monitor.scheduler;

import com.hostsentinel.core.config.MonitorConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * Typed, immutable timing and fan-out settings for the
 * {@link MonitoringScheduler}.
 *
 * <p>
 * Use {@link #fromConfig(MonitorConfig)} in production, or the
 * {@link Builder} when tests need sub-second intervals.
 * </p>
 *
 * @since 1.0.0
 */
public final class SchedulerSettings {

    private final Duration interval;
    private final Duration taskTimeout;
    private final int maxConcurrentMonitors;
    private final boolean retryFailedConnections;

    private SchedulerSettings(Builder b) {
        this.interval = b.interval;
        this.taskTimeout = b.taskTimeout;
        this.maxConcurrentMonitors = b.maxConcurrentMonitors;
        this.retryFailedConnections = b.retryFailedConnections;
    }

    public static SchedulerSettings fromConfig(MonitorConfig config) {
        return new Builder()
                .interval(Duration.ofSeconds(config.getMonitoringIntervalSeconds()))
                .taskTimeout(Duration.ofSeconds(config.getTaskTimeoutSeconds()))
                .maxConcurrentMonitors(config.getMaxConcurrentMonitors())
                .retryFailedConnections(config.isRetryFailedConnections())
                .build();
    }

    public Duration getInterval() {
        return interval;
    }

    public Duration getTaskTimeout() {
        return taskTimeout;
    }

    public int getMaxConcurrentMonitors() {
        return maxConcurrentMonitors;
    }

    public boolean isRetryFailedConnections() {
        return retryFailedConnections;
    }

    @Override
    public String toString() {
        return "SchedulerSettings{interval=" + interval
                + ", taskTimeout=" + taskTimeout
                + ", maxConcurrentMonitors=" + maxConcurrentMonitors
                + ", retryFailedConnections=" + retryFailedConnections + '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private Duration interval = Duration.ofSeconds(5);
        private Duration taskTimeout = Duration.ofSeconds(30);
        private int maxConcurrentMonitors = 10;
        private boolean retryFailedConnections = true;

        public Builder interval(Duration v) {
            this.interval = v;
            return this;
        }

        public Builder taskTimeout(Duration v) {
            this.taskTimeout = v;
            return this;
        }

        public Builder maxConcurrentMonitors(int v) {
            this.maxConcurrentMonitors = v;
            return this;
        }

        public Builder retryFailedConnections(boolean v) {
            this.retryFailedConnections = v;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a duration is not positive or
         *                                  the concurrency limit is below 1
         */
        public SchedulerSettings build() {
            Objects.requireNonNull(interval, "interval required");
            Objects.requireNonNull(taskTimeout, "taskTimeout required");
            if (interval.isNegative() || interval.isZero()) {
                throw new IllegalArgumentException("interval must be positive, got: " + interval);
            }
            if (taskTimeout.isNegative() || taskTimeout.isZero()) {
                throw new IllegalArgumentException("taskTimeout must be positive, got: " + taskTimeout);
            }
            if (maxConcurrentMonitors < 1) {
                throw new IllegalArgumentException(
                        "maxConcurrentMonitors must be >= 1, got: " + maxConcurrentMonitors);
            }
            return new SchedulerSettings(this);
        }
    }
}
