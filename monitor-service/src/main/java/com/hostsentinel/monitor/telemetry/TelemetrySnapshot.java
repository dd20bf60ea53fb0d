package com.hostsentinel.monitor.telemetry;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One set of readings returned by {@link TelemetryProvider#fetchMetrics}.
 *
 * <p>
 * Percent metrics are kept in insertion order with {@code cpu}, {@code memory}
 * and {@code disk} required. Any further numeric metric the provider reports
 * (for example {@code swap}) is carried alongside and evaluated the same way.
 * Network counters, load average, process count and the per-service CPU
 * share are optional.
 * </p>
 *
 * <p>
 * Instances are immutable. Presence and finiteness of the required metrics is
 * checked by {@link #validatedMetrics(String)}, not at construction, so that a
 * provider can hand over whatever it received and the poller decides.
 * </p>
 *
 * @since 1.0.0
 */
public final class TelemetrySnapshot {

    public static final String CPU = "cpu";
    public static final String MEMORY = "memory";
    public static final String DISK = "disk";

    public static final List<String> REQUIRED_METRICS = List.of(CPU, MEMORY, DISK);

    private final Map<String, Double> metrics;
    private final Long networkBytesSent;
    private final Long networkBytesReceived;
    private final double[] loadAverage;
    private final Integer processes;
    private final Map<String, Double> services;
    private final Instant timestamp;

    private TelemetrySnapshot(Builder b) {
        this.metrics = Collections.unmodifiableMap(new LinkedHashMap<>(b.metrics));
        this.networkBytesSent = b.networkBytesSent;
        this.networkBytesReceived = b.networkBytesReceived;
        this.loadAverage = b.loadAverage == null ? null : b.loadAverage.clone();
        this.processes = b.processes;
        this.services = Collections.unmodifiableMap(new LinkedHashMap<>(b.services));
        this.timestamp = b.timestamp;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Return the metric values after checking that every required metric is
     * present and that no value is NaN or infinite.
     *
     * @param deviceId device the snapshot belongs to, used in the error
     * @return the metric values in reporting order
     * @throws MetricFormatException if a required metric is missing or any
     *                               value is not finite
     */
    public Map<String, Double> validatedMetrics(String deviceId) throws MetricFormatException {
        for (String required : REQUIRED_METRICS) {
            if (!metrics.containsKey(required)) {
                throw new MetricFormatException(deviceId, required,
                        "Missing required metric '" + required + "' for device " + deviceId);
            }
        }
        for (Map.Entry<String, Double> entry : metrics.entrySet()) {
            Double value = entry.getValue();
            if (value == null || value.isNaN() || value.isInfinite()) {
                throw new MetricFormatException(deviceId, entry.getKey(),
                        "Invalid " + entry.getKey() + " value for device " + deviceId + ": " + value);
            }
        }
        return metrics;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Map<String, Double> getMetrics() {
        return metrics;
    }

    public Optional<Double> getMetric(String name) {
        return Optional.ofNullable(metrics.get(name));
    }

    public Optional<Long> getNetworkBytesSent() {
        return Optional.ofNullable(networkBytesSent);
    }

    public Optional<Long> getNetworkBytesReceived() {
        return Optional.ofNullable(networkBytesReceived);
    }

    /**
     * @return 1, 5 and 15 minute load averages, or empty if not reported
     */
    public Optional<double[]> getLoadAverage() {
        return loadAverage == null ? Optional.empty() : Optional.of(loadAverage.clone());
    }

    public Optional<Integer> getProcesses() {
        return Optional.ofNullable(processes);
    }

    public Map<String, Double> getServices() {
        return services;
    }

    public Optional<Instant> getTimestamp() {
        return Optional.ofNullable(timestamp);
    }

    @Override
    public String toString() {
        return "TelemetrySnapshot{metrics=" + metrics
                + ", networkBytesSent=" + networkBytesSent
                + ", networkBytesReceived=" + networkBytesReceived
                + ", loadAverage=" + Arrays.toString(loadAverage)
                + ", processes=" + processes
                + ", services=" + services.size()
                + ", timestamp=" + timestamp + '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private final Map<String, Double> metrics = new LinkedHashMap<>();
        private final Map<String, Double> services = new LinkedHashMap<>();
        private Long networkBytesSent;
        private Long networkBytesReceived;
        private double[] loadAverage;
        private Integer processes;
        private Instant timestamp;

        public Builder cpu(double v) {
            return metric(CPU, v);
        }

        public Builder memory(double v) {
            return metric(MEMORY, v);
        }

        public Builder disk(double v) {
            return metric(DISK, v);
        }

        /**
         * Add a percent metric. Names are stored lower-case.
         */
        public Builder metric(String name, Double value) {
            Objects.requireNonNull(name, "metric name must not be null");
            metrics.put(name.trim().toLowerCase(Locale.ROOT), value);
            return this;
        }

        public Builder networkBytesSent(long v) {
            this.networkBytesSent = v;
            return this;
        }

        public Builder networkBytesReceived(long v) {
            this.networkBytesReceived = v;
            return this;
        }

        public Builder loadAverage(double oneMinute, double fiveMinutes, double fifteenMinutes) {
            this.loadAverage = new double[] { oneMinute, fiveMinutes, fifteenMinutes };
            return this;
        }

        public Builder processes(int v) {
            this.processes = v;
            return this;
        }

        public Builder service(String name, double cpuShare) {
            services.put(Objects.requireNonNull(name, "service name must not be null"), cpuShare);
            return this;
        }

        public Builder services(Map<String, Double> v) {
            if (v != null) {
                v.forEach((name, share) -> {
                    if (name != null && share != null) {
                        services.put(name, share);
                    }
                });
            }
            return this;
        }

        public Builder timestamp(Instant v) {
            this.timestamp = v;
            return this;
        }

        public TelemetrySnapshot build() {
            return new TelemetrySnapshot(this);
        }
    }
}
