package com.hostsentinel.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A monitored host.
 *
 * <p>
 * The identity is the stable hardware id (typically the MAC address) and never
 * changes. Everything else is mutable state owned by the monitoring engine.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Writers must hold {@link #getLock()} while mutating the device. Scalar fields
 * are {@code volatile} and the service and history maps are concurrent, so
 * readers (presentation code, persistence) may observe the device without the
 * lock and see a consistent value per field, though not necessarily across
 * fields.
 * </p>
 *
 * @since 1.0.0
 */
public class Device {

    private final String id;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile String ip;
    private volatile String hostname;
    private volatile String osType;
    private volatile DeviceStatus status = DeviceStatus.UNKNOWN;
    private volatile boolean monitoringEnabled;
    private volatile int connectionErrors;
    private volatile Instant lastUpdate;
    private volatile int historyCapacity = MetricHistory.DEFAULT_CAPACITY;
    private volatile Map<String, Object> hardwareInfo = Collections.emptyMap();

    /** Per-service CPU share reported by the last successful poll. */
    private final Map<String, Double> services = new ConcurrentHashMap<>();

    /** Lazily created per-metric sample histories. */
    private final Map<String, MetricHistory> histories = new ConcurrentHashMap<>();

    /**
     * @param id stable hardware identity; must not be {@code null} or blank
     * @throws IllegalArgumentException if {@code id} is blank
     */
    public Device(String id) {
        Objects.requireNonNull(id, "Device id must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Device id must not be blank");
        }
        this.id = id;
    }

    // ---------------------------------------------------------------
    // Locking
    // ---------------------------------------------------------------

    /**
     * @return the lock guarding this device's mutable fields
     */
    public ReentrantLock getLock() {
        return lock;
    }

    // ---------------------------------------------------------------
    // Metric history
    // ---------------------------------------------------------------

    /**
     * Append a sample to the history of {@code metric}, creating it on first use.
     *
     * @param metric metric name, e.g. {@code cpu}
     * @param sample the observation
     */
    public void recordSample(String metric, MetricSample sample) {
        Objects.requireNonNull(metric, "metric must not be null");
        Objects.requireNonNull(sample, "sample must not be null");
        histories.computeIfAbsent(metric, m -> new MetricHistory(historyCapacity)).add(sample);
    }

    public Optional<MetricHistory> getHistory(String metric) {
        return Optional.ofNullable(histories.get(metric));
    }

    public Set<String> getTrackedMetrics() {
        return Collections.unmodifiableSet(histories.keySet());
    }

    // ---------------------------------------------------------------
    // Services / hardware info
    // ---------------------------------------------------------------

    /**
     * @return unmodifiable view of the per-service CPU map
     */
    public Map<String, Double> getServices() {
        return Collections.unmodifiableMap(services);
    }

    /**
     * Merge reported service usage into the service map.
     *
     * @param update service name to CPU share; {@code null} values are skipped
     */
    public void updateServices(Map<String, Double> update) {
        if (update == null) {
            return;
        }
        update.forEach((name, usage) -> {
            if (name != null && usage != null) {
                services.put(name, usage);
            }
        });
    }

    /**
     * Replace the service map entirely (used when restoring from storage).
     *
     * @param replacement new service map, may be {@code null}
     */
    public void setServices(Map<String, Double> replacement) {
        services.clear();
        updateServices(replacement);
    }

    public Map<String, Object> getHardwareInfo() {
        return hardwareInfo;
    }

    /**
     * @param hardwareInfo free-form hardware description (copied)
     */
    public void setHardwareInfo(Map<String, Object> hardwareInfo) {
        this.hardwareInfo = hardwareInfo == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(hardwareInfo));
    }

    // ---------------------------------------------------------------
    // Connection bookkeeping
    // ---------------------------------------------------------------

    /**
     * Record a successful connection: resets the error counter and marks the
     * device {@link DeviceStatus#ONLINE}.
     */
    public void markConnected() {
        this.connectionErrors = 0;
        this.status = DeviceStatus.ONLINE;
    }

    /**
     * Record a failed connection attempt.
     *
     * @return the updated error count
     */
    public int markConnectionFailed() {
        this.status = DeviceStatus.CONNECTION_FAILED;
        return ++connectionErrors;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public String getIp() {
        return ip;
    }

    public void setIp(String ip) {
        this.ip = ip;
    }

    public String getHostname() {
        return hostname;
    }

    public void setHostname(String hostname) {
        this.hostname = hostname;
    }

    public String getOsType() {
        return osType;
    }

    public void setOsType(String osType) {
        this.osType = osType;
    }

    public DeviceStatus getStatus() {
        return status;
    }

    public void setStatus(DeviceStatus status) {
        this.status = status != null ? status : DeviceStatus.UNKNOWN;
    }

    public boolean isMonitoringEnabled() {
        return monitoringEnabled;
    }

    public void setMonitoringEnabled(boolean monitoringEnabled) {
        this.monitoringEnabled = monitoringEnabled;
    }

    public int getConnectionErrors() {
        return connectionErrors;
    }

    public void setConnectionErrors(int connectionErrors) {
        this.connectionErrors = Math.max(0, connectionErrors);
    }

    public Instant getLastUpdate() {
        return lastUpdate;
    }

    public void setLastUpdate(Instant lastUpdate) {
        this.lastUpdate = lastUpdate;
    }

    public int getHistoryCapacity() {
        return historyCapacity;
    }

    /**
     * Capacity applied to histories created after this call.
     *
     * @param historyCapacity samples per metric; must be &gt; 0
     */
    public void setHistoryCapacity(int historyCapacity) {
        if (historyCapacity <= 0) {
            throw new IllegalArgumentException("historyCapacity must be > 0, got: " + historyCapacity);
        }
        this.historyCapacity = historyCapacity;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Device that))
            return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Device{" +
                "id='" + id + '\'' +
                ", ip='" + ip + '\'' +
                ", hostname='" + hostname + '\'' +
                ", status=" + status +
                ", monitoringEnabled=" + monitoringEnabled +
                ", connectionErrors=" + connectionErrors +
                ", lastUpdate=" + lastUpdate +
                '}';
    }
}
