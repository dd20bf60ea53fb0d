package com.hostsentinel.monitor.store;

import java.time.Instant;
import java.util.Optional;

/**
 * One persisted row of the {@code metrics} table.
 *
 * @since 1.0.0
 */
public final class MetricRecord {

    private final String deviceId;
    private final Instant timestamp;
    private final double cpuPercent;
    private final double memoryPercent;
    private final double diskPercent;
    private final Long networkBytesSent;
    private final Long networkBytesReceived;
    private final Double loadAverage1;

    public MetricRecord(String deviceId, Instant timestamp, double cpuPercent, double memoryPercent,
            double diskPercent, Long networkBytesSent, Long networkBytesReceived, Double loadAverage1) {
        this.deviceId = deviceId;
        this.timestamp = timestamp;
        this.cpuPercent = cpuPercent;
        this.memoryPercent = memoryPercent;
        this.diskPercent = diskPercent;
        this.networkBytesSent = networkBytesSent;
        this.networkBytesReceived = networkBytesReceived;
        this.loadAverage1 = loadAverage1;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getCpuPercent() {
        return cpuPercent;
    }

    public double getMemoryPercent() {
        return memoryPercent;
    }

    public double getDiskPercent() {
        return diskPercent;
    }

    public Optional<Long> getNetworkBytesSent() {
        return Optional.ofNullable(networkBytesSent);
    }

    public Optional<Long> getNetworkBytesReceived() {
        return Optional.ofNullable(networkBytesReceived);
    }

    public Optional<Double> getLoadAverage1() {
        return Optional.ofNullable(loadAverage1);
    }

    @Override
    public String toString() {
        return "MetricRecord{deviceId='" + deviceId + "', timestamp=" + timestamp
                + ", cpu=" + cpuPercent + ", memory=" + memoryPercent + ", disk=" + diskPercent + '}';
    }
}
