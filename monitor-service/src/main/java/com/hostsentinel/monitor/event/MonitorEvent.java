package com.hostsentinel.monitor.event;

import com.hostsentinel.core.alert.AlertEvent;
import com.hostsentinel.core.model.Device;
import com.hostsentinel.core.model.DeviceStatus;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable notification published on the {@link MonitorEventBus}.
 *
 * <p>
 * Carries only values copied at publication time, never a live
 * {@link Device}, so subscribers can keep events around safely.
 * </p>
 *
 * @since 1.0.0
 */
public final class MonitorEvent {

    /** Severity for {@link MonitorEventType#LOG} events. */
    public enum Severity {
        INFO, WARN, ERROR
    }

    private final MonitorEventType type;
    private final Instant timestamp;
    private final String deviceId;
    private final DeviceStatus deviceStatus;
    private final AlertEvent alertEvent;
    private final Severity severity;
    private final String message;

    private MonitorEvent(MonitorEventType type, Instant timestamp, String deviceId, DeviceStatus deviceStatus,
            AlertEvent alertEvent, Severity severity, String message) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.deviceId = deviceId;
        this.deviceStatus = deviceStatus;
        this.alertEvent = alertEvent;
        this.severity = severity;
        this.message = message;
    }

    // ---------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------

    public static MonitorEvent deviceUpdated(Device device, Instant timestamp) {
        return new MonitorEvent(MonitorEventType.DEVICE_UPDATED, timestamp, device.getId(), device.getStatus(),
                null, Severity.INFO,
                "Device " + device.getId() + " is " + device.getStatus()
                        + " (connection errors: " + device.getConnectionErrors() + ")");
    }

    public static MonitorEvent alert(AlertEvent event, Instant timestamp) {
        Severity severity = switch (event.getType()) {
            case CREATED, REOPENED, UPDATED -> Severity.WARN;
            case RESOLVED, ACKNOWLEDGED -> Severity.INFO;
        };
        return new MonitorEvent(MonitorEventType.ALERT, timestamp, event.getAlert().getDeviceId(), null,
                event, severity, event.getAlert().getMessage());
    }

    public static MonitorEvent cycleCompleted(int devicesPolled, long elapsedMillis, Instant timestamp) {
        return new MonitorEvent(MonitorEventType.CYCLE_COMPLETED, timestamp, null, null, null, Severity.INFO,
                "Polled " + devicesPolled + " device(s) in " + elapsedMillis + " ms");
    }

    public static MonitorEvent log(Severity severity, String message, Instant timestamp) {
        return new MonitorEvent(MonitorEventType.LOG, timestamp, null, null, null,
                Objects.requireNonNull(severity, "severity must not be null"), message);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public MonitorEventType getType() {
        return type;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Optional<String> getDeviceId() {
        return Optional.ofNullable(deviceId);
    }

    public Optional<DeviceStatus> getDeviceStatus() {
        return Optional.ofNullable(deviceStatus);
    }

    public Optional<AlertEvent> getAlertEvent() {
        return Optional.ofNullable(alertEvent);
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "MonitorEvent{type=" + type
                + ", timestamp=" + timestamp
                + ", deviceId='" + deviceId + '\''
                + ", severity=" + severity
                + ", message='" + message + "'}";
    }
}
