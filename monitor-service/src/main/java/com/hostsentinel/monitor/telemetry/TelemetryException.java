package com.hostsentinel.monitor.telemetry;

/**
 * Failure reported by a {@link TelemetryProvider}.
 *
 * @since 1.0.0
 */
public class TelemetryException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String deviceId;

    public TelemetryException(String deviceId, String message) {
        super(message);
        this.deviceId = deviceId;
    }

    public TelemetryException(String deviceId, String message, Throwable cause) {
        super(message, cause);
        this.deviceId = deviceId;
    }

    /**
     * @return identity of the device the failure relates to, may be {@code null}
     */
    public String getDeviceId() {
        return deviceId;
    }
}
