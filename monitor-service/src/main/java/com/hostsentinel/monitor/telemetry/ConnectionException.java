package com.hostsentinel.monitor.telemetry;

/**
 * The device could not be reached. Counted against the device and retried on
 * a later cycle.
 *
 * @since 1.0.0
 */
public class ConnectionException extends TelemetryException {

    private static final long serialVersionUID = 1L;

    public ConnectionException(String deviceId, String message) {
        super(deviceId, message);
    }

    public ConnectionException(String deviceId, String message, Throwable cause) {
        super(deviceId, message, cause);
    }
}
