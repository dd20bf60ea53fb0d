package com.hostsentinel.monitor.telemetry;

import com.hostsentinel.core.model.Device;

/**
 * Source of raw metric samples for monitored devices.
 *
 * <p>
 * The engine makes no assumption about the transport (SSH, agent, SNMP). Both
 * calls may be slow and may fail; they run on poller threads, are bounded by
 * the per-device task timeout, and may be interrupted when that timeout fires.
 * </p>
 *
 * <p>
 * Implementations must be safe for concurrent calls on different devices.
 * Calls for the same device are never concurrent.
 * </p>
 *
 * @since 1.0.0
 */
public interface TelemetryProvider {

    /**
     * Open or verify a session with the device.
     *
     * @param device the device to reach
     * @return {@code true} if the device is reachable
     * @throws TelemetryException if the attempt failed
     */
    boolean connect(Device device) throws TelemetryException;

    /**
     * Collect one set of readings from the device.
     *
     * @param device a device that {@link #connect} accepted
     * @return the readings
     * @throws TelemetryException if collection failed
     */
    TelemetrySnapshot fetchMetrics(Device device) throws TelemetryException;
}
