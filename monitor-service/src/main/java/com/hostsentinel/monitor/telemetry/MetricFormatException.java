package com.hostsentinel.monitor.telemetry;

/**
 * The provider returned a snapshot with a missing or malformed metric.
 *
 * @since 1.0.0
 */
public class MetricFormatException extends TelemetryException {

    private static final long serialVersionUID = 1L;

    private final String metric;

    public MetricFormatException(String deviceId, String metric, String message) {
        super(deviceId, message);
        this.metric = metric;
    }

    public String getMetric() {
        return metric;
    }
}
