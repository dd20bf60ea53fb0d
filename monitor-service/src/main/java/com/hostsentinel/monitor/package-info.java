/**
 * Monitoring service: the {@link com.hostsentinel.monitor.HostSentinelEngine}
 * facade that wires configuration, persistence, telemetry, alerting and the
 * scheduler together.
 *
 * @since 1.0.0
 */
package com.hostsentinel.monitor;
