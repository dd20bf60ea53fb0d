/**
 * Boundary to the transport that reaches monitored devices: the
 * {@link com.hostsentinel.monitor.telemetry.TelemetryProvider} contract, the
 * snapshot it returns, its checked failures, and a caching decorator.
 *
 * @since 1.0.0
 */
package com.hostsentinel.monitor.telemetry;
