/**
 * Domain model classes for Host Sentinel.
 *
 * <ul>
 * <li>{@link com.hostsentinel.core.model.Device}: a monitored host and its
 * per-metric {@link com.hostsentinel.core.model.MetricHistory}</li>
 * <li>{@link com.hostsentinel.core.model.Alert}: one alert per device/metric
 * pair</li>
 * <li>{@link com.hostsentinel.core.model.AlertThreshold}: warning/critical
 * levels loaded from configuration</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.hostsentinel.core.model;
