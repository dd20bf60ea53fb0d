/**
 * Statistical baseline tracking and z-score anomaly detection.
 *
 * <p>
 * {@link com.hostsentinel.core.detection.AnomalyDetector} keeps one rolling
 * window per device/metric pair and scores new observations against it.
 * </p>
 *
 * @since 1.0.0
 */
package com.hostsentinel.core.detection;
