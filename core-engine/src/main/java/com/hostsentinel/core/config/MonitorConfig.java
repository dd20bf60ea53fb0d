package com.hostsentinel.core.config;

import com.hostsentinel.core.model.AlertThreshold;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Top-level POJO for the engine's YAML configuration.
 *
 * <p>
 * Expected YAML structure (every key is optional; omitted keys keep their
 * defaults):
 * </p>
 *
 * <pre>
 * monitoringIntervalSeconds: 5
 * maxHistorySize: 100
 * cacheTtlSeconds: 300
 * maxConcurrentMonitors: 10
 * databaseConnections: 5
 * databasePath: network_monitor.db
 * alertThresholds:
 *   - metric: cpu
 *     warningLevel: 80
 *     criticalLevel: 95
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitorConfig {

    public static final String POLICY_ANOMALY_FIRST = "anomaly-first";
    public static final String POLICY_THRESHOLD_FIRST = "threshold-first";

    // --- Scheduling ---
    private long monitoringIntervalSeconds = 5;
    private int maxConcurrentMonitors = 10;
    private long taskTimeoutSeconds = 30;
    private boolean retryFailedConnections = true;

    // --- History / detection ---
    private int maxHistorySize = 100;
    private double anomalyZScoreThreshold = 2.5;
    private int alertHistoryCapacity = 1000;
    private String classificationPolicy = POLICY_ANOMALY_FIRST;

    // --- Cache ---
    private long cacheTtlSeconds = 300;
    private int cacheCapacity = 1000;

    // --- Persistence ---
    private int databaseConnections = 5;
    private String databasePath = "network_monitor.db";

    private List<AlertThreshold> alertThresholds = defaultThresholds();

    /**
     * @return the thresholds applied when the configuration does not define any
     */
    public static List<AlertThreshold> defaultThresholds() {
        List<AlertThreshold> defaults = new ArrayList<>();
        defaults.add(new AlertThreshold("cpu", 80.0, 95.0));
        defaults.add(new AlertThreshold("memory", 85.0, 95.0));
        defaults.add(new AlertThreshold("disk", 90.0, 98.0));
        return defaults;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every setting and threshold. Collects all errors and throws a
     * single exception.
     *
     * @throws IllegalStateException if the configuration is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (monitoringIntervalSeconds < 1) {
            errors.add("monitoringIntervalSeconds must be >= 1, got: " + monitoringIntervalSeconds);
        }
        if (maxConcurrentMonitors < 1) {
            errors.add("maxConcurrentMonitors must be >= 1, got: " + maxConcurrentMonitors);
        }
        if (taskTimeoutSeconds < 1) {
            errors.add("taskTimeoutSeconds must be >= 1, got: " + taskTimeoutSeconds);
        }
        if (maxHistorySize < 1) {
            errors.add("maxHistorySize must be >= 1, got: " + maxHistorySize);
        }
        if (!(anomalyZScoreThreshold > 0)) {
            errors.add("anomalyZScoreThreshold must be > 0, got: " + anomalyZScoreThreshold);
        }
        if (alertHistoryCapacity < 1) {
            errors.add("alertHistoryCapacity must be >= 1, got: " + alertHistoryCapacity);
        }
        if (!POLICY_ANOMALY_FIRST.equals(classificationPolicy)
                && !POLICY_THRESHOLD_FIRST.equals(classificationPolicy)) {
            errors.add("Unknown classificationPolicy: '" + classificationPolicy
                    + "'. Supported: " + POLICY_ANOMALY_FIRST + ", " + POLICY_THRESHOLD_FIRST);
        }
        if (cacheTtlSeconds < 0) {
            errors.add("cacheTtlSeconds must be >= 0, got: " + cacheTtlSeconds);
        }
        if (cacheCapacity < 1) {
            errors.add("cacheCapacity must be >= 1, got: " + cacheCapacity);
        }
        if (databaseConnections < 1) {
            errors.add("databaseConnections must be >= 1, got: " + databaseConnections);
        }
        if (databasePath == null || databasePath.isBlank()) {
            errors.add("databasePath must not be blank");
        }

        List<String> seen = new ArrayList<>();
        for (int i = 0; i < alertThresholds.size(); i++) {
            AlertThreshold threshold = Objects.requireNonNull(alertThresholds.get(i),
                    "Threshold at index " + i + " is null");
            try {
                threshold.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
            if (threshold.getMetric() != null) {
                if (seen.contains(threshold.getMetric())) {
                    errors.add("Duplicate threshold for metric '" + threshold.getMetric() + "'");
                }
                seen.add(threshold.getMetric());
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Monitor configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    /**
     * @return thresholds keyed by metric name, in declaration order
     */
    public Map<String, AlertThreshold> thresholdsByMetric() {
        Map<String, AlertThreshold> byMetric = new LinkedHashMap<>();
        for (AlertThreshold threshold : alertThresholds) {
            byMetric.put(threshold.getMetric(), threshold);
        }
        return byMetric;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public long getMonitoringIntervalSeconds() {
        return monitoringIntervalSeconds;
    }

    public void setMonitoringIntervalSeconds(long monitoringIntervalSeconds) {
        this.monitoringIntervalSeconds = monitoringIntervalSeconds;
    }

    public int getMaxConcurrentMonitors() {
        return maxConcurrentMonitors;
    }

    public void setMaxConcurrentMonitors(int maxConcurrentMonitors) {
        this.maxConcurrentMonitors = maxConcurrentMonitors;
    }

    public long getTaskTimeoutSeconds() {
        return taskTimeoutSeconds;
    }

    public void setTaskTimeoutSeconds(long taskTimeoutSeconds) {
        this.taskTimeoutSeconds = taskTimeoutSeconds;
    }

    public boolean isRetryFailedConnections() {
        return retryFailedConnections;
    }

    public void setRetryFailedConnections(boolean retryFailedConnections) {
        this.retryFailedConnections = retryFailedConnections;
    }

    public int getMaxHistorySize() {
        return maxHistorySize;
    }

    public void setMaxHistorySize(int maxHistorySize) {
        this.maxHistorySize = maxHistorySize;
    }

    public double getAnomalyZScoreThreshold() {
        return anomalyZScoreThreshold;
    }

    public void setAnomalyZScoreThreshold(double anomalyZScoreThreshold) {
        this.anomalyZScoreThreshold = anomalyZScoreThreshold;
    }

    public int getAlertHistoryCapacity() {
        return alertHistoryCapacity;
    }

    public void setAlertHistoryCapacity(int alertHistoryCapacity) {
        this.alertHistoryCapacity = alertHistoryCapacity;
    }

    public String getClassificationPolicy() {
        return classificationPolicy;
    }

    /**
     * @param classificationPolicy {@value #POLICY_ANOMALY_FIRST} or
     *                             {@value #POLICY_THRESHOLD_FIRST}; normalised
     *                             to lowercase
     */
    public void setClassificationPolicy(String classificationPolicy) {
        this.classificationPolicy = classificationPolicy != null
                ? classificationPolicy.trim().toLowerCase(Locale.ROOT)
                : null;
    }

    public long getCacheTtlSeconds() {
        return cacheTtlSeconds;
    }

    public void setCacheTtlSeconds(long cacheTtlSeconds) {
        this.cacheTtlSeconds = cacheTtlSeconds;
    }

    public int getCacheCapacity() {
        return cacheCapacity;
    }

    public void setCacheCapacity(int cacheCapacity) {
        this.cacheCapacity = cacheCapacity;
    }

    public int getDatabaseConnections() {
        return databaseConnections;
    }

    public void setDatabaseConnections(int databaseConnections) {
        this.databaseConnections = databaseConnections;
    }

    public String getDatabasePath() {
        return databasePath;
    }

    public void setDatabasePath(String databasePath) {
        this.databasePath = databasePath;
    }

    /**
     * @return unmodifiable list of configured thresholds
     */
    public List<AlertThreshold> getAlertThresholds() {
        return Collections.unmodifiableList(alertThresholds);
    }

    /**
     * Replace the threshold list (used by SnakeYAML during deserialization).
     *
     * @param alertThresholds thresholds; {@code null} clears the list
     */
    public void setAlertThresholds(List<AlertThreshold> alertThresholds) {
        this.alertThresholds = alertThresholds != null ? new ArrayList<>(alertThresholds) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "MonitorConfig{" +
                "monitoringIntervalSeconds=" + monitoringIntervalSeconds +
                ", maxConcurrentMonitors=" + maxConcurrentMonitors +
                ", taskTimeoutSeconds=" + taskTimeoutSeconds +
                ", retryFailedConnections=" + retryFailedConnections +
                ", maxHistorySize=" + maxHistorySize +
                ", anomalyZScoreThreshold=" + anomalyZScoreThreshold +
                ", alertHistoryCapacity=" + alertHistoryCapacity +
                ", classificationPolicy='" + classificationPolicy + '\'' +
                ", cacheTtlSeconds=" + cacheTtlSeconds +
                ", cacheCapacity=" + cacheCapacity +
                ", databaseConnections=" + databaseConnections +
                ", databasePath='" + databasePath + '\'' +
                ", alertThresholds=" + alertThresholds +
                '}';
    }
}
