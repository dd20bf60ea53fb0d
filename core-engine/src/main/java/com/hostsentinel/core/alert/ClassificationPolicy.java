package com.hostsentinel.core.alert;

import com.hostsentinel.core.config.MonitorConfig;
import com.hostsentinel.core.detection.AnomalyResult;
import com.hostsentinel.core.model.AlertLevel;
import com.hostsentinel.core.model.AlertThreshold;

import java.util.Locale;
import java.util.Optional;

/**
 * Decides which level, if any, a reading deserves.
 *
 * <p>
 * {@link #ANOMALY_FIRST} ranks a statistical anomaly above both thresholds, so
 * an unusual reading far below the warning level still raises an
 * {@code ANOMALY} alert while a reading above the critical level that is normal
 * for a volatile baseline is reported as {@code CRITICAL}.
 * {@link #THRESHOLD_FIRST} lets the static thresholds win and only falls back
 * to the anomaly flag for readings below the warning level.
 * </p>
 *
 * @since 1.0.0
 */
public enum ClassificationPolicy {

    ANOMALY_FIRST {
        @Override
        public Optional<Classification> classify(String metric, double value,
                AnomalyResult anomaly, AlertThreshold threshold) {
            if (anomaly.isAnomalous()) {
                return Optional.of(anomalyOf(metric, anomaly));
            }
            return thresholdOf(metric, value, threshold);
        }
    },

    THRESHOLD_FIRST {
        @Override
        public Optional<Classification> classify(String metric, double value,
                AnomalyResult anomaly, AlertThreshold threshold) {
            Optional<Classification> byThreshold = thresholdOf(metric, value, threshold);
            if (byThreshold.isPresent()) {
                return byThreshold;
            }
            return anomaly.isAnomalous() ? Optional.of(anomalyOf(metric, anomaly)) : Optional.empty();
        }
    };

    /**
     * @param metric    metric name
     * @param value     observed value
     * @param anomaly   detector verdict for the value
     * @param threshold configured levels for the metric
     * @return the classification, or empty when the reading is normal
     */
    public abstract Optional<Classification> classify(String metric, double value,
            AnomalyResult anomaly, AlertThreshold threshold);

    /**
     * Resolve a policy from its configuration name.
     *
     * @param name {@code anomaly-first} or {@code threshold-first}
     *             (case-insensitive)
     * @return the policy
     * @throws IllegalArgumentException if the name is unknown
     */
    public static ClassificationPolicy fromConfigName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Classification policy must not be null");
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case MonitorConfig.POLICY_ANOMALY_FIRST -> ANOMALY_FIRST;
            case MonitorConfig.POLICY_THRESHOLD_FIRST -> THRESHOLD_FIRST;
            default -> throw new IllegalArgumentException("Unknown classification policy: '" + name
                    + "'. Supported: " + MonitorConfig.POLICY_ANOMALY_FIRST
                    + ", " + MonitorConfig.POLICY_THRESHOLD_FIRST);
        };
    }

    private static Classification anomalyOf(String metric, AnomalyResult anomaly) {
        return new Classification(AlertLevel.ANOMALY, 0.0, String.format(Locale.ROOT,
                "Anomalous %s value detected (z-score: %.2f)", metric, anomaly.getZScore()));
    }

    private static Optional<Classification> thresholdOf(String metric, double value, AlertThreshold threshold) {
        if (value >= threshold.getCriticalLevel()) {
            return Optional.of(new Classification(AlertLevel.CRITICAL, threshold.getCriticalLevel(),
                    String.format(Locale.ROOT, "%s usage critically high: %.1f%%", metric, value)));
        }
        if (value >= threshold.getWarningLevel()) {
            return Optional.of(new Classification(AlertLevel.WARNING, threshold.getWarningLevel(),
                    String.format(Locale.ROOT, "%s usage high: %.1f%%", metric, value)));
        }
        return Optional.empty();
    }
}
