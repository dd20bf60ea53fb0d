package com.hostsentinel.core.alert;

import com.hostsentinel.core.config.MonitorConfig;
import com.hostsentinel.core.detection.AnomalyDetector;
import com.hostsentinel.core.detection.AnomalyResult;
import com.hostsentinel.core.model.Alert;
import com.hostsentinel.core.model.AlertThreshold;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Alert lifecycle state machine.
 *
 * <p>
 * Every reading passed to {@link #evaluate} is fed into the
 * {@link AnomalyDetector} (baseline first, then detection), classified by the
 * configured {@link ClassificationPolicy}, and applied to the alert keyed by
 * {@code deviceId + "_" + metric}:
 * </p>
 *
 * <table>
 * <caption>Transitions</caption>
 * <tr><th>stored</th><th>classification</th><th>result</th></tr>
 * <tr><td>none</td><td>none</td><td>no-op</td></tr>
 * <tr><td>none</td><td>level</td><td>{@code CREATED}</td></tr>
 * <tr><td>unresolved, same level</td><td>level</td><td>no-op</td></tr>
 * <tr><td>unresolved, other level</td><td>level</td><td>{@code UPDATED}</td></tr>
 * <tr><td>resolved</td><td>level</td><td>{@code REOPENED}</td></tr>
 * <tr><td>unresolved</td><td>none</td><td>{@code RESOLVED}, archived</td></tr>
 * <tr><td>resolved</td><td>none</td><td>no-op</td></tr>
 * </table>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Each transition runs inside {@link ConcurrentHashMap#compute} for its own
 * key, so different device/metric pairs never block each other. Stored alerts
 * are never mutated after publication; a transition stores a modified copy.
 * Listeners are notified after the map update, outside the per-key section.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertManager {

    private static final Logger LOG = LoggerFactory.getLogger(AlertManager.class);

    private static final Comparator<Alert> BY_TIMESTAMP_THEN_ID = Comparator
            .comparing(Alert::getTimestamp)
            .thenComparing(Alert::getId);

    private final Map<String, AlertThreshold> thresholds = new ConcurrentHashMap<>();
    private final Map<String, Alert> alerts = new ConcurrentHashMap<>();
    private final List<AlertListener> listeners = new CopyOnWriteArrayList<>();

    private final AnomalyDetector detector;
    private final AlertHistory history;
    private final ClassificationPolicy policy;
    private final Clock clock;

    /**
     * @param detector       baseline detector fed by every evaluation
     * @param thresholds     initial thresholds (validated and copied)
     * @param policy         classification priority
     * @param history        archive for resolved alerts
     * @param clock          time source for alert timestamps
     */
    public AlertManager(AnomalyDetector detector,
            Collection<AlertThreshold> thresholds,
            ClassificationPolicy policy,
            AlertHistory history,
            Clock clock) {
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.history = Objects.requireNonNull(history, "history must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        Objects.requireNonNull(thresholds, "thresholds must not be null").forEach(this::setThreshold);
    }

    /**
     * Build a manager, its detector and its history from configuration.
     *
     * @param config validated configuration
     * @param clock  time source
     * @return a new manager
     */
    public static AlertManager fromConfig(MonitorConfig config, Clock clock) {
        Objects.requireNonNull(config, "config must not be null");
        return new AlertManager(
                new AnomalyDetector(config.getMaxHistorySize(), config.getAnomalyZScoreThreshold()),
                config.getAlertThresholds(),
                ClassificationPolicy.fromConfigName(config.getClassificationPolicy()),
                new AlertHistory(config.getAlertHistoryCapacity()),
                clock);
    }

    // ---------------------------------------------------------------
    // Thresholds
    // ---------------------------------------------------------------

    /**
     * Install or replace the threshold of one metric.
     *
     * @param threshold threshold to install (validated and copied)
     * @throws IllegalStateException if the threshold is invalid
     */
    public void setThreshold(AlertThreshold threshold) {
        Objects.requireNonNull(threshold, "threshold must not be null");
        threshold.validate();
        AlertThreshold copy = threshold.copy();
        AlertThreshold previous = thresholds.put(copy.getMetric(), copy);
        if (previous != null && !previous.equals(copy)) {
            LOG.info("Threshold for '{}' changed: {} -> {}", copy.getMetric(), previous, copy);
        }
    }

    public Optional<AlertThreshold> getThreshold(String metric) {
        AlertThreshold threshold = thresholds.get(metric);
        return threshold == null ? Optional.empty() : Optional.of(threshold.copy());
    }

    // ---------------------------------------------------------------
    // Evaluation
    // ---------------------------------------------------------------

    /**
     * Evaluate one reading and apply the resulting transition.
     *
     * <p>
     * Metrics without an enabled threshold are ignored entirely; their
     * readings do not enter the baseline either.
     * </p>
     *
     * @param deviceId device identity
     * @param metric   metric name
     * @param value    observed value
     * @return the transition, or empty when nothing changed
     */
    public Optional<AlertEvent> evaluate(String deviceId, String metric, double value) {
        Objects.requireNonNull(deviceId, "deviceId must not be null");
        Objects.requireNonNull(metric, "metric must not be null");

        AlertThreshold threshold = thresholds.get(metric);
        if (threshold == null || !threshold.isEnabled()) {
            LOG.trace("No enabled threshold for '{}' - skipping", metric);
            return Optional.empty();
        }

        detector.updateBaseline(deviceId, metric, value);
        AnomalyResult anomaly = detector.detect(deviceId, metric, value);
        Optional<Classification> classification = policy.classify(metric, value, anomaly, threshold);

        String key = Alert.keyOf(deviceId, metric);
        Instant now = clock.instant();
        AlertEvent[] transition = new AlertEvent[1];

        alerts.compute(key, (k, existing) -> {
            if (existing == null) {
                if (classification.isEmpty()) {
                    return null;
                }
                Alert created = newAlert(deviceId, metric, value, classification.get(), now);
                transition[0] = new AlertEvent(AlertEventType.CREATED, created, null);
                return created;
            }

            if (classification.isPresent()) {
                Classification c = classification.get();
                if (existing.getLevel() == c.getLevel() && !existing.isResolved()) {
                    return existing;
                }
                Alert updated = existing.copy();
                updated.setLevel(c.getLevel());
                updated.setValue(value);
                updated.setThreshold(c.getThreshold());
                updated.setTimestamp(now);
                updated.setMessage(c.getMessage());
                updated.setResolved(false);
                AlertEventType type = existing.isResolved() ? AlertEventType.REOPENED : AlertEventType.UPDATED;
                transition[0] = new AlertEvent(type, updated, existing.getLevel());
                return updated;
            }

            if (existing.isResolved()) {
                return existing;
            }
            Alert resolved = existing.copy();
            resolved.setResolved(true);
            resolved.setTimestamp(now);
            resolved.setMessage(metric + " returned to normal levels");
            transition[0] = new AlertEvent(AlertEventType.RESOLVED, resolved, existing.getLevel());
            return resolved;
        });

        AlertEvent event = transition[0];
        if (event == null) {
            return Optional.empty();
        }
        if (event.getType() == AlertEventType.RESOLVED) {
            history.archive(event.getAlert());
        }
        LOG.info("{} {} alert {}: {}", event.getType(), event.getAlert().getLevel(), key,
                event.getAlert().getMessage());
        publish(event);
        return Optional.of(event);
    }

    // ---------------------------------------------------------------
    // Queries / operator actions
    // ---------------------------------------------------------------

    /**
     * @return copies of every unresolved alert, ordered by timestamp then id
     */
    public List<Alert> getActiveAlerts() {
        return alerts.values().stream()
                .filter(a -> !a.isResolved())
                .map(Alert::copy)
                .sorted(BY_TIMESTAMP_THEN_ID)
                .toList();
    }

    /**
     * @return copies of every alert record, resolved ones included
     */
    public List<Alert> getAlerts() {
        return alerts.values().stream()
                .map(Alert::copy)
                .sorted(BY_TIMESTAMP_THEN_ID)
                .toList();
    }

    public Optional<Alert> getAlert(String alertId) {
        Alert alert = alerts.get(alertId);
        return alert == null ? Optional.empty() : Optional.of(alert.copy());
    }

    public AlertHistory getAlertHistory() {
        return history;
    }

    /**
     * Mark an alert as acknowledged.
     *
     * @param alertId alert key
     * @return the acknowledged alert
     * @throws AlertNotFoundException if no record exists for {@code alertId}
     */
    public Alert acknowledgeAlert(String alertId) {
        Objects.requireNonNull(alertId, "alertId must not be null");
        Alert acknowledged = alerts.computeIfPresent(alertId, (k, existing) -> {
            if (existing.isAcknowledged()) {
                return existing;
            }
            Alert copy = existing.copy();
            copy.setAcknowledged(true);
            return copy;
        });
        if (acknowledged == null) {
            throw new AlertNotFoundException(alertId);
        }
        LOG.info("Acknowledged alert: {}", alertId);
        AlertEvent event = new AlertEvent(AlertEventType.ACKNOWLEDGED, acknowledged, acknowledged.getLevel());
        publish(event);
        return acknowledged.copy();
    }

    /**
     * Drop the anomaly baselines of a device that is no longer monitored.
     * Its alert records are kept.
     *
     * @return number of metric baselines dropped
     */
    public int resetBaselines(String deviceId) {
        return detector.reset(deviceId);
    }

    /**
     * Re-insert alerts loaded from storage. Existing records win; no events are
     * published.
     *
     * @param restored alerts to restore
     * @return number of records inserted
     */
    public int restore(Collection<Alert> restored) {
        int inserted = 0;
        for (Alert alert : restored) {
            if (alerts.putIfAbsent(alert.getId(), alert.copy()) == null) {
                inserted++;
            }
        }
        LOG.info("Restored {} alert(s)", inserted);
        return inserted;
    }

    /**
     * Remove resolved alert records and archive entries stamped before
     * {@code olderThan}.
     *
     * @param olderThan cutoff
     * @return number of alert records removed from the active map
     */
    public int pruneHistory(Instant olderThan) {
        Objects.requireNonNull(olderThan, "olderThan must not be null");
        int[] removed = new int[1];
        for (String key : alerts.keySet()) {
            alerts.computeIfPresent(key, (k, a) -> {
                if (a.isResolved() && a.getTimestamp().isBefore(olderThan)) {
                    removed[0]++;
                    return null;
                }
                return a;
            });
        }
        int archived = history.prune(olderThan);
        LOG.info("Pruned {} resolved alert(s) and {} archive entr{} older than {}",
                removed[0], archived, archived == 1 ? "y" : "ies", olderThan);
        return removed[0];
    }

    // ---------------------------------------------------------------
    // Listeners
    // ---------------------------------------------------------------

    public void addListener(AlertListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void removeListener(AlertListener listener) {
        listeners.remove(listener);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static Alert newAlert(String deviceId, String metric, double value,
            Classification classification, Instant now) {
        return Alert.builder()
                .deviceId(deviceId)
                .metric(metric)
                .level(classification.getLevel())
                .value(value)
                .threshold(classification.getThreshold())
                .timestamp(now)
                .message(classification.getMessage())
                .build();
    }

    private void publish(AlertEvent event) {
        for (AlertListener listener : listeners) {
            try {
                listener.onAlertEvent(event);
            } catch (RuntimeException e) {
                LOG.error("Alert listener threw an exception - continuing with next listener", e);
            }
        }
    }
}
