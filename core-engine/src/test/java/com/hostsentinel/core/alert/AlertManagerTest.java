package com.hostsentinel.core.alert;

import com.hostsentinel.core.MutableClock;
import com.hostsentinel.core.config.MonitorConfig;
import com.hostsentinel.core.detection.AnomalyDetector;
import com.hostsentinel.core.model.Alert;
import com.hostsentinel.core.model.AlertLevel;
import com.hostsentinel.core.model.AlertThreshold;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertManager}.
 */
class AlertManagerTest {

    private static final String DEVICE = "aa:bb:cc:dd:ee:01";
    private static final String CPU_ALERT = DEVICE + "_cpu";

    private MutableClock clock;
    private AlertManager manager;
    private List<AlertEvent> events;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        manager = newManager(ClassificationPolicy.ANOMALY_FIRST, new AlertHistory());
        events = new ArrayList<>();
        manager.addListener(events::add);
    }

    // ------------------------------------------------------------------
    // Lifecycle transitions
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should walk a cpu alert through warning, critical and resolved under one id")
    void shouldFollowAlertLifecycle() {
        assertThat(evaluate(50)).isEmpty();

        AlertEvent warning = evaluate(85).orElseThrow();
        assertThat(warning.getType()).isEqualTo(AlertEventType.CREATED);
        assertThat(warning.getAlert().getLevel()).isEqualTo(AlertLevel.WARNING);
        assertThat(warning.getAlert().getThreshold()).isEqualTo(80.0);
        assertThat(warning.getAlert().getMessage()).isEqualTo("cpu usage high: 85.0%");

        AlertEvent critical = evaluate(97).orElseThrow();
        assertThat(critical.getType()).isEqualTo(AlertEventType.UPDATED);
        assertThat(critical.getPreviousLevel()).contains(AlertLevel.WARNING);
        assertThat(critical.getAlert().getLevel()).isEqualTo(AlertLevel.CRITICAL);
        assertThat(critical.getAlert().getThreshold()).isEqualTo(95.0);
        assertThat(critical.getAlert().getMessage()).isEqualTo("cpu usage critically high: 97.0%");

        AlertEvent resolved = evaluate(60).orElseThrow();
        assertThat(resolved.getType()).isEqualTo(AlertEventType.RESOLVED);
        assertThat(resolved.getAlert().isResolved()).isTrue();
        assertThat(resolved.getAlert().getMessage()).isEqualTo("cpu returned to normal levels");

        assertThat(List.of(warning, critical, resolved))
                .extracting(AlertEvent::getAlertId)
                .containsOnly(CPU_ALERT);
        assertThat(manager.getActiveAlerts()).isEmpty();
        assertThat(manager.getAlert(CPU_ALERT)).hasValueSatisfying(a -> assertThat(a.isResolved()).isTrue());
        assertThat(manager.getAlertHistory().snapshot()).hasSize(1);
        assertThat(events).hasSize(3);
    }

    @Test
    @DisplayName("Should not churn while the level stays the same")
    void shouldIgnoreRepeatedLevel() {
        evaluate(85);
        clock.advance(Duration.ofSeconds(5));

        assertThat(evaluate(88)).isEmpty();

        Alert stored = manager.getAlert(CPU_ALERT).orElseThrow();
        assertThat(stored.getValue()).isEqualTo(85.0);
        assertThat(stored.getTimestamp()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
    }

    @Test
    @DisplayName("Should reopen a resolved alert under the same id")
    void shouldReopenResolvedAlert() {
        evaluate(85);
        evaluate(50);

        AlertEvent reopened = evaluate(90).orElseThrow();

        assertThat(reopened.getType()).isEqualTo(AlertEventType.REOPENED);
        assertThat(reopened.getAlertId()).isEqualTo(CPU_ALERT);
        assertThat(reopened.getAlert().isResolved()).isFalse();
        assertThat(manager.getActiveAlerts()).extracting(Alert::getId).containsExactly(CPU_ALERT);
    }

    @Test
    @DisplayName("Should do nothing for a normal reading with no alert or a resolved one")
    void shouldIgnoreNormalReadingsWithoutOpenAlert() {
        assertThat(evaluate(10)).isEmpty();
        evaluate(85);
        evaluate(10);

        assertThat(evaluate(10)).isEmpty();
        assertThat(manager.getAlertHistory().size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should ignore metrics without an enabled threshold")
    void shouldIgnoreMetricsWithoutThreshold() {
        AlertThreshold disabled = new AlertThreshold("disk", 1, 2);
        disabled.setEnabled(false);
        manager.setThreshold(disabled);

        assertThat(manager.evaluate(DEVICE, "swap", 99)).isEmpty();
        assertThat(manager.evaluate(DEVICE, "disk", 99)).isEmpty();
        assertThat(manager.getAlerts()).isEmpty();
    }

    @Test
    @DisplayName("Should apply a threshold replaced at runtime")
    void shouldApplyReplacedThreshold() {
        manager.setThreshold(new AlertThreshold("cpu", 40, 60));

        AlertEvent event = evaluate(50).orElseThrow();

        assertThat(event.getAlert().getLevel()).isEqualTo(AlertLevel.WARNING);
        assertThat(manager.getThreshold("cpu")).hasValueSatisfying(t -> assertThat(t.getWarningLevel()).isEqualTo(40));
    }

    // ------------------------------------------------------------------
    // Classification policy
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should prefer the anomaly level by default")
    void shouldClassifyAnomalyFirst() {
        feedBaseline(manager);

        AlertEvent event = evaluate(97).orElseThrow();

        assertThat(event.getAlert().getLevel()).isEqualTo(AlertLevel.ANOMALY);
        assertThat(event.getAlert().getThreshold()).isZero();
        assertThat(event.getAlert().getMessage()).startsWith("Anomalous cpu value detected (z-score: ");
    }

    @Test
    @DisplayName("Should prefer the threshold level with the threshold-first policy")
    void shouldClassifyThresholdFirst() {
        AlertManager thresholdFirst = newManager(ClassificationPolicy.THRESHOLD_FIRST, new AlertHistory());
        feedBaseline(thresholdFirst);

        AlertEvent event = thresholdFirst.evaluate(DEVICE, "cpu", 97).orElseThrow();

        assertThat(event.getAlert().getLevel()).isEqualTo(AlertLevel.CRITICAL);
    }

    @Test
    @DisplayName("Should resolve policy names from configuration")
    void shouldResolvePolicyNames() {
        assertThat(ClassificationPolicy.fromConfigName("anomaly-first")).isEqualTo(ClassificationPolicy.ANOMALY_FIRST);
        assertThat(ClassificationPolicy.fromConfigName(" Threshold-First ")).isEqualTo(ClassificationPolicy.THRESHOLD_FIRST);
        assertThatThrownBy(() -> ClassificationPolicy.fromConfigName("loudest-first"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("loudest-first");
    }

    // ------------------------------------------------------------------
    // Operator actions
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should acknowledge an alert and notify listeners")
    void shouldAcknowledgeAlert() {
        evaluate(85);
        events.clear();

        Alert acknowledged = manager.acknowledgeAlert(CPU_ALERT);

        assertThat(acknowledged.isAcknowledged()).isTrue();
        assertThat(manager.getAlert(CPU_ALERT)).hasValueSatisfying(a -> assertThat(a.isAcknowledged()).isTrue());
        assertThat(events).extracting(AlertEvent::getType).containsExactly(AlertEventType.ACKNOWLEDGED);
    }

    @Test
    @DisplayName("Should keep the acknowledgement when the alert escalates")
    void shouldKeepAcknowledgementOnUpdate() {
        evaluate(85);
        manager.acknowledgeAlert(CPU_ALERT);

        AlertEvent critical = evaluate(97).orElseThrow();

        assertThat(critical.getAlert().isAcknowledged()).isTrue();
    }

    @Test
    @DisplayName("Should throw for an unknown alert id without side effects")
    void shouldThrowForUnknownAlert() {
        assertThatThrownBy(() -> manager.acknowledgeAlert("nope_cpu"))
                .isInstanceOf(AlertNotFoundException.class)
                .hasMessageContaining("nope_cpu");

        assertThat(events).isEmpty();
        assertThat(manager.getAlerts()).isEmpty();
    }

    @Test
    @DisplayName("Should return active alerts ordered by timestamp then id")
    void shouldOrderActiveAlerts() {
        manager.evaluate("dev-b", "cpu", 90);
        manager.evaluate("dev-a", "cpu", 90);
        clock.advance(Duration.ofSeconds(1));
        manager.evaluate("dev-a", "memory", 90);

        assertThat(manager.getActiveAlerts())
                .extracting(Alert::getId)
                .containsExactly("dev-a_cpu", "dev-b_cpu", "dev-a_memory");
    }

    @Test
    @DisplayName("Should hand out copies that cannot change the stored alert")
    void shouldReturnDefensiveCopies() {
        evaluate(85);

        manager.getActiveAlerts().get(0).setLevel(AlertLevel.CRITICAL);

        assertThat(manager.getAlert(CPU_ALERT).orElseThrow().getLevel()).isEqualTo(AlertLevel.WARNING);
    }

    // ------------------------------------------------------------------
    // History, restore, prune
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should cap the resolved-alert archive and evict the oldest entry")
    void shouldCapHistory() {
        AlertHistory history = new AlertHistory();
        for (int i = 0; i < AlertHistory.DEFAULT_CAPACITY + 1; i++) {
            history.archive(resolvedAlert("dev-" + i, Instant.parse("2024-05-01T10:00:00Z").plusSeconds(i)));
        }

        assertThat(history.size()).isEqualTo(1000);
        assertThat(history.snapshot().get(0).getDeviceId()).isEqualTo("dev-1");
        assertThat(history.snapshot().get(999).getDeviceId()).isEqualTo("dev-1000");
    }

    @Test
    @DisplayName("Should archive each resolution into a bounded history")
    void shouldArchiveResolutions() {
        AlertManager small = newManager(ClassificationPolicy.ANOMALY_FIRST, new AlertHistory(2));
        for (int i = 0; i < 3; i++) {
            small.evaluate(DEVICE, "cpu", 85);
            clock.advance(Duration.ofSeconds(1));
            small.evaluate(DEVICE, "cpu", 10);
        }

        assertThat(small.getAlertHistory().size()).isEqualTo(2);
        assertThat(small.getAlertHistory().forDevice(DEVICE)).allMatch(Alert::isResolved);
    }

    @Test
    @DisplayName("Should restore stored alerts without overwriting live ones")
    void shouldRestoreAlerts() {
        evaluate(85);
        Alert storedCpu = resolvedAlert(DEVICE, Instant.parse("2024-04-30T10:00:00Z"));
        Alert storedDisk = Alert.builder()
                .deviceId(DEVICE).metric("disk").level(AlertLevel.CRITICAL)
                .value(99).threshold(98).timestamp(Instant.parse("2024-04-30T10:00:00Z"))
                .message("disk usage critically high: 99.0%")
                .build();

        int restored = manager.restore(List.of(storedCpu, storedDisk));

        assertThat(restored).isEqualTo(1);
        assertThat(manager.getAlert(CPU_ALERT).orElseThrow().isResolved()).isFalse();
        assertThat(manager.getActiveAlerts()).extracting(Alert::getId).contains(DEVICE + "_disk");
    }

    @Test
    @DisplayName("Should prune only resolved alerts older than the cutoff")
    void shouldPruneResolvedAlerts() {
        manager.evaluate("dev-a", "cpu", 85);
        manager.evaluate("dev-a", "cpu", 10);
        manager.evaluate("dev-b", "cpu", 85);
        clock.advance(Duration.ofHours(2));

        int removed = manager.pruneHistory(clock.instant().minus(Duration.ofHours(1)));

        assertThat(removed).isEqualTo(1);
        assertThat(manager.getAlert("dev-a_cpu")).isEmpty();
        assertThat(manager.getAlert("dev-b_cpu")).isPresent();
        assertThat(manager.getAlertHistory().size()).isZero();
    }

    // ------------------------------------------------------------------
    // Listeners
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should keep notifying other listeners when one throws")
    void shouldIsolateFailingListener() {
        List<AlertEvent> received = new ArrayList<>();
        manager.addListener(event -> {
            throw new IllegalStateException("listener bug");
        });
        manager.addListener(received::add);

        Optional<AlertEvent> event = evaluate(85);

        assertThat(event).isPresent();
        assertThat(received).hasSize(1);
        assertThat(manager.getActiveAlerts()).hasSize(1);
    }

    @Test
    @DisplayName("Should stop notifying a removed listener")
    void shouldRemoveListener() {
        List<AlertEvent> received = new ArrayList<>();
        AlertListener listener = received::add;
        manager.addListener(listener);
        manager.removeListener(listener);

        evaluate(85);

        assertThat(received).isEmpty();
    }

    @Test
    @DisplayName("Should classify by threshold again once a device's baselines are reset")
    void shouldForgetBaselinesOfRemovedDevice() {
        feedBaseline(manager);
        manager.evaluate("other", "cpu", 50);

        assertThat(manager.resetBaselines(DEVICE)).isEqualTo(1);

        AlertEvent created = evaluate(90).orElseThrow();
        assertThat(created.getAlert().getLevel()).isEqualTo(AlertLevel.WARNING);
        assertThat(manager.resetBaselines(DEVICE)).isEqualTo(1);
        assertThat(manager.resetBaselines("other")).isEqualTo(1);
    }

    @Test
    @DisplayName("Should build a manager from configuration")
    void shouldBuildFromConfig() {
        MonitorConfig config = new MonitorConfig();
        config.setClassificationPolicy(MonitorConfig.POLICY_THRESHOLD_FIRST);
        config.setAlertHistoryCapacity(5);

        AlertManager fromConfig = AlertManager.fromConfig(config, clock);

        assertThat(fromConfig.getThreshold("memory")).hasValueSatisfying(t -> assertThat(t.getCriticalLevel()).isEqualTo(95));
        assertThat(fromConfig.getAlertHistory().getCapacity()).isEqualTo(5);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private AlertManager newManager(ClassificationPolicy policy, AlertHistory history) {
        return new AlertManager(new AnomalyDetector(), MonitorConfig.defaultThresholds(), policy, history, clock);
    }

    private Optional<AlertEvent> evaluate(double cpu) {
        return manager.evaluate(DEVICE, "cpu", cpu);
    }

    /** Twenty normal readings alternating 49 and 51. */
    private static void feedBaseline(AlertManager target) {
        for (int i = 0; i < 20; i++) {
            assertThat(target.evaluate(DEVICE, "cpu", i % 2 == 0 ? 49 : 51)).isEmpty();
        }
    }

    private static Alert resolvedAlert(String deviceId, Instant timestamp) {
        return Alert.builder()
                .deviceId(deviceId)
                .metric("cpu")
                .level(AlertLevel.WARNING)
                .value(85)
                .threshold(80)
                .timestamp(timestamp)
                .resolved(true)
                .message("cpu returned to normal levels")
                .build();
    }
}
