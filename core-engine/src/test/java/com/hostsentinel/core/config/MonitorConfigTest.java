package com.hostsentinel.core.config;

import com.hostsentinel.core.model.AlertThreshold;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MonitorConfig}.
 */
class MonitorConfigTest {

    @Test
    @DisplayName("Should ship valid defaults")
    void shouldHaveValidDefaults() {
        MonitorConfig config = new MonitorConfig();

        assertThatCode(config::validate).doesNotThrowAnyException();
        assertThat(config.getMonitoringIntervalSeconds()).isEqualTo(5);
        assertThat(config.getMaxHistorySize()).isEqualTo(100);
        assertThat(config.getCacheTtlSeconds()).isEqualTo(300);
        assertThat(config.getCacheCapacity()).isEqualTo(1000);
        assertThat(config.getMaxConcurrentMonitors()).isEqualTo(10);
        assertThat(config.getDatabaseConnections()).isEqualTo(5);
        assertThat(config.getDatabasePath()).isEqualTo("network_monitor.db");
        assertThat(config.getTaskTimeoutSeconds()).isEqualTo(30);
        assertThat(config.getAlertHistoryCapacity()).isEqualTo(1000);
        assertThat(config.isRetryFailedConnections()).isTrue();
        assertThat(config.getClassificationPolicy()).isEqualTo(MonitorConfig.POLICY_ANOMALY_FIRST);
    }

    @Test
    @DisplayName("Should default to cpu, memory and disk thresholds")
    void shouldHaveDefaultThresholds() {
        MonitorConfig config = new MonitorConfig();

        assertThat(config.thresholdsByMetric()).containsOnlyKeys("cpu", "memory", "disk");
        assertThat(config.thresholdsByMetric().get("disk").getWarningLevel()).isEqualTo(90.0);
        assertThat(config.thresholdsByMetric().get("disk").getCriticalLevel()).isEqualTo(98.0);
        assertThat(config.getAlertThresholds()).allMatch(t -> t.getDurationSeconds() == 300);
    }

    @Test
    @DisplayName("Should reject a warning level above the critical level")
    void shouldRejectInvertedLevels() {
        MonitorConfig config = new MonitorConfig();
        config.setAlertThresholds(List.of(new AlertThreshold("cpu", 96, 95)));

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("cpu");
    }

    @Test
    @DisplayName("Should reject negative cache TTL but allow zero")
    void shouldValidateCacheTtl() {
        MonitorConfig config = new MonitorConfig();
        config.setCacheTtlSeconds(0);
        assertThatCode(config::validate).doesNotThrowAnyException();

        config.setCacheTtlSeconds(-1);
        assertThatThrownBy(config::validate).hasMessageContaining("cacheTtlSeconds");
    }

    @Test
    @DisplayName("Should normalise the policy name")
    void shouldNormalisePolicyName() {
        MonitorConfig config = new MonitorConfig();
        config.setClassificationPolicy("  THRESHOLD-FIRST ");

        assertThat(config.getClassificationPolicy()).isEqualTo(MonitorConfig.POLICY_THRESHOLD_FIRST);
        assertThatCode(config::validate).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should not expose the threshold list for modification")
    void shouldProtectThresholdList() {
        MonitorConfig config = new MonitorConfig();

        assertThatThrownBy(() -> config.getAlertThresholds().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
