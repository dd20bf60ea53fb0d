package com.hostsentinel.monitor.scheduler;

import com.hostsentinel.core.config.MonitorConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchedulerSettingsTest {

    @Test
    @DisplayName("Should map scheduling fields from the configuration")
    void shouldBuildFromConfig() {
        MonitorConfig config = new MonitorConfig();
        config.setMonitoringIntervalSeconds(7);
        config.setTaskTimeoutSeconds(12);
        config.setMaxConcurrentMonitors(3);
        config.setRetryFailedConnections(false);

        SchedulerSettings settings = SchedulerSettings.fromConfig(config);

        assertThat(settings.getInterval()).isEqualTo(Duration.ofSeconds(7));
        assertThat(settings.getTaskTimeout()).isEqualTo(Duration.ofSeconds(12));
        assertThat(settings.getMaxConcurrentMonitors()).isEqualTo(3);
        assertThat(settings.isRetryFailedConnections()).isFalse();
    }

    @Test
    @DisplayName("Should default to a 5s interval, 30s timeout and 10 monitors")
    void shouldApplyDefaults() {
        SchedulerSettings settings = new SchedulerSettings.Builder().build();

        assertThat(settings.getInterval()).isEqualTo(Duration.ofSeconds(5));
        assertThat(settings.getTaskTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(settings.getMaxConcurrentMonitors()).isEqualTo(10);
        assertThat(settings.isRetryFailedConnections()).isTrue();
    }

    @Test
    @DisplayName("Should reject non-positive durations and limits")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> new SchedulerSettings.Builder().interval(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("interval");
        assertThatThrownBy(() -> new SchedulerSettings.Builder().taskTimeout(Duration.ofSeconds(-1)).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("taskTimeout");
        assertThatThrownBy(() -> new SchedulerSettings.Builder().maxConcurrentMonitors(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxConcurrentMonitors");
    }
}
