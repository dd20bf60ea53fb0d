package com.hostsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Device} and {@link MetricHistory}.
 */
class DeviceTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    @DisplayName("Should start unknown with no errors")
    void shouldStartUnknown() {
        Device device = new Device("aa:bb:cc:dd:ee:01");

        assertThat(device.getStatus()).isEqualTo(DeviceStatus.UNKNOWN);
        assertThat(device.getConnectionErrors()).isZero();
        assertThat(device.getLastUpdate()).isNull();
        assertThat(device.getTrackedMetrics()).isEmpty();
    }

    @Test
    @DisplayName("Should count failures and reset them on the next connection")
    void shouldTrackConnectionErrors() {
        Device device = new Device("aa:bb:cc:dd:ee:01");

        assertThat(device.markConnectionFailed()).isEqualTo(1);
        assertThat(device.markConnectionFailed()).isEqualTo(2);
        assertThat(device.getStatus()).isEqualTo(DeviceStatus.CONNECTION_FAILED);

        device.markConnected();

        assertThat(device.getConnectionErrors()).isZero();
        assertThat(device.getStatus()).isEqualTo(DeviceStatus.ONLINE);
    }

    @Test
    @DisplayName("Should keep a bounded history per metric")
    void shouldBoundHistory() {
        Device device = new Device("aa:bb:cc:dd:ee:01");
        device.setHistoryCapacity(3);

        for (int i = 0; i < 5; i++) {
            device.recordSample("cpu", new MetricSample(i, T0.plusSeconds(i)));
        }

        MetricHistory history = device.getHistory("cpu").orElseThrow();
        assertThat(history.size()).isEqualTo(3);
        assertThat(history.snapshot()).extracting(MetricSample::getValue).containsExactly(2.0, 3.0, 4.0);
        assertThat(history.latest()).contains(new MetricSample(4, T0.plusSeconds(4)));
        assertThat(device.getHistory("memory")).isEmpty();
    }

    @Test
    @DisplayName("Should merge service updates and skip null readings")
    void shouldMergeServices() {
        Device device = new Device("aa:bb:cc:dd:ee:01");
        device.updateServices(Map.of("nginx", 12.5, "postgres", 30.0));

        Map<String, Double> update = new HashMap<>();
        update.put("nginx", 14.0);
        update.put("redis", null);
        device.updateServices(update);

        assertThat(device.getServices()).containsOnly(Map.entry("nginx", 14.0), Map.entry("postgres", 30.0));
    }

    @Test
    @DisplayName("Should compare devices by id only")
    void shouldUseIdentity() {
        Device a = new Device("aa:bb:cc:dd:ee:01");
        Device b = new Device("aa:bb:cc:dd:ee:01");
        b.setHostname("web-01");

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
    }

    @Test
    @DisplayName("Should reject blank ids and non-positive history capacity")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> new Device(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MetricHistory(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Device("x").setHistoryCapacity(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should parse stored status names leniently")
    void shouldParseStatus() {
        assertThat(DeviceStatus.fromString("online")).isEqualTo(DeviceStatus.ONLINE);
        assertThat(DeviceStatus.fromString("Connection_Failed")).isEqualTo(DeviceStatus.CONNECTION_FAILED);
        assertThat(DeviceStatus.fromString("rebooting")).isEqualTo(DeviceStatus.UNKNOWN);
        assertThat(DeviceStatus.fromString(null)).isEqualTo(DeviceStatus.UNKNOWN);
    }
}
