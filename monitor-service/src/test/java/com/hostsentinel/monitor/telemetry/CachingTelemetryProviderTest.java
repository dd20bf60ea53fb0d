package com.hostsentinel.monitor.telemetry;

import com.hostsentinel.core.cache.TelemetryCache;
import com.hostsentinel.core.model.Device;
import com.hostsentinel.monitor.FakeTelemetryProvider;
import com.hostsentinel.monitor.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CachingTelemetryProvider}.
 */
class CachingTelemetryProviderTest {

    private static final String DEVICE = "aa:bb:cc:dd:ee:01";

    private MutableClock clock;
    private FakeTelemetryProvider delegate;
    private CachingTelemetryProvider provider;
    private Device device;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        delegate = new FakeTelemetryProvider();
        provider = new CachingTelemetryProvider(delegate,
                new TelemetryCache<>(100, Duration.ofSeconds(300), clock));
        device = new Device(DEVICE);
    }

    @Test
    @DisplayName("Should call the delegate once per TTL for connections and metrics")
    void shouldMemoiseWithinTtl() throws TelemetryException {
        assertThat(provider.connect(device)).isTrue();
        assertThat(provider.connect(device)).isTrue();
        TelemetrySnapshot first = provider.fetchMetrics(device);
        TelemetrySnapshot second = provider.fetchMetrics(device);

        assertThat(delegate.connectCount(DEVICE)).isEqualTo(1);
        assertThat(delegate.fetchCount(DEVICE)).isEqualTo(1);
        assertThat(second).isSameAs(first);
    }

    @Test
    @DisplayName("Should go back to the delegate once the TTL has passed")
    void shouldRefreshAfterTtl() throws TelemetryException {
        provider.fetchMetrics(device);
        clock.advance(Duration.ofSeconds(300));

        provider.fetchMetrics(device);

        assertThat(delegate.fetchCount(DEVICE)).isEqualTo(2);
    }

    @Test
    @DisplayName("Should not cache a failed connection")
    void shouldNotCacheConnectionFailure() throws TelemetryException {
        delegate.unreachable(DEVICE);
        assertThatThrownBy(() -> provider.connect(device)).isInstanceOf(ConnectionException.class);

        delegate.reachable(DEVICE);

        assertThat(provider.connect(device)).isTrue();
        assertThat(delegate.connectCount(DEVICE)).isEqualTo(2);
    }

    @Test
    @DisplayName("Should drop the cached connection when fetching fails")
    void shouldInvalidateConnectionOnFetchFailure() throws TelemetryException {
        provider.connect(device);
        delegate.failFetch(DEVICE);

        assertThatThrownBy(() -> provider.fetchMetrics(device)).isInstanceOf(TelemetryException.class);
        provider.connect(device);

        assertThat(delegate.connectCount(DEVICE)).isEqualTo(2);
    }

    @Test
    @DisplayName("Should forget a device on request")
    void shouldInvalidateDevice() throws TelemetryException {
        provider.connect(device);
        provider.fetchMetrics(device);

        provider.invalidate(DEVICE);
        provider.connect(device);
        provider.fetchMetrics(device);

        assertThat(delegate.connectCount(DEVICE)).isEqualTo(2);
        assertThat(delegate.fetchCount(DEVICE)).isEqualTo(2);
    }
}
