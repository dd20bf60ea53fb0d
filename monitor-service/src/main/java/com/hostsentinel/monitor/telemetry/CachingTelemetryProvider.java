package com.hostsentinel.monitor.telemetry;

import com.hostsentinel.core.cache.TelemetryCache;
import com.hostsentinel.core.model.Device;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * {@link TelemetryProvider} decorator that memoises connection checks and
 * metric snapshots in a {@link TelemetryCache}.
 *
 * <p>
 * Entries are keyed {@code connection_<deviceId>} and {@code metrics_<deviceId>}.
 * Only successful results are cached: a refused connection or a failed fetch
 * goes back to the delegate on the next call, and a failed fetch also drops
 * the cached connection so the device is re-verified.
 * </p>
 *
 * @since 1.0.0
 */
public class CachingTelemetryProvider implements TelemetryProvider {

    private static final Logger LOG = LoggerFactory.getLogger(CachingTelemetryProvider.class);

    static final String CONNECTION_PREFIX = "connection_";
    static final String METRICS_PREFIX = "metrics_";

    private final TelemetryProvider delegate;
    private final TelemetryCache<String, Object> cache;

    public CachingTelemetryProvider(TelemetryProvider delegate, TelemetryCache<String, Object> cache) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
    }

    @Override
    public boolean connect(Device device) throws TelemetryException {
        String key = CONNECTION_PREFIX + device.getId();
        Optional<Object> cached = cache.get(key);
        if (cached.isPresent() && cached.get() instanceof Boolean hit) {
            LOG.trace("Connection cache hit for device {}", device.getId());
            return hit;
        }
        boolean reachable = delegate.connect(device);
        if (reachable) {
            cache.put(key, Boolean.TRUE);
        }
        return reachable;
    }

    @Override
    public TelemetrySnapshot fetchMetrics(Device device) throws TelemetryException {
        String key = METRICS_PREFIX + device.getId();
        Optional<Object> cached = cache.get(key);
        if (cached.isPresent() && cached.get() instanceof TelemetrySnapshot hit) {
            LOG.trace("Metrics cache hit for device {}", device.getId());
            return hit;
        }
        try {
            TelemetrySnapshot snapshot = delegate.fetchMetrics(device);
            cache.put(key, snapshot);
            return snapshot;
        } catch (TelemetryException e) {
            cache.invalidate(CONNECTION_PREFIX + device.getId());
            throw e;
        }
    }

    /**
     * Drop everything cached for the device.
     */
    public void invalidate(String deviceId) {
        cache.invalidate(CONNECTION_PREFIX + deviceId);
        cache.invalidate(METRICS_PREFIX + deviceId);
    }

    public TelemetryProvider getDelegate() {
        return delegate;
    }
}
