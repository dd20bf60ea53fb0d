package com.hostsentinel.monitor.scheduler;

import com.hostsentinel.core.alert.AlertEvent;
import com.hostsentinel.core.alert.AlertManager;
import com.hostsentinel.core.model.Alert;
import com.hostsentinel.core.model.Device;
import com.hostsentinel.core.model.MetricSample;
import com.hostsentinel.monitor.event.MonitorEvent;
import com.hostsentinel.monitor.event.MonitorEventBus;
import com.hostsentinel.monitor.store.AlertStore;
import com.hostsentinel.monitor.store.AlertWriter;
import com.hostsentinel.monitor.store.PersistenceException;
import com.hostsentinel.monitor.telemetry.MetricFormatException;
import com.hostsentinel.monitor.telemetry.TelemetryException;
import com.hostsentinel.monitor.telemetry.TelemetryProvider;
import com.hostsentinel.monitor.telemetry.TelemetrySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs one monitoring pass over a single device.
 *
 * <h3>Steps</h3>
 * <ol>
 *   <li>lock the device</li>
 *   <li>connect; on failure count the error, mark the device
 *       {@code CONNECTION_FAILED}, persist it and stop</li>
 *   <li>mark the device {@code ONLINE} and fetch readings</li>
 *   <li>validate the readings; a missing or malformed required metric stops
 *       the pass before any state changes</li>
 *   <li>append each reading to the device history and evaluate it, in
 *       reporting order</li>
 *   <li>merge services, stamp {@code lastUpdate}</li>
 *   <li>persist the device, the metrics row, every changed alert and every
 *       evaluated alert whose earlier write failed</li>
 *   <li>publish a device update</li>
 * </ol>
 *
 * <p>
 * Persistence failures are logged and reported as
 * {@link PollOutcome#PERSISTENCE_FAILED}; in-memory state is kept. Alert
 * events reach subscribers through the {@link AlertManager} listeners, not
 * from here.
 * </p>
 *
 * @since 1.0.0
 */
public class DevicePoller {

    private static final Logger LOG = LoggerFactory.getLogger(DevicePoller.class);

    private final TelemetryProvider provider;
    private final AlertManager alertManager;
    private final AlertStore store;
    private final AlertWriter alertWriter;
    private final MonitorEventBus eventBus;
    private final Clock clock;

    public DevicePoller(TelemetryProvider provider,
            AlertManager alertManager,
            AlertStore store,
            AlertWriter alertWriter,
            MonitorEventBus eventBus,
            Clock clock) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.alertManager = Objects.requireNonNull(alertManager, "alertManager must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.alertWriter = Objects.requireNonNull(alertWriter, "alertWriter must not be null");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Poll the device while holding its lock.
     *
     * @throws InterruptedException if interrupted while waiting for the lock
     */
    public PollOutcome poll(Device device) throws InterruptedException {
        ReentrantLock lock = device.getLock();
        lock.lockInterruptibly();
        try {
            return pollLocked(device);
        } finally {
            lock.unlock();
        }
    }

    private PollOutcome pollLocked(Device device) {
        String deviceId = device.getId();

        if (!connect(device)) {
            int errors = device.markConnectionFailed();
            LOG.warn("Failed to connect to device {} (errors: {})", deviceId, errors);
            persist(() -> store.saveDevice(device), deviceId);
            eventBus.publish(MonitorEvent.deviceUpdated(device, clock.instant()));
            return PollOutcome.CONNECTION_FAILED;
        }
        device.markConnected();

        TelemetrySnapshot snapshot;
        Map<String, Double> readings;
        try {
            snapshot = provider.fetchMetrics(device);
            readings = snapshot.validatedMetrics(deviceId);
        } catch (MetricFormatException e) {
            LOG.warn("Discarding readings from device {}: {}", deviceId, e.getMessage());
            return PollOutcome.INVALID_METRICS;
        } catch (TelemetryException e) {
            LOG.warn("Failed to get metrics from device {}: {}", deviceId, e.getMessage());
            return PollOutcome.FETCH_FAILED;
        }
        if (Thread.currentThread().isInterrupted()) {
            LOG.debug("Poll of device {} cancelled before evaluation", deviceId);
            return PollOutcome.CANCELLED;
        }

        Instant now = clock.instant();
        Set<String> dirty = new LinkedHashSet<>();
        for (Map.Entry<String, Double> reading : readings.entrySet()) {
            String metric = reading.getKey();
            device.recordSample(metric, new MetricSample(reading.getValue(), now));
            String alertId = Alert.keyOf(deviceId, metric);
            Optional<AlertEvent> change = alertManager.evaluate(deviceId, metric, reading.getValue());
            if (change.isPresent() || alertWriter.isPending(alertId)) {
                dirty.add(alertId);
            }
        }
        device.updateServices(snapshot.getServices());
        device.setLastUpdate(now);

        boolean persisted = persist(() -> {
            store.saveDevice(device);
            store.saveMetrics(deviceId, now, snapshot);
        }, deviceId);
        for (String alertId : dirty) {
            persisted &= persist(() -> alertWriter.write(alertId), deviceId);
        }

        eventBus.publish(MonitorEvent.deviceUpdated(device, now));
        LOG.debug("Polled device {}: {} reading(s), {} alert write(s)", deviceId, readings.size(), dirty.size());
        return persisted ? PollOutcome.SUCCESS : PollOutcome.PERSISTENCE_FAILED;
    }

    private boolean connect(Device device) {
        try {
            return provider.connect(device);
        } catch (TelemetryException e) {
            LOG.debug("Connection attempt to device {} raised: {}", device.getId(), e.getMessage());
            return false;
        }
    }

    private boolean persist(Runnable writes, String deviceId) {
        try {
            writes.run();
            return true;
        } catch (PersistenceException e) {
            LOG.error("Failed to persist state of device {}: {}", deviceId, e.getMessage(), e);
            return false;
        }
    }
}
