package com.hostsentinel.monitor;

import com.hostsentinel.core.alert.AlertManager;
import com.hostsentinel.core.cache.TelemetryCache;
import com.hostsentinel.core.config.ConfigLoader;
import com.hostsentinel.core.config.MonitorConfig;
import com.hostsentinel.core.model.Alert;
import com.hostsentinel.core.model.Device;
import com.hostsentinel.monitor.event.MonitorEvent;
import com.hostsentinel.monitor.event.MonitorEventBus;
import com.hostsentinel.monitor.event.MonitorEventListener;
import com.hostsentinel.monitor.metrics.MonitorMetrics;
import com.hostsentinel.monitor.scheduler.DevicePoller;
import com.hostsentinel.monitor.scheduler.DeviceRegistry;
import com.hostsentinel.monitor.scheduler.MonitoringScheduler;
import com.hostsentinel.monitor.scheduler.SchedulerSettings;
import com.hostsentinel.monitor.store.AlertStore;
import com.hostsentinel.monitor.store.AlertWriter;
import com.hostsentinel.monitor.store.PersistenceException;
import com.hostsentinel.monitor.telemetry.CachingTelemetryProvider;
import com.hostsentinel.monitor.telemetry.TelemetryProvider;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point for embedding the monitoring engine in a host application.
 *
 * <h3>Wiring</h3>
 *
 * <pre>
 *   MonitorConfig
 *     → AlertStore (SQLite pool)       restores devices and open alerts
 *     → TelemetryCache + provider       CachingTelemetryProvider when the TTL is positive
 *     → AlertManager (AnomalyDetector)  alert events forwarded to the event bus
 *     → AlertWriter                     ordered alert upserts, failed writes retried
 *     → DevicePoller + DeviceRegistry
 *     → MonitoringScheduler
 * </pre>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * Construction opens the database, which is fatal on failure, and restores
 * saved devices and open alerts, which only logs on failure. {@link #start()} and {@link #stop()} may be repeated.
 * {@link #close()} stops monitoring and releases the database.
 * </p>
 *
 * @since 1.0.0
 */
public class HostSentinelEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(HostSentinelEngine.class);

    private final MonitorConfig config;
    private final Clock clock;
    private final AlertStore store;
    private final AlertManager alertManager;
    private final AlertWriter alertWriter;
    private final DeviceRegistry registry = new DeviceRegistry();
    private final MonitorEventBus eventBus = new MonitorEventBus();
    private final MonitorMetrics metrics;
    private final MonitoringScheduler scheduler;

    /**
     * Build an engine with the system UTC clock and a private meter registry.
     */
    public HostSentinelEngine(MonitorConfig config, TelemetryProvider provider) {
        this(config, provider, Clock.systemUTC(), new SimpleMeterRegistry());
    }

    /**
     * @throws IllegalStateException if the configuration is invalid
     * @throws PersistenceException  if the database cannot be opened
     */
    public HostSentinelEngine(MonitorConfig config,
            TelemetryProvider provider,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(provider, "provider must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        config.validate();

        this.store = AlertStore.open(config.getDatabasePath(), config.getDatabaseConnections(), clock,
                meterRegistry);
        this.metrics = new MonitorMetrics(meterRegistry);
        this.alertManager = AlertManager.fromConfig(config, clock);
        this.alertManager.addListener(event -> {
            metrics.recordAlertTransition(event.getType().name().toLowerCase(Locale.ROOT));
            eventBus.publish(MonitorEvent.alert(event, clock.instant()));
        });

        this.alertWriter = new AlertWriter(alertManager, store);

        DevicePoller poller = new DevicePoller(wrap(provider), alertManager, store, alertWriter, eventBus, clock);
        this.scheduler = new MonitoringScheduler(registry, poller, SchedulerSettings.fromConfig(config),
                metrics, eventBus, clock);

        restoreState();
    }

    /**
     * Load configuration through {@link ConfigLoader#load()} and build an
     * engine for {@code provider}.
     */
    public static HostSentinelEngine fromDefaultConfig(TelemetryProvider provider) {
        return new HostSentinelEngine(ConfigLoader.load(), provider);
    }

    private TelemetryProvider wrap(TelemetryProvider provider) {
        if (config.getCacheTtlSeconds() <= 0) {
            LOG.info("Telemetry caching disabled");
            return provider;
        }
        TelemetryCache<String, Object> cache = new TelemetryCache<>(config.getCacheCapacity(),
                Duration.ofSeconds(config.getCacheTtlSeconds()), clock);
        return new CachingTelemetryProvider(provider, cache);
    }

    private void restoreState() {
        try {
            for (Device device : store.loadDevices().values()) {
                device.setHistoryCapacity(config.getMaxHistorySize());
                registry.register(device);
            }
            int alerts = alertManager.restore(store.loadAlerts(true));
            LOG.info("Restored {} device(s) and {} open alert(s) from {}",
                    registry.size(), alerts, config.getDatabasePath());
        } catch (PersistenceException e) {
            LOG.warn("Could not restore saved state, starting empty: {}", e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    public void start() {
        scheduler.start();
        eventBus.publish(MonitorEvent.log(MonitorEvent.Severity.INFO, "Monitoring started", clock.instant()));
    }

    public void stop() {
        scheduler.stop();
        eventBus.publish(MonitorEvent.log(MonitorEvent.Severity.INFO, "Monitoring stopped", clock.instant()));
    }

    public boolean isRunning() {
        return scheduler.isRunning();
    }

    @Override
    public void close() {
        scheduler.stop();
        store.close();
    }

    // ---------------------------------------------------------------
    // Devices
    // ---------------------------------------------------------------

    /**
     * Add or replace a device and persist it. The device's history capacity is
     * set from the configuration.
     */
    public void registerDevice(Device device) {
        device.setHistoryCapacity(config.getMaxHistorySize());
        registry.register(device).ifPresent(previous ->
                LOG.info("Replacing registered device {}", previous.getId()));
        saveQuietly(() -> store.saveDevice(device), "device " + device.getId());
    }

    /**
     * Stop tracking a device in memory and drop its anomaly baselines. Stored
     * rows and alert records are kept.
     */
    public Optional<Device> removeDevice(String deviceId) {
        Optional<Device> removed = registry.remove(deviceId);
        removed.ifPresent(device -> alertManager.resetBaselines(deviceId));
        return removed;
    }

    public Optional<Device> getDevice(String deviceId) {
        return registry.get(deviceId);
    }

    public Collection<Device> getDevices() {
        return registry.all();
    }

    // ---------------------------------------------------------------
    // Alerts
    // ---------------------------------------------------------------

    public List<Alert> getActiveAlerts() {
        return alertManager.getActiveAlerts();
    }

    /**
     * Acknowledge an alert and persist the change. A failed write is retried
     * by the next poll of the device.
     *
     * @throws com.hostsentinel.core.alert.AlertNotFoundException if no alert has that id
     */
    public Alert acknowledgeAlert(String alertId) {
        Alert acknowledged = alertManager.acknowledgeAlert(alertId);
        saveQuietly(() -> alertWriter.write(alertId), "alert " + alertId);
        return acknowledged;
    }

    /**
     * Drop resolved alerts older than {@code olderThan} from memory, the
     * archive and the database.
     *
     * @return rows deleted from the database
     */
    public int pruneResolvedAlerts(Instant olderThan) {
        alertManager.pruneHistory(olderThan);
        return store.pruneResolvedAlerts(olderThan);
    }

    // ---------------------------------------------------------------
    // Events
    // ---------------------------------------------------------------

    public AutoCloseable subscribe(MonitorEventListener listener) {
        return eventBus.subscribe(listener);
    }

    public List<MonitorEvent> recentEvents() {
        return eventBus.recentEvents();
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public AlertManager getAlertManager() {
        return alertManager;
    }

    public AlertStore getStore() {
        return store;
    }

    public MonitorMetrics getMetrics() {
        return metrics;
    }

    public MonitorConfig getConfig() {
        return config;
    }

    private static void saveQuietly(Runnable write, String what) {
        try {
            write.run();
        } catch (PersistenceException e) {
            LOG.error("Failed to persist {}: {}", what, e.getMessage(), e);
        }
    }
}
