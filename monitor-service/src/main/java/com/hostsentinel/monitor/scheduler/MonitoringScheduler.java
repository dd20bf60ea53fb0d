package com.hostsentinel.monitor.scheduler;

import com.hostsentinel.core.model.Device;
import com.hostsentinel.monitor.event.MonitorEvent;
import com.hostsentinel.monitor.event.MonitorEventBus;
import com.hostsentinel.monitor.metrics.MonitorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Periodic driver of the monitoring loop.
 *
 * <h3>Threads</h3>
 * <p>
 * One driver thread ({@code host-sentinel-scheduler}) runs the loop. Each
 * cycle dispatches one {@link DevicePoller} task per selected device onto a
 * cached pool of daemon threads ({@code host-sentinel-poller-N}); a semaphore
 * caps in-flight polls at {@code maxConcurrentMonitors}.
 * </p>
 *
 * <h3>Cycle</h3>
 * <ol>
 *   <li>select eligible devices through {@link DeviceRegistry#selectEligible}</li>
 *   <li>none: sleep the full interval</li>
 *   <li>dispatch, then wait for every task up to its own deadline (dispatch
 *       time plus {@code taskTimeout}); late tasks are cancelled, logged and
 *       counted</li>
 *   <li>sleep the rest of the interval, or log an overrun and go again</li>
 * </ol>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * {@link #start()} and {@link #stop()} are idempotent and may be called from
 * any thread. A stopped scheduler can be started again.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitoringScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(MonitoringScheduler.class);

    static final String DRIVER_THREAD_NAME = "host-sentinel-scheduler";
    static final String POLLER_THREAD_PREFIX = "host-sentinel-poller-";

    private final DeviceRegistry registry;
    private final DevicePoller poller;
    private final SchedulerSettings settings;
    private final MonitorMetrics metrics;
    private final MonitorEventBus eventBus;
    private final Clock clock;
    private final Semaphore permits;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger activeLoops = new AtomicInteger();
    private final AtomicInteger pollerThreads = new AtomicInteger();

    private ExecutorService driver;
    private ExecutorService workers;

    public MonitoringScheduler(DeviceRegistry registry,
            DevicePoller poller,
            SchedulerSettings settings,
            MonitorMetrics metrics,
            MonitorEventBus eventBus,
            Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.poller = Objects.requireNonNull(poller, "poller must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.permits = new Semaphore(settings.getMaxConcurrentMonitors());
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            LOG.debug("Monitoring already running");
            return;
        }
        driver = Executors.newSingleThreadExecutor(daemonFactory(() -> DRIVER_THREAD_NAME));
        workers = Executors.newCachedThreadPool(
                daemonFactory(() -> POLLER_THREAD_PREFIX + pollerThreads.incrementAndGet()));
        driver.execute(this::runLoop);
        LOG.info("Monitoring started with {}", settings);
    }

    /**
     * Stop the loop, cancel in-flight polls and wait for the driver to exit,
     * at most one task timeout.
     */
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        driver.shutdownNow();
        workers.shutdownNow();
        try {
            long timeoutMillis = settings.getTaskTimeout().toMillis();
            if (!driver.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
                LOG.warn("Scheduler thread did not exit within {} ms", timeoutMillis);
            }
            if (!workers.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
                LOG.warn("Poller threads did not exit within {} ms", timeoutMillis);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOG.info("Monitoring stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return number of loops currently executing, 0 or 1
     */
    public int getActiveLoopCount() {
        return activeLoops.get();
    }

    public SchedulerSettings getSettings() {
        return settings;
    }

    // ---------------------------------------------------------------
    // Loop
    // ---------------------------------------------------------------

    private void runLoop() {
        activeLoops.incrementAndGet();
        LOG.debug("Scheduler loop entered");
        try {
            while (running.get() && !Thread.currentThread().isInterrupted()) {
                long started = System.nanoTime();
                List<Device> batch = registry.selectEligible(
                        settings.getMaxConcurrentMonitors(), settings.isRetryFailedConnections());

                if (batch.isEmpty()) {
                    LOG.trace("No devices eligible for monitoring");
                    Thread.sleep(settings.getInterval().toMillis());
                    continue;
                }

                try {
                    runCycle(batch);
                } catch (RuntimeException e) {
                    LOG.error("Poll cycle failed: {}", e.getMessage(), e);
                }

                Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
                metrics.recordCycle(elapsed);
                eventBus.publish(MonitorEvent.cycleCompleted(batch.size(), elapsed.toMillis(), clock.instant()));

                Duration remaining = settings.getInterval().minus(elapsed);
                if (remaining.isNegative() || remaining.isZero()) {
                    metrics.incrementOverruns();
                    LOG.warn("Monitoring cycle took {} ms, longer than the {} ms interval",
                            elapsed.toMillis(), settings.getInterval().toMillis());
                } else {
                    Thread.sleep(remaining.toMillis());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            activeLoops.decrementAndGet();
            LOG.debug("Scheduler loop exited");
        }
    }

    private void runCycle(List<Device> batch) throws InterruptedException {
        long timeoutNanos = settings.getTaskTimeout().toNanos();
        Map<Device, Future<PollOutcome>> tasks = new LinkedHashMap<>();
        Map<Device, Long> deadlines = new LinkedHashMap<>();

        for (Device device : batch) {
            try {
                tasks.put(device, workers.submit(() -> pollWithPermit(device)));
                deadlines.put(device, System.nanoTime() + timeoutNanos);
            } catch (RejectedExecutionException e) {
                LOG.debug("Poller pool shut down, abandoning cycle");
                break;
            }
        }

        try {
            for (Map.Entry<Device, Future<PollOutcome>> task : tasks.entrySet()) {
                await(task.getKey(), task.getValue(), deadlines.get(task.getKey()));
            }
        } catch (InterruptedException e) {
            tasks.values().forEach(f -> f.cancel(true));
            throw e;
        }
    }

    private PollOutcome pollWithPermit(Device device) throws InterruptedException {
        permits.acquire();
        try {
            return poller.poll(device);
        } finally {
            permits.release();
        }
    }

    private void await(Device device, Future<PollOutcome> future, long deadlineNanos) throws InterruptedException {
        long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
        try {
            PollOutcome outcome = future.get(remaining, TimeUnit.NANOSECONDS);
            metrics.recordPoll(outcome.tag());
        } catch (TimeoutException e) {
            future.cancel(true);
            metrics.incrementTimeouts();
            LOG.error("Timeout monitoring device {} after {} ms", device.getId(), settings.getTaskTimeout().toMillis());
        } catch (ExecutionException e) {
            metrics.recordPoll("error");
            LOG.error("Error monitoring device {}: {}", device.getId(), e.getCause().getMessage(), e.getCause());
        } catch (CancellationException e) {
            metrics.recordPoll(PollOutcome.CANCELLED.tag());
        }
    }

    private static ThreadFactory daemonFactory(Supplier<String> names) {
        return runnable -> {
            Thread thread = new Thread(runnable, names.get());
            thread.setDaemon(true);
            return thread;
        };
    }
}
