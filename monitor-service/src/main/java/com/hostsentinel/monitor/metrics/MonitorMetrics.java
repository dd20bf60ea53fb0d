package com.hostsentinel.monitor.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.Objects;

/**
 * Micrometer meters for the monitoring loop.
 *
 * <p>
 * The engine uses a {@link SimpleMeterRegistry} unless the host application
 * passes its own registry (for example a Prometheus one).
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code host_sentinel.cycles} – completed poll cycles</li>
 *   <li>{@code host_sentinel.cycle.overruns} – cycles longer than the interval</li>
 *   <li>{@code host_sentinel.cycle.duration} – timer over cycle wall time</li>
 *   <li>{@code host_sentinel.polls{outcome}} – finished device polls by outcome</li>
 *   <li>{@code host_sentinel.poll.timeouts} – polls cancelled at the task deadline</li>
 *   <li>{@code host_sentinel.alerts{type}} – alert transitions by event type</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class MonitorMetrics {

    static final String PREFIX = "host_sentinel.";

    private final MeterRegistry registry;
    private final Counter cycles;
    private final Counter overruns;
    private final Counter timeouts;
    private final Timer cycleDuration;

    public MonitorMetrics() {
        this(new SimpleMeterRegistry());
    }

    public MonitorMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.cycles = Counter.builder(PREFIX + "cycles")
                .description("Completed poll cycles")
                .register(registry);
        this.overruns = Counter.builder(PREFIX + "cycle.overruns")
                .description("Poll cycles that took longer than the monitoring interval")
                .register(registry);
        this.timeouts = Counter.builder(PREFIX + "poll.timeouts")
                .description("Device polls cancelled at their deadline")
                .register(registry);
        this.cycleDuration = Timer.builder(PREFIX + "cycle.duration")
                .description("Wall time of a poll cycle")
                .register(registry);
    }

    public void recordCycle(Duration elapsed) {
        cycles.increment();
        cycleDuration.record(elapsed);
    }

    public void incrementOverruns() {
        overruns.increment();
    }

    public void incrementTimeouts() {
        timeouts.increment();
    }

    public void recordPoll(String outcome) {
        registry.counter(PREFIX + "polls", "outcome", outcome).increment();
    }

    public void recordAlertTransition(String type) {
        registry.counter(PREFIX + "alerts", "type", type).increment();
    }

    // ---------------------------------------------------------------
    // Readers (tests and status displays)
    // ---------------------------------------------------------------

    public long getCycleCount() {
        return (long) cycles.count();
    }

    public long getOverrunCount() {
        return (long) overruns.count();
    }

    public long getTimeoutCount() {
        return (long) timeouts.count();
    }

    public long getPollCount(String outcome) {
        Counter counter = registry.find(PREFIX + "polls").tag("outcome", outcome).counter();
        return counter == null ? 0 : (long) counter.count();
    }

    public long getAlertTransitionCount(String type) {
        Counter counter = registry.find(PREFIX + "alerts").tag("type", type).counter();
        return counter == null ? 0 : (long) counter.count();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
