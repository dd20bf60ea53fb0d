package com.hostsentinel.monitor;

import com.hostsentinel.core.model.Device;
import com.hostsentinel.monitor.telemetry.ConnectionException;
import com.hostsentinel.monitor.telemetry.TelemetryException;
import com.hostsentinel.monitor.telemetry.TelemetryProvider;
import com.hostsentinel.monitor.telemetry.TelemetrySnapshot;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable in-memory provider. Devices are reachable and report
 * cpu 10 / memory 20 / disk 30 unless told otherwise.
 */
public class FakeTelemetryProvider implements TelemetryProvider {

    private final Set<String> unreachable = ConcurrentHashMap.newKeySet();
    private final Set<String> failingFetch = ConcurrentHashMap.newKeySet();
    private final Map<String, Deque<TelemetrySnapshot>> scripted = new ConcurrentHashMap<>();
    private final Map<String, Duration> delays = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> connects = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> fetches = new ConcurrentHashMap<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();

    @Override
    public boolean connect(Device device) throws TelemetryException {
        connects.computeIfAbsent(device.getId(), k -> new AtomicInteger()).incrementAndGet();
        if (unreachable.contains(device.getId())) {
            throw new ConnectionException(device.getId(), "connection refused");
        }
        return true;
    }

    @Override
    public TelemetrySnapshot fetchMetrics(Device device) throws TelemetryException {
        int current = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(current, Math::max);
        try {
            fetches.computeIfAbsent(device.getId(), k -> new AtomicInteger()).incrementAndGet();
            Duration delay = delays.get(device.getId());
            if (delay != null) {
                try {
                    Thread.sleep(delay.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new TelemetryException(device.getId(), "interrupted", e);
                }
            }
            if (failingFetch.contains(device.getId())) {
                throw new TelemetryException(device.getId(), "metrics command failed");
            }
            Deque<TelemetrySnapshot> queue = scripted.get(device.getId());
            if (queue != null) {
                synchronized (queue) {
                    if (queue.size() > 1) {
                        return queue.pollFirst();
                    }
                    if (!queue.isEmpty()) {
                        return queue.peekFirst();
                    }
                }
            }
            return snapshot(10, 20, 30);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    // ------------------------------------------------------------------
    // Scripting
    // ------------------------------------------------------------------

    public FakeTelemetryProvider unreachable(String deviceId) {
        unreachable.add(deviceId);
        return this;
    }

    public FakeTelemetryProvider reachable(String deviceId) {
        unreachable.remove(deviceId);
        return this;
    }

    public FakeTelemetryProvider failFetch(String deviceId) {
        failingFetch.add(deviceId);
        return this;
    }

    /** Queue snapshots for a device; the last one repeats. */
    public FakeTelemetryProvider script(String deviceId, TelemetrySnapshot... snapshots) {
        Deque<TelemetrySnapshot> queue = scripted.computeIfAbsent(deviceId, k -> new ArrayDeque<>());
        synchronized (queue) {
            for (TelemetrySnapshot snapshot : snapshots) {
                queue.addLast(snapshot);
            }
        }
        return this;
    }

    public FakeTelemetryProvider delay(String deviceId, Duration delay) {
        delays.put(deviceId, delay);
        return this;
    }

    // ------------------------------------------------------------------
    // Inspection
    // ------------------------------------------------------------------

    public int connectCount(String deviceId) {
        AtomicInteger count = connects.get(deviceId);
        return count == null ? 0 : count.get();
    }

    public int fetchCount(String deviceId) {
        AtomicInteger count = fetches.get(deviceId);
        return count == null ? 0 : count.get();
    }

    public int maxConcurrentFetches() {
        return maxInFlight.get();
    }

    public static TelemetrySnapshot snapshot(double cpu, double memory, double disk) {
        return TelemetrySnapshot.builder().cpu(cpu).memory(memory).disk(disk).build();
    }
}
