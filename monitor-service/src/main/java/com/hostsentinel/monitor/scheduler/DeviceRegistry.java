package com.hostsentinel.monitor.scheduler;

import com.hostsentinel.core.model.Device;
import com.hostsentinel.core.model.DeviceStatus;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Devices known to the engine, keyed by id, plus the per-cycle selection of
 * devices to poll.
 *
 * @since 1.0.0
 */
public class DeviceRegistry {

    private final Map<String, Device> devices = new ConcurrentHashMap<>();
    private final AtomicInteger cursor = new AtomicInteger();

    /**
     * Add or replace a device.
     *
     * @return the previously registered device with the same id, if any
     */
    public Optional<Device> register(Device device) {
        Objects.requireNonNull(device, "device must not be null");
        return Optional.ofNullable(devices.put(device.getId(), device));
    }

    public Optional<Device> remove(String deviceId) {
        return Optional.ofNullable(devices.remove(deviceId));
    }

    public Optional<Device> get(String deviceId) {
        return Optional.ofNullable(devices.get(deviceId));
    }

    public Collection<Device> all() {
        return List.copyOf(devices.values());
    }

    public int size() {
        return devices.size();
    }

    /**
     * A device is polled when monitoring is enabled and it is online, or, with
     * {@code retryFailed}, when its last connection failed. {@code UNKNOWN}
     * devices are never polled.
     */
    public static boolean isEligible(Device device, boolean retryFailed) {
        if (!device.isMonitoringEnabled()) {
            return false;
        }
        DeviceStatus status = device.getStatus();
        return status == DeviceStatus.ONLINE
                || (retryFailed && status == DeviceStatus.CONNECTION_FAILED);
    }

    /**
     * Pick at most {@code limit} eligible devices for the next cycle.
     *
     * <p>
     * Eligible devices are ordered by id. When there are more than
     * {@code limit}, a cursor advanced by {@code limit} on every call selects
     * a different window each cycle, wrapping around, so every eligible
     * device is polled within {@code ceil(eligible / limit)} cycles.
     * </p>
     */
    public List<Device> selectEligible(int limit, boolean retryFailed) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got: " + limit);
        }
        List<Device> eligible = devices.values().stream()
                .filter(d -> isEligible(d, retryFailed))
                .sorted(Comparator.comparing(Device::getId))
                .toList();
        int count = eligible.size();
        if (count <= limit) {
            return eligible;
        }
        int start = Math.floorMod(cursor.getAndAdd(limit), count);
        List<Device> window = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            window.add(eligible.get((start + i) % count));
        }
        return window;
    }
}
