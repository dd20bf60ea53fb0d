package com.hostsentinel.core.alert;

import com.hostsentinel.core.model.Alert;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Bounded FIFO archive of resolved alert snapshots.
 *
 * <p>
 * Once {@code capacity} entries are held, archiving another one drops the
 * oldest. Snapshots are copied on the way in and on the way out.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertHistory {

    public static final int DEFAULT_CAPACITY = 1000;

    private final int capacity;
    private final Deque<Alert> entries = new ArrayDeque<>();

    public AlertHistory() {
        this(DEFAULT_CAPACITY);
    }

    public AlertHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * @param alert resolved alert to archive
     */
    public synchronized void archive(Alert alert) {
        Objects.requireNonNull(alert, "alert must not be null");
        entries.addLast(alert.copy());
        while (entries.size() > capacity) {
            entries.pollFirst();
        }
    }

    /**
     * @return archived alerts, oldest first
     */
    public synchronized List<Alert> snapshot() {
        return entries.stream().map(Alert::copy).toList();
    }

    /**
     * @param deviceId device identity
     * @return archived alerts of one device, oldest first
     */
    public synchronized List<Alert> forDevice(String deviceId) {
        return entries.stream()
                .filter(a -> a.getDeviceId().equals(deviceId))
                .map(Alert::copy)
                .toList();
    }

    /**
     * Drop entries stamped before {@code olderThan}.
     *
     * @return number of entries removed
     */
    public synchronized int prune(Instant olderThan) {
        int removed = 0;
        for (Iterator<Alert> it = entries.iterator(); it.hasNext();) {
            if (it.next().getTimestamp().isBefore(olderThan)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    public synchronized int size() {
        return entries.size();
    }

    public int getCapacity() {
        return capacity;
    }
}
