package com.hostsentinel.monitor.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Synchronous publish/subscribe hub for engine state changes, with a bounded
 * log of the most recent events for late subscribers.
 *
 * <p>
 * A listener that throws is logged and skipped; delivery to the others
 * continues.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitorEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(MonitorEventBus.class);

    public static final int DEFAULT_RECENT_CAPACITY = 500;

    private final List<MonitorEventListener> listeners = new CopyOnWriteArrayList<>();
    private final Deque<MonitorEvent> recent = new ArrayDeque<>();
    private final int recentCapacity;

    public MonitorEventBus() {
        this(DEFAULT_RECENT_CAPACITY);
    }

    public MonitorEventBus(int recentCapacity) {
        if (recentCapacity < 1) {
            throw new IllegalArgumentException("recentCapacity must be >= 1, got: " + recentCapacity);
        }
        this.recentCapacity = recentCapacity;
    }

    /**
     * Register a listener.
     *
     * @return handle that removes the listener when closed
     */
    public AutoCloseable subscribe(MonitorEventListener listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void unsubscribe(MonitorEventListener listener) {
        listeners.remove(listener);
    }

    public void publish(MonitorEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        synchronized (recent) {
            if (recent.size() >= recentCapacity) {
                recent.pollFirst();
            }
            recent.addLast(event);
        }
        for (MonitorEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                LOG.error("Event listener {} failed on {}: {}", listener, event.getType(), e.getMessage(), e);
            }
        }
    }

    /**
     * @return the retained events, oldest first
     */
    public List<MonitorEvent> recentEvents() {
        synchronized (recent) {
            return new ArrayList<>(recent);
        }
    }

    public int getListenerCount() {
        return listeners.size();
    }

    public int getRecentCapacity() {
        return recentCapacity;
    }
}
