package com.hostsentinel.monitor.event;

/**
 * Subscriber to the {@link MonitorEventBus}. Called on the publishing thread,
 * which is a poller or the scheduler thread; implementations must return
 * quickly.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface MonitorEventListener {

    void onEvent(MonitorEvent event);
}
