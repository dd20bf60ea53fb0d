package com.hostsentinel.core.alert;

/**
 * Receives alert state changes from {@link AlertManager}.
 *
 * <p>
 * Called synchronously on the thread that evaluated the metric, after the
 * alert map has been updated. Implementations should return quickly.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface AlertListener {

    void onAlertEvent(AlertEvent event);
}
