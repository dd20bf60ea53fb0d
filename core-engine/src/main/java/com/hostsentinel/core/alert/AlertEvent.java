package com.hostsentinel.core.alert;

import com.hostsentinel.core.model.Alert;
import com.hostsentinel.core.model.AlertLevel;

import java.util.Objects;
import java.util.Optional;

/**
 * Alert state change. Carries a snapshot of the alert after the change.
 *
 * @since 1.0.0
 */
public final class AlertEvent {

    private final AlertEventType type;
    private final Alert alert;
    private final AlertLevel previousLevel;

    /**
     * @param type          change kind
     * @param alert         alert state after the change (copied)
     * @param previousLevel level before the change, {@code null} for new alerts
     */
    public AlertEvent(AlertEventType type, Alert alert, AlertLevel previousLevel) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.alert = Objects.requireNonNull(alert, "alert must not be null").copy();
        this.previousLevel = previousLevel;
    }

    public AlertEventType getType() {
        return type;
    }

    /**
     * @return a copy of the alert snapshot
     */
    public Alert getAlert() {
        return alert.copy();
    }

    public String getAlertId() {
        return alert.getId();
    }

    public Optional<AlertLevel> getPreviousLevel() {
        return Optional.ofNullable(previousLevel);
    }

    @Override
    public String toString() {
        return "AlertEvent{type=" + type + ", alert=" + alert + ", previousLevel=" + previousLevel + '}';
    }
}
