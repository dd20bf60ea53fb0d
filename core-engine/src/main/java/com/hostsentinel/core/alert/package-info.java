/**
 * Alert lifecycle: classification, deduplication, resolution and archiving.
 *
 * <p>
 * {@link com.hostsentinel.core.alert.AlertManager} owns the one-alert-per
 * device/metric map and notifies
 * {@link com.hostsentinel.core.alert.AlertListener}s of every state change.
 * </p>
 *
 * @since 1.0.0
 */
package com.hostsentinel.core.alert;
