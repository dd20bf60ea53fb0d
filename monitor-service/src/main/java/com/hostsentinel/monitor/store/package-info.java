/**
 * SQLite persistence: a fixed JDBC connection pool with a degraded fallback,
 * and the store for devices, metric rows and alerts.
 *
 * @since 1.0.0
 */
package com.hostsentinel.monitor.store;
