/**
 * Micrometer instrumentation of the monitoring loop.
 *
 * @since 1.0.0
 */
package com.hostsentinel.monitor.metrics;
