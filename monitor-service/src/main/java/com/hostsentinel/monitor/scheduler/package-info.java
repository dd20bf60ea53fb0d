/**
 * The monitoring loop: device selection, bounded concurrent polling with
 * per-task deadlines, and the single-device poll pass.
 *
 * @since 1.0.0
 */
package com.hostsentinel.monitor.scheduler;
