/**
 * In-memory TTL cache used to memoise expensive telemetry lookups.
 *
 * @since 1.0.0
 */
package com.hostsentinel.core.cache;
