package com.hostsentinel.core.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Capacity-bounded cache with per-entry time-to-live.
 *
 * <h3>Expiry</h3>
 * <p>
 * There is no background sweep. An expired entry is removed when it is read,
 * or by {@link #cleanupExpired()}, which {@link #put} runs before evicting
 * for capacity.
 * </p>
 *
 * <h3>Eviction</h3>
 * <p>
 * When the cache is full after the expiry pass, the entry with the earliest
 * expiry time is evicted. With a uniform TTL this is the oldest insertion.
 * New keys are inserted under a single eviction lock, so the size never
 * exceeds the capacity; replacing the value of a present key does not take
 * the lock.
 * </p>
 *
 * @param <K> key type
 * @param <V> value type
 * @since 1.0.0
 */
public class TelemetryCache<K, V> {

    private static final Logger LOG = LoggerFactory.getLogger(TelemetryCache.class);

    /** Default capacity of a cache built without an explicit size. */
    public static final int DEFAULT_CAPACITY = 1000;

    private final Map<K, Entry<V>> entries = new ConcurrentHashMap<>();
    private final Object evictionLock = new Object();
    private final int capacity;
    private final Duration defaultTtl;
    private final Clock clock;

    public TelemetryCache(Duration defaultTtl) {
        this(DEFAULT_CAPACITY, defaultTtl, Clock.systemUTC());
    }

    /**
     * @param capacity   maximum number of entries; must be &gt; 0
     * @param defaultTtl TTL used by {@link #put(Object, Object)}
     * @param clock      time source for expiry checks
     * @throws IllegalArgumentException if {@code capacity} is not positive or the
     *                                  TTL is negative
     */
    public TelemetryCache(int capacity, Duration defaultTtl, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        Objects.requireNonNull(defaultTtl, "defaultTtl must not be null");
        if (defaultTtl.isNegative()) {
            throw new IllegalArgumentException("defaultTtl must not be negative, got: " + defaultTtl);
        }
        this.capacity = capacity;
        this.defaultTtl = defaultTtl;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Look up a live entry. An expired entry is removed and reported as absent.
     *
     * @param key cache key
     * @return the cached value, or empty if absent or expired
     */
    public Optional<V> get(K key) {
        Entry<V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isLive(clock.instant())) {
            return Optional.of(entry.value);
        }
        // Only drop the instance we saw; a concurrent put may have replaced it.
        entries.remove(key, entry);
        return Optional.empty();
    }

    /**
     * Store a value with the default TTL.
     */
    public void put(K key, V value) {
        put(key, value, defaultTtl);
    }

    /**
     * Store a value, evicting one entry first if the cache is full.
     *
     * @param key   cache key; must not be {@code null}
     * @param value value; must not be {@code null}
     * @param ttl   time-to-live; must not be negative
     */
    public void put(K key, V value, Duration ttl) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(ttl, "ttl must not be null");
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must not be negative, got: " + ttl);
        }

        Entry<V> entry = new Entry<>(value, clock.instant().plus(ttl));
        if (entries.computeIfPresent(key, (k, previous) -> entry) != null) {
            return;
        }
        synchronized (evictionLock) {
            if (!entries.containsKey(key)) {
                if (entries.size() >= capacity) {
                    cleanupExpired();
                }
                if (entries.size() >= capacity) {
                    evictSoonestExpiring();
                }
            }
            entries.put(key, entry);
        }
    }

    /**
     * @param key cache key
     * @return {@code true} if an entry was removed
     */
    public boolean invalidate(K key) {
        return entries.remove(key) != null;
    }

    /**
     * Remove every expired entry.
     *
     * @return number of entries removed
     */
    public int cleanupExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Iterator<Map.Entry<K, Entry<V>>> it = entries.entrySet().iterator(); it.hasNext();) {
            if (!it.next().getValue().isLive(now)) {
                it.remove();
                removed++;
            }
        }
        if (removed > 0) {
            LOG.debug("Removed {} expired cache entr{}", removed, removed == 1 ? "y" : "ies");
        }
        return removed;
    }

    public void clear() {
        entries.clear();
    }

    /**
     * @return number of stored entries, including expired ones not yet reclaimed
     */
    public int size() {
        return entries.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void evictSoonestExpiring() {
        K victim = null;
        Instant earliest = null;
        for (Map.Entry<K, Entry<V>> e : entries.entrySet()) {
            Instant expiresAt = e.getValue().expiresAt;
            if (earliest == null || expiresAt.isBefore(earliest)) {
                earliest = expiresAt;
                victim = e.getKey();
            }
        }
        if (victim != null) {
            entries.remove(victim);
            LOG.trace("Cache full ({}), evicted key {}", capacity, victim);
        }
    }

    private static final class Entry<V> {
        private final V value;
        private final Instant expiresAt;

        private Entry(V value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        private boolean isLive(Instant now) {
            return now.isBefore(expiresAt);
        }
    }
}
