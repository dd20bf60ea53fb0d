package com.hostsentinel.core.model;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Bounded FIFO of {@link MetricSample}s for one metric of one device.
 *
 * <p>
 * When the capacity is reached the oldest sample is dropped. All methods are
 * synchronized on the instance, so a history may be read by presentation code
 * while the poller appends to it.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricHistory {

    /** Default number of samples retained per metric. */
    public static final int DEFAULT_CAPACITY = 100;

    private final int capacity;
    private final Deque<MetricSample> samples;

    public MetricHistory() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * @param capacity maximum number of retained samples; must be &gt; 0
     * @throws IllegalArgumentException if {@code capacity} is not positive
     */
    public MetricHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        this.capacity = capacity;
        this.samples = new ArrayDeque<>(Math.min(capacity, 256));
    }

    /**
     * Append a sample, evicting the oldest one past capacity.
     *
     * @param sample the sample to append
     */
    public synchronized void add(MetricSample sample) {
        samples.addLast(sample);
        while (samples.size() > capacity) {
            samples.pollFirst();
        }
    }

    public synchronized Optional<MetricSample> latest() {
        return Optional.ofNullable(samples.peekLast());
    }

    /**
     * @return copy of the retained samples, oldest first
     */
    public synchronized List<MetricSample> snapshot() {
        return List.copyOf(samples);
    }

    public synchronized int size() {
        return samples.size();
    }

    public int getCapacity() {
        return capacity;
    }
}
