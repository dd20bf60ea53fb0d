package com.hostsentinel.core.detection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Z-score anomaly detector over per-(entity, metric) rolling baselines.
 *
 * <p>
 * Each baseline is a sliding window of the last <i>N</i> observations. A value
 * is anomalous when its distance from the window mean exceeds
 * {@code zScoreThreshold} population standard deviations. Statistics are
 * recomputed from the window on every call.
 * </p>
 *
 * <h3>Warm-up</h3>
 * <p>
 * Detection only engages once a window holds at least
 * {@value #MIN_SAMPLES} observations. Windows whose standard deviation is at
 * most {@value #STDDEV_EPSILON} never report anomalies.
 * </p>
 *
 * <h3>Ordering</h3>
 * <p>
 * {@link #detect} reads the window as it is; it does not add the tested value.
 * Callers that want the observation reflected in its own baseline call
 * {@link #updateBaseline} first.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Windows live in concurrent maps, grouped by entity and then by metric, and
 * each window is guarded by its own monitor, so different pairs never
 * contend.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyDetector.class);

    /** Minimum number of observations required before detection begins. */
    public static final int MIN_SAMPLES = 20;

    /** Minimum number of observations for {@link #baselineStats}. */
    public static final int MIN_STATS_SAMPLES = 10;

    /** Standard deviations at or below this are treated as zero. */
    public static final double STDDEV_EPSILON = 0.001;

    public static final int DEFAULT_WINDOW_SIZE = 100;
    public static final double DEFAULT_Z_SCORE_THRESHOLD = 2.5;

    private final Map<String, Map<String, Window>> baselines = new ConcurrentHashMap<>();
    private final int windowSize;
    private final double zScoreThreshold;

    public AnomalyDetector() {
        this(DEFAULT_WINDOW_SIZE, DEFAULT_Z_SCORE_THRESHOLD);
    }

    /**
     * @param windowSize      observations kept per baseline; must be &gt; 0
     * @param zScoreThreshold z-score above which a value is anomalous; must be
     *                        &gt; 0
     * @throws IllegalArgumentException if either argument is out of range
     */
    public AnomalyDetector(int windowSize, double zScoreThreshold) {
        if (windowSize <= 0) {
            throw new IllegalArgumentException("windowSize must be > 0, got: " + windowSize);
        }
        if (!(zScoreThreshold > 0)) {
            throw new IllegalArgumentException("zScoreThreshold must be > 0, got: " + zScoreThreshold);
        }
        this.windowSize = windowSize;
        this.zScoreThreshold = zScoreThreshold;
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Append an observation to the baseline, evicting the oldest one past the
     * window size.
     *
     * @param entityId device identity
     * @param metric   metric name
     * @param value    observed value
     */
    public void updateBaseline(String entityId, String metric, double value) {
        Objects.requireNonNull(entityId, "entityId must not be null");
        Objects.requireNonNull(metric, "metric must not be null");
        baselines.computeIfAbsent(entityId, k -> new ConcurrentHashMap<>())
                .computeIfAbsent(metric, k -> new Window(windowSize))
                .add(value);
    }

    /**
     * Score {@code value} against the current baseline.
     *
     * @param entityId device identity
     * @param metric   metric name
     * @param value    value to score
     * @return {@link AnomalyResult#NORMAL} while the baseline is too small or
     *         flat, otherwise the anomaly flag and absolute z-score
     */
    public AnomalyResult detect(String entityId, String metric, double value) {
        Window window = window(entityId, metric);
        if (window == null) {
            return AnomalyResult.NORMAL;
        }
        double[] data = window.snapshot();
        if (data.length < MIN_SAMPLES) {
            return AnomalyResult.NORMAL;
        }

        double mean = computeMean(data);
        double stddev = computeStdDev(data, mean);
        if (stddev <= STDDEV_EPSILON) {
            return AnomalyResult.NORMAL;
        }

        double zScore = Math.abs(value - mean) / stddev;
        boolean anomalous = zScore > zScoreThreshold;
        if (anomalous) {
            LOG.debug("Anomaly on [{}/{}]: value={} mean={} stddev={} z={}",
                    entityId, metric, value, mean, stddev, zScore);
        }
        return new AnomalyResult(anomalous, zScore);
    }

    /**
     * @param entityId device identity
     * @param metric   metric name
     * @return baseline statistics, or empty with fewer than
     *         {@value #MIN_STATS_SAMPLES} observations
     */
    public Optional<BaselineStats> baselineStats(String entityId, String metric) {
        Window window = window(entityId, metric);
        if (window == null) {
            return Optional.empty();
        }
        double[] data = window.snapshot();
        if (data.length < MIN_STATS_SAMPLES) {
            return Optional.empty();
        }
        double mean = computeMean(data);
        double variance = computeVariance(data, mean);
        return Optional.of(new BaselineStats(mean, Math.sqrt(variance), variance, data.length));
    }

    /**
     * @return number of observations currently held for the pair
     */
    public int sampleCount(String entityId, String metric) {
        Window window = window(entityId, metric);
        return window == null ? 0 : window.size();
    }

    /**
     * Drop every baseline belonging to {@code entityId}. Other entities are
     * untouched even when their id starts with this one.
     *
     * @param entityId device identity
     * @return number of metric baselines dropped
     */
    public int reset(String entityId) {
        Objects.requireNonNull(entityId, "entityId must not be null");
        Map<String, Window> removed = baselines.remove(entityId);
        int count = removed == null ? 0 : removed.size();
        if (count > 0) {
            LOG.debug("Dropped {} baseline(s) of {}", count, entityId);
        }
        return count;
    }

    /**
     * @return number of entities with at least one baseline
     */
    public int trackedEntityCount() {
        return baselines.size();
    }

    public int getWindowSize() {
        return windowSize;
    }

    public double getZScoreThreshold() {
        return zScoreThreshold;
    }

    // ---------------------------------------------------------------
    // Statistics helpers
    // ---------------------------------------------------------------

    private Window window(String entityId, String metric) {
        Objects.requireNonNull(entityId, "entityId must not be null");
        Objects.requireNonNull(metric, "metric must not be null");
        Map<String, Window> windows = baselines.get(entityId);
        return windows == null ? null : windows.get(metric);
    }

    private static double computeMean(double[] data) {
        double sum = 0;
        for (double v : data) {
            sum += v;
        }
        return sum / data.length;
    }

    private static double computeVariance(double[] data, double mean) {
        double sumSquaredDiff = 0;
        for (double v : data) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return sumSquaredDiff / data.length;
    }

    private static double computeStdDev(double[] data, double mean) {
        return Math.sqrt(computeVariance(data, mean));
    }

    /** Bounded FIFO of observations for one key. */
    private static final class Window {
        private final int capacity;
        private final Deque<Double> values = new ArrayDeque<>();

        private Window(int capacity) {
            this.capacity = capacity;
        }

        private synchronized void add(double value) {
            values.addLast(value);
            if (values.size() > capacity) {
                values.pollFirst();
            }
        }

        private synchronized double[] snapshot() {
            double[] data = new double[values.size()];
            int i = 0;
            for (double v : values) {
                data[i++] = v;
            }
            return data;
        }

        private synchronized int size() {
            return values.size();
        }
    }
}
