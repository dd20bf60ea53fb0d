package com.hostsentinel.core.detection;

/**
 * Outcome of {@link AnomalyDetector#detect(String, String, double)}.
 *
 * @since 1.0.0
 */
public final class AnomalyResult {

    /** Result used whenever the baseline is not usable. */
    public static final AnomalyResult NORMAL = new AnomalyResult(false, 0.0);

    private final boolean anomalous;
    private final double zScore;

    public AnomalyResult(boolean anomalous, double zScore) {
        this.anomalous = anomalous;
        this.zScore = zScore;
    }

    public boolean isAnomalous() {
        return anomalous;
    }

    /**
     * @return absolute z-score of the tested value, {@code 0.0} when not computed
     */
    public double getZScore() {
        return zScore;
    }

    @Override
    public String toString() {
        return "AnomalyResult{anomalous=" + anomalous + ", zScore=" + zScore + '}';
    }
}
