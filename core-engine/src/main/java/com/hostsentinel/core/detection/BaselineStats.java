package com.hostsentinel.core.detection;

/**
 * Summary statistics of one baseline window.
 *
 * @since 1.0.0
 */
public final class BaselineStats {

    private final double mean;
    private final double stdDev;
    private final double variance;
    private final int sampleCount;

    public BaselineStats(double mean, double stdDev, double variance, int sampleCount) {
        this.mean = mean;
        this.stdDev = stdDev;
        this.variance = variance;
        this.sampleCount = sampleCount;
    }

    public double getMean() {
        return mean;
    }

    public double getStdDev() {
        return stdDev;
    }

    public double getVariance() {
        return variance;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    @Override
    public String toString() {
        return "BaselineStats{" +
                "mean=" + mean +
                ", stdDev=" + stdDev +
                ", variance=" + variance +
                ", sampleCount=" + sampleCount +
                '}';
    }
}
