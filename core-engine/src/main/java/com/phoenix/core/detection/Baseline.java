package com.phoenix.core.detection;

import java.util.Objects;

/**
 * Snapshot of a signal's learned normal range.
 *
 * @since 1.0.0
 */
public final class Baseline {

    private final double mean;
    private final double stdDev;
    private final long sampleCount;

    public Baseline(double mean, double stdDev, long sampleCount) {
        this.mean = mean;
        this.stdDev = stdDev;
        this.sampleCount = sampleCount;
    }

    public double getMean() {
        return mean;
    }

    /**
     * @return sample standard deviation, {@code sqrt(m2 / (count - 1))}
     */
    public double getStdDev() {
        return stdDev;
    }

    public long getSampleCount() {
        return sampleCount;
    }

    /**
     * @return {@code true} for a flat signal that cannot be scored
     */
    public boolean isDegenerate() {
        return stdDev == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Baseline that))
            return false;
        return Double.compare(mean, that.mean) == 0
                && Double.compare(stdDev, that.stdDev) == 0
                && sampleCount == that.sampleCount;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mean, stdDev, sampleCount);
    }

    @Override
    public String toString() {
        return "Baseline{mean=" + mean + ", stdDev=" + stdDev + ", samples=" + sampleCount + '}';
    }
}
