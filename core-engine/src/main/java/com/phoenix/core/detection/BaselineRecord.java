package com.phoenix.core.detection;

/**
 * Running statistics of one signal: count, mean and the Welford {@code m2}
 * accumulator (sum of squared differences from the current mean).
 *
 * <p>
 * Instances are mutated only by {@link BaselineLearner} inside a per-key
 * atomic section. No observation history is stored.
 * </p>
 */
final class BaselineRecord {

    private long count;
    private double mean;
    private double m2;

    /**
     * Fold one value into the statistics using Welford's recurrence.
     *
     * @param value the observed value
     */
    void add(double value) {
        count++;
        double delta = value - mean;
        mean += delta / count;
        double delta2 = value - mean;
        m2 += delta * delta2;
    }

    long count() {
        return count;
    }

    double mean() {
        return mean;
    }

    /**
     * @return Bessel-corrected sample variance; requires {@code count >= 2}
     */
    double sampleVariance() {
        return m2 / (count - 1);
    }
}
