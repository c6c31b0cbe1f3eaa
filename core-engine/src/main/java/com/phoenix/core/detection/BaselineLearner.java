package com.phoenix.core.detection;

import com.phoenix.core.model.SignalKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Learns what "normal" looks like for every {@code (component, metric)}
 * signal from live values.
 *
 * <p>
 * Keeps count, mean and variance per signal using Welford's online
 * algorithm: single pass, O(1) per update, numerically stable, no stored
 * history. A baseline becomes usable once {@code minSamples} values have
 * been seen.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * One record is created lazily per signal and kept for the lifetime of the
 * learner; records are never pruned, so memory grows with the number of
 * distinct signals seen. {@link #trackedSignals()} reports that number.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Updates to the same signal are serialized through
 * {@link ConcurrentHashMap#compute}. Reads of a record that is being
 * updated concurrently are not guaranteed to see a consistent snapshot.
 * </p>
 *
 * @since 1.0.0
 */
public class BaselineLearner {

    private static final Logger LOG = LoggerFactory.getLogger(BaselineLearner.class);

    private final int minSamples;
    private final Map<SignalKey, BaselineRecord> stats = new ConcurrentHashMap<>();

    /**
     * @param minSamples observations required before a baseline is trusted
     * @throws IllegalArgumentException if {@code minSamples < 2}
     */
    public BaselineLearner(int minSamples) {
        if (minSamples < 2) {
            throw new IllegalArgumentException("minSamples must be >= 2, got: " + minSamples);
        }
        this.minSamples = minSamples;
    }

    /**
     * Fold one observed value into the signal's statistics.
     *
     * @param component component id
     * @param metric    metric name
     * @param value     observed value
     * @throws IllegalArgumentException if {@code value} is NaN or infinite
     */
    public void update(String component, String metric, double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(
                    "Value for " + component + "/" + metric + " must be finite, got: " + value);
        }
        SignalKey key = SignalKey.of(component, metric);
        BaselineRecord updated = stats.compute(key, (k, record) -> {
            BaselineRecord r = record != null ? record : new BaselineRecord();
            r.add(value);
            return r;
        });
        if (updated.count() == minSamples) {
            LOG.info("Baseline ready for {}: mean={} after {} samples",
                    key, updated.mean(), minSamples);
        }
    }

    /**
     * @param component component id
     * @param metric    metric name
     * @return {@code true} once at least {@code minSamples} values have been seen
     */
    public boolean isReady(String component, String metric) {
        BaselineRecord record = stats.get(SignalKey.of(component, metric));
        return record != null && record.count() >= minSamples;
    }

    /**
     * @param component component id
     * @param metric    metric name
     * @return the learned mean and sample standard deviation
     * @throws BaselineNotReadyException if fewer than {@code minSamples} values were seen
     */
    public Baseline getBaseline(String component, String metric) {
        SignalKey key = SignalKey.of(component, metric);
        BaselineRecord record = stats.get(key);
        long count = record != null ? record.count() : 0;
        if (count < minSamples) {
            throw new BaselineNotReadyException(key, count, minSamples);
        }
        return new Baseline(record.mean(), Math.sqrt(record.sampleVariance()), count);
    }

    /**
     * @param component component id
     * @param metric    metric name
     * @return number of values seen for the signal, {@code 0} if unknown
     */
    public long sampleCount(String component, String metric) {
        BaselineRecord record = stats.get(SignalKey.of(component, metric));
        return record != null ? record.count() : 0;
    }

    /**
     * @return number of distinct signals with statistics
     */
    public int trackedSignals() {
        return stats.size();
    }
}
