package com.phoenix.core.detection;

import com.phoenix.core.model.Deviation;
import com.phoenix.core.model.DeviationLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Scores an observed value against its signal's learned baseline.
 *
 * <p>
 * The score is a z-score, {@code |value - mean| / stdDev}. Classification
 * uses the unrounded score, first match wins:
 * </p>
 * <ul>
 * <li>{@code score >= strongThreshold}: {@link DeviationLevel#STRONG}</li>
 * <li>{@code score >= }{@value #MILD_THRESHOLD}: {@link DeviationLevel#MILD}</li>
 * <li>otherwise {@link DeviationLevel#NORMAL}</li>
 * </ul>
 *
 * <p>
 * Nothing is produced while the baseline is still warming up or when the
 * signal has been perfectly flat ({@code stdDev == 0}).
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * Stateless across calls; reads the learner's current snapshot.
 * </p>
 *
 * @since 1.0.0
 */
public class DeviationDetector {

    private static final Logger LOG = LoggerFactory.getLogger(DeviationDetector.class);

    /** Score at or above which a reading is at least mild. */
    public static final double MILD_THRESHOLD = 2.0;

    private static final int DISPLAY_SCALE = 3;

    private final BaselineLearner baselineLearner;
    private final double strongThreshold;
    private final Clock clock;

    /**
     * @param baselineLearner source of baselines
     * @param strongThreshold z-score at or above which a reading is strong
     * @param clock           time source for deviation timestamps
     * @throws IllegalArgumentException if {@code strongThreshold} is not positive
     */
    public DeviationDetector(BaselineLearner baselineLearner, double strongThreshold, Clock clock) {
        this.baselineLearner = Objects.requireNonNull(baselineLearner, "baselineLearner must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (!(strongThreshold > 0)) {
            throw new IllegalArgumentException("strongThreshold must be > 0, got: " + strongThreshold);
        }
        this.strongThreshold = strongThreshold;
    }

    /**
     * Evaluate one value against its baseline.
     *
     * @param component component id
     * @param metric    metric name
     * @param value     observed value
     * @return the scored deviation, or empty if the baseline is not ready or flat
     */
    public Optional<Deviation> evaluate(String component, String metric, double value) {
        if (!baselineLearner.isReady(component, metric)) {
            LOG.trace("Baseline for {}/{} not ready, skipping", component, metric);
            return Optional.empty();
        }

        Baseline baseline = baselineLearner.getBaseline(component, metric);
        if (baseline.isDegenerate()) {
            LOG.trace("Flat signal {}/{} (stdDev=0), skipping", component, metric);
            return Optional.empty();
        }

        double score = Math.abs(value - baseline.getMean()) / baseline.getStdDev();
        DeviationLevel level = classify(score);

        if (level != DeviationLevel.NORMAL) {
            LOG.debug("{} deviation on {}/{}: value={} mean={} stdDev={} score={}",
                    level, component, metric, value, baseline.getMean(), baseline.getStdDev(), score);
        }

        return Optional.of(Deviation.builder()
                .component(component)
                .metric(metric)
                .value(value)
                .mean(round(baseline.getMean()))
                .stdDev(round(baseline.getStdDev()))
                .deviationScore(round(score))
                .level(level)
                .timestamp(clock.instant())
                .build());
    }

    DeviationLevel classify(double score) {
        if (score >= strongThreshold) {
            return DeviationLevel.STRONG;
        }
        if (score >= MILD_THRESHOLD) {
            return DeviationLevel.MILD;
        }
        return DeviationLevel.NORMAL;
    }

    static double round(double v) {
        if (Double.isNaN(v) || Double.isInfinite(v)) {
            return v;
        }
        return new BigDecimal(v).setScale(DISPLAY_SCALE, RoundingMode.HALF_EVEN).doubleValue();
    }
}
