package com.phoenix.core.detection;

import com.phoenix.core.model.Deviation;
import com.phoenix.core.model.DeviationLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DeviationDetector}.
 *
 * <p>
 * The baseline 9, 10, 11 has mean 10 and sample standard deviation exactly 1,
 * so the score of a value {@code v} is {@code |v - 10|}.
 * </p>
 */
class DeviationDetectorTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private BaselineLearner learner;
    private DeviationDetector detector;

    @BeforeEach
    void setUp() {
        learner = new BaselineLearner(3);
        detector = new DeviationDetector(learner, 3.0, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should return empty while the baseline is not ready")
    void shouldSkipWhenNotReady() {
        learner.update("api-gateway", "error_rate", 9);
        learner.update("api-gateway", "error_rate", 11);

        assertThat(detector.evaluate("api-gateway", "error_rate", 500)).isEmpty();
    }

    @Test
    @DisplayName("Should return empty for a flat signal even when ready")
    void shouldSkipFlatSignal() {
        for (int i = 0; i < 3; i++) {
            learner.update("api-gateway", "error_rate", 5.0);
        }

        assertThat(detector.evaluate("api-gateway", "error_rate", 50.0)).isEmpty();
    }

    @Test
    @DisplayName("Score of exactly the z-threshold should be strong")
    void scoreAtThresholdShouldBeStrong() {
        seedUnitBaseline();

        Optional<Deviation> deviation = detector.evaluate("api-gateway", "latency_ms", 13.0);

        assertThat(deviation).isPresent();
        assertThat(deviation.get().getLevel()).isEqualTo(DeviationLevel.STRONG);
        assertThat(deviation.get().getDeviationScore()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Score of exactly 2.0 should be mild")
    void scoreOfTwoShouldBeMild() {
        seedUnitBaseline();

        assertThat(detector.evaluate("api-gateway", "latency_ms", 8.0))
                .get()
                .extracting(Deviation::getLevel)
                .isEqualTo(DeviationLevel.MILD);
    }

    @Test
    @DisplayName("Score just below 2.0 should be normal but still reported")
    void scoreBelowTwoShouldBeNormal() {
        seedUnitBaseline();

        Optional<Deviation> deviation = detector.evaluate("api-gateway", "latency_ms", 11.999);

        assertThat(deviation).isPresent();
        assertThat(deviation.get().getLevel()).isEqualTo(DeviationLevel.NORMAL);
    }

    @Test
    @DisplayName("Classification should use the unrounded score")
    void classificationShouldUseUnroundedScore() {
        seedUnitBaseline();

        // 2.9996 rounds to 3.0 for display but is not strong
        Deviation deviation = detector.evaluate("api-gateway", "latency_ms", 12.9996).orElseThrow();

        assertThat(deviation.getDeviationScore()).isEqualTo(3.0);
        assertThat(deviation.getLevel()).isEqualTo(DeviationLevel.MILD);
    }

    @Test
    @DisplayName("Deviation should carry rounded baseline figures and the clock time")
    void deviationShouldCarryContext() {
        learner.update("order-service", "p95_latency_ms", 1.0);
        learner.update("order-service", "p95_latency_ms", 2.0);
        learner.update("order-service", "p95_latency_ms", 2.0);

        Deviation deviation = detector.evaluate("order-service", "p95_latency_ms", 10.0).orElseThrow();

        assertThat(deviation.getComponent()).isEqualTo("order-service");
        assertThat(deviation.getMetric()).isEqualTo("p95_latency_ms");
        assertThat(deviation.getValue()).isEqualTo(10.0);
        assertThat(deviation.getMean()).isEqualTo(1.667);
        assertThat(deviation.getStdDev()).isEqualTo(0.577);
        assertThat(deviation.getDeviationScore()).isEqualTo(14.434);
        assertThat(deviation.getTimestamp()).isEqualTo(NOW);
        assertThat(deviation.isStrong()).isTrue();
    }

    @Test
    @DisplayName("Evaluation should not change the baseline")
    void evaluationShouldNotUpdateBaseline() {
        seedUnitBaseline();

        detector.evaluate("api-gateway", "latency_ms", 1_000.0);

        assertThat(learner.sampleCount("api-gateway", "latency_ms")).isEqualTo(3);
    }

    @Test
    @DisplayName("Display rounding should round the exact binary value half-even")
    void displayRoundingShouldUseExactBinaryValue() {
        // 2.0675 and 0.1235 are stored slightly below the written decimal
        assertThat(DeviationDetector.round(2.0675)).isEqualTo(2.067);
        assertThat(DeviationDetector.round(0.1235)).isEqualTo(0.123);
        assertThat(DeviationDetector.round(14.4345)).isEqualTo(14.434);
        assertThat(DeviationDetector.round(Double.NaN)).isNaN();
    }

    @Test
    @DisplayName("Should reject a non-positive z-threshold")
    void shouldRejectNonPositiveThreshold() {
        assertThatThrownBy(() -> new DeviationDetector(learner, 0.0, Clock.systemUTC()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("strongThreshold");
    }

    private void seedUnitBaseline() {
        learner.update("api-gateway", "latency_ms", 9.0);
        learner.update("api-gateway", "latency_ms", 10.0);
        learner.update("api-gateway", "latency_ms", 11.0);
    }
}
