package com.phoenix.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A scored departure of one observed value from its learned baseline.
 *
 * <p>
 * {@code mean}, {@code stdDev} and {@code deviationScore} are rounded to
 * three decimal places for display; the {@link #getLevel() level} was
 * classified on the unrounded score before rounding.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code component}, {@code metric}, {@code level}
 * and {@code timestamp} are required; omitting any of them throws a
 * {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class Deviation implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String component;
    private final String metric;
    private final double value;
    private final double mean;
    private final double stdDev;
    private final double deviationScore;
    private final DeviationLevel level;

    /** Scoring time, or record time once the deviation has been buffered for correlation. */
    private final Instant timestamp;

    private Deviation(Builder builder) {
        this.component = Objects.requireNonNull(builder.component, "component must not be null");
        this.metric = Objects.requireNonNull(builder.metric, "metric must not be null");
        this.value = builder.value;
        this.mean = builder.mean;
        this.stdDev = builder.stdDev;
        this.deviationScore = builder.deviationScore;
        this.level = Objects.requireNonNull(builder.level, "level must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Copy this deviation with a different timestamp.
     *
     * @param timestamp the new timestamp; must not be {@code null}
     * @return a new deviation identical apart from its timestamp
     */
    public Deviation withTimestamp(Instant timestamp) {
        return new Builder()
                .component(component)
                .metric(metric)
                .value(value)
                .mean(mean)
                .stdDev(stdDev)
                .deviationScore(deviationScore)
                .level(level)
                .timestamp(timestamp)
                .build();
    }

    /**
     * @return {@code true} if this deviation is classified {@link DeviationLevel#STRONG}
     */
    @JsonIgnore
    public boolean isStrong() {
        return level == DeviationLevel.STRONG;
    }

    /**
     * Fluent builder for {@link Deviation} instances.
     */
    public static class Builder {
        private String component;
        private String metric;
        private double value;
        private double mean;
        private double stdDev;
        private double deviationScore;
        private DeviationLevel level;
        private Instant timestamp;

        public Builder component(String component) {
            this.component = component;
            return this;
        }

        public Builder metric(String metric) {
            this.metric = metric;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder mean(double mean) {
            this.mean = mean;
            return this;
        }

        public Builder stdDev(double stdDev) {
            this.stdDev = stdDev;
            return this;
        }

        public Builder deviationScore(double deviationScore) {
            this.deviationScore = deviationScore;
            return this;
        }

        public Builder level(DeviationLevel level) {
            this.level = level;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Deviation build() {
            return new Deviation(this);
        }
    }

    public String getComponent() {
        return component;
    }

    public String getMetric() {
        return metric;
    }

    public double getValue() {
        return value;
    }

    public double getMean() {
        return mean;
    }

    public double getStdDev() {
        return stdDev;
    }

    public double getDeviationScore() {
        return deviationScore;
    }

    public DeviationLevel getLevel() {
        return level;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Deviation that))
            return false;
        return Double.compare(value, that.value) == 0
                && Double.compare(deviationScore, that.deviationScore) == 0
                && component.equals(that.component)
                && metric.equals(that.metric)
                && level == that.level
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(component, metric, value, deviationScore, level, timestamp);
    }

    @Override
    public String toString() {
        return "Deviation{" +
                "component='" + component + '\'' +
                ", metric='" + metric + '\'' +
                ", value=" + value +
                ", mean=" + mean +
                ", stdDev=" + stdDev +
                ", deviationScore=" + deviationScore +
                ", level=" + level +
                ", timestamp=" + timestamp +
                '}';
    }
}
