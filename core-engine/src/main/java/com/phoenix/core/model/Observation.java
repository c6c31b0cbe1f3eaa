package com.phoenix.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A single telemetry reading: one value of one metric on one component.
 *
 * <p>
 * Observations arrive from the signal source, e.g. as
 * {@code {"component":"api-gateway","metric":"error_rate","value":0.004}}.
 * The optional {@code timestamp} is carried for reference only; the engine stamps its own wall-clock time on everything
 * it derives from an observation.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is <strong>not</strong> thread-safe. It is a mutable bean so
 * that Flink's POJO serializer can handle it.
 * </p>
 *
 * @since 1.0.0
 */
public class Observation implements Serializable {

    private static final long serialVersionUID = 1L;

    private String component;
    private String metric;
    private double value;

    /** Source-side timestamp, if the emitter supplied one. */
    private Instant timestamp;

    /** No-arg constructor required by Flink. */
    public Observation() {
    }

    public Observation(String component, String metric, double value) {
        this.component = component;
        this.metric = metric;
        this.value = value;
    }

    /**
     * @return {@code true} if both component and metric are present
     */
    public boolean isComplete() {
        return component != null && !component.isBlank()
                && metric != null && !metric.isBlank();
    }

    public String getComponent() {
        return component;
    }

    public void setComponent(String component) {
        this.component = component;
    }

    public String getMetric() {
        return metric;
    }

    public void setMetric(String metric) {
        this.metric = metric;
    }

    public double getValue() {
        return value;
    }

    public void setValue(double value) {
        this.value = value;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Observation that))
            return false;
        return Double.compare(value, that.value) == 0
                && Objects.equals(component, that.component)
                && Objects.equals(metric, that.metric)
                && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(component, metric, value, timestamp);
    }

    @Override
    public String toString() {
        return "Observation{" +
                "component='" + component + '\'' +
                ", metric='" + metric + '\'' +
                ", value=" + value +
                ", timestamp=" + timestamp +
                '}';
    }
}
