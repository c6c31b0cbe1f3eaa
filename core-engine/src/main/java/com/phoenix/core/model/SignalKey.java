package com.phoenix.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Identity of a single telemetry signal: a {@code (component, metric)} pair.
 *
 * <p>
 * Used as the key for baseline statistics. Instances are immutable and safe
 * to use as map keys.
 * </p>
 *
 * @since 1.0.0
 */
public final class SignalKey implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String component;
    private final String metric;

    /**
     * @param component the topology node id emitting the signal
     * @param metric    the metric name
     * @throws NullPointerException if either argument is {@code null}
     */
    public SignalKey(String component, String metric) {
        this.component = Objects.requireNonNull(component, "component must not be null");
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
    }

    public static SignalKey of(String component, String metric) {
        return new SignalKey(component, metric);
    }

    public String getComponent() {
        return component;
    }

    public String getMetric() {
        return metric;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SignalKey that))
            return false;
        return component.equals(that.component) && metric.equals(that.metric);
    }

    @Override
    public int hashCode() {
        return Objects.hash(component, metric);
    }

    @Override
    public String toString() {
        return component + "/" + metric;
    }
}
