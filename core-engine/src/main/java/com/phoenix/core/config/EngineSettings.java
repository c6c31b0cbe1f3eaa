package com.phoenix.core.config;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunables of the decision pipeline, bound from YAML.
 *
 * <p>
 * Expected YAML structure (all keys optional, defaults shown):
 * </p>
 *
 * <pre>
 * minSamples: 30
 * strongThreshold: 3.0
 * timeWindowSeconds: 30
 * cooldownSeconds: 300
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class EngineSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final int DEFAULT_MIN_SAMPLES = 30;
    public static final double DEFAULT_STRONG_THRESHOLD = 3.0;
    public static final long DEFAULT_TIME_WINDOW_SECONDS = 30;
    public static final long DEFAULT_COOLDOWN_SECONDS = 300;

    /** Observations needed before a signal's baseline is trusted. */
    private int minSamples = DEFAULT_MIN_SAMPLES;

    /** Deviation score (z-score) at or above which a reading is strong. */
    private double strongThreshold = DEFAULT_STRONG_THRESHOLD;

    /** Maximum age of a recorded deviation that still takes part in correlation. */
    private long timeWindowSeconds = DEFAULT_TIME_WINDOW_SECONDS;

    /** Minimum gap between two incidents, across all components. */
    private long cooldownSeconds = DEFAULT_COOLDOWN_SECONDS;

    /**
     * @return settings with every field at its default
     */
    public static EngineSettings defaults() {
        return new EngineSettings();
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * @throws IllegalStateException if any value is out of range
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (minSamples < 2) {
            errors.add("'minSamples' must be >= 2, got: " + minSamples);
        }
        if (!(strongThreshold > 0)) {
            errors.add("'strongThreshold' must be > 0, got: " + strongThreshold);
        }
        if (timeWindowSeconds <= 0) {
            errors.add("'timeWindowSeconds' must be > 0, got: " + timeWindowSeconds);
        }
        if (cooldownSeconds < 0) {
            errors.add("'cooldownSeconds' must be >= 0, got: " + cooldownSeconds);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid engine settings: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Derived values
    // ---------------------------------------------------------------

    public Duration timeWindow() {
        return Duration.ofSeconds(timeWindowSeconds);
    }

    public Duration cooldown() {
        return Duration.ofSeconds(cooldownSeconds);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public int getMinSamples() {
        return minSamples;
    }

    public void setMinSamples(int minSamples) {
        this.minSamples = minSamples;
    }

    public double getStrongThreshold() {
        return strongThreshold;
    }

    public void setStrongThreshold(double strongThreshold) {
        this.strongThreshold = strongThreshold;
    }

    public long getTimeWindowSeconds() {
        return timeWindowSeconds;
    }

    public void setTimeWindowSeconds(long timeWindowSeconds) {
        this.timeWindowSeconds = timeWindowSeconds;
    }

    public long getCooldownSeconds() {
        return cooldownSeconds;
    }

    public void setCooldownSeconds(long cooldownSeconds) {
        this.cooldownSeconds = cooldownSeconds;
    }

    @Override
    public String toString() {
        return "EngineSettings{" +
                "minSamples=" + minSamples +
                ", strongThreshold=" + strongThreshold +
                ", timeWindowSeconds=" + timeWindowSeconds +
                ", cooldownSeconds=" + cooldownSeconds +
                '}';
    }
}
