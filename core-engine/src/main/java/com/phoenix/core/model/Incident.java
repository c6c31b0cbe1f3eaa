package com.phoenix.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Escalation decision raised when a correlation group clears the confidence
 * bar outside the cooldown period.
 *
 * <p>
 * The full {@link CorrelationGroup} is kept in {@link #getDetails()} as the
 * audit trail of why the incident was raised.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code incidentId}, {@code timestamp},
 * {@code severity} and {@code details} are required.
 * </p>
 *
 * @since 1.0.0
 */
public final class Incident implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Summary attached to every incident raised by correlation. */
    public static final String CORRELATED_DEGRADATION = "Correlated system degradation detected";

    private final String incidentId;
    private final Instant timestamp;
    private final Severity severity;
    private final double confidence;
    private final Set<String> affectedComponents;
    private final boolean criticalInvolved;
    private final String summary;
    private final CorrelationGroup details;

    private Incident(Builder builder) {
        this.incidentId = Objects.requireNonNull(builder.incidentId, "incidentId must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.confidence = builder.confidence;
        this.affectedComponents = builder.affectedComponents != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(builder.affectedComponents))
                : Collections.emptySet();
        this.criticalInvolved = builder.criticalInvolved;
        this.summary = builder.summary != null ? builder.summary : CORRELATED_DEGRADATION;
        this.details = Objects.requireNonNull(builder.details, "details must not be null");

        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got: " + confidence);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Incident} instances.
     */
    public static class Builder {
        private String incidentId;
        private Instant timestamp;
        private Severity severity;
        private double confidence;
        private Set<String> affectedComponents;
        private boolean criticalInvolved;
        private String summary;
        private CorrelationGroup details;

        public Builder incidentId(String incidentId) {
            this.incidentId = incidentId;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder affectedComponents(Set<String> affectedComponents) {
            this.affectedComponents = affectedComponents;
            return this;
        }

        public Builder criticalInvolved(boolean criticalInvolved) {
            this.criticalInvolved = criticalInvolved;
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder details(CorrelationGroup details) {
            this.details = details;
            return this;
        }

        /**
         * @return a new {@link Incident}
         * @throws NullPointerException     if a required field is missing
         * @throws IllegalArgumentException if confidence is outside [0, 1]
         */
        public Incident build() {
            return new Incident(this);
        }
    }

    public String getIncidentId() {
        return incidentId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Severity getSeverity() {
        return severity;
    }

    public double getConfidence() {
        return confidence;
    }

    /**
     * @return unmodifiable set of affected components
     */
    public Set<String> getAffectedComponents() {
        return affectedComponents;
    }

    public boolean isCriticalInvolved() {
        return criticalInvolved;
    }

    public String getSummary() {
        return summary;
    }

    public CorrelationGroup getDetails() {
        return details;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Incident that))
            return false;
        return incidentId.equals(that.incidentId);
    }

    @Override
    public int hashCode() {
        return incidentId.hashCode();
    }

    @Override
    public String toString() {
        return "Incident{" +
                "incidentId='" + incidentId + '\'' +
                ", timestamp=" + timestamp +
                ", severity=" + severity +
                ", confidence=" + confidence +
                ", affectedComponents=" + affectedComponents +
                ", criticalInvolved=" + criticalInvolved +
                '}';
    }
}
