package com.phoenix.core.incident;

import com.phoenix.core.model.CorrelationGroup;
import com.phoenix.core.model.Incident;
import com.phoenix.core.model.Severity;
import com.phoenix.core.topology.Topology;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Final decision layer: turns a correlation group into an incident when the
 * evidence is strong enough.
 *
 * <h3>Decision</h3>
 * <ol>
 * <li>Suppress everything while a previous incident is younger than the
 * cooldown.</li>
 * <li>Require at least two distinct components and at least one strong
 * deviation.</li>
 * <li>{@code confidence = min(1, 0.5 + 0.2 * strong + 0.2 if a critical
 * component is involved)}; reject below {@value #MIN_CONFIDENCE}.</li>
 * <li>Severity is {@link Severity#HIGH} when a critical component is
 * involved, {@link Severity#MEDIUM} otherwise.</li>
 * </ol>
 *
 * <h3>State</h3>
 * <p>
 * The cooldown is global: one accepted incident silences all groups, not
 * only those touching the same components.
 * </p>
 *
 * @since 1.0.0
 */
public class IncidentManager {

    private static final Logger LOG = LoggerFactory.getLogger(IncidentManager.class);

    static final double BASE_CONFIDENCE = 0.5;
    static final double STRONG_WEIGHT = 0.2;
    static final double CRITICAL_WEIGHT = 0.2;
    static final double MIN_CONFIDENCE = 0.7;

    private final Set<String> criticalComponents;
    private final Duration cooldown;
    private final Clock clock;
    private final Supplier<String> idSupplier;

    /** Time of the last accepted incident; {@code null} until the first one. */
    private Instant lastIncidentTime;

    /**
     * @param topology   validated topology; its critical nodes are captured once
     * @param cooldown   minimum gap between incidents
     * @param clock      time source
     * @param idSupplier incident id generator
     * @throws IllegalArgumentException if {@code cooldown} is negative
     */
    public IncidentManager(Topology topology, Duration cooldown, Clock clock, Supplier<String> idSupplier) {
        Objects.requireNonNull(topology, "topology must not be null");
        this.cooldown = Objects.requireNonNull(cooldown, "cooldown must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.idSupplier = Objects.requireNonNull(idSupplier, "idSupplier must not be null");
        if (cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must not be negative, got: " + cooldown);
        }
        this.criticalComponents = topology.criticalComponents();
    }

    public IncidentManager(Topology topology, Duration cooldown, Clock clock) {
        this(topology, cooldown, clock, IncidentIds.randomUuid());
    }

    /**
     * Decide whether a correlation group warrants an incident.
     *
     * @param group the correlated deviations
     * @return the raised incident, or empty if the group does not qualify or
     *         the cooldown is active
     */
    public synchronized Optional<Incident> evaluate(CorrelationGroup group) {
        Objects.requireNonNull(group, "group must not be null");
        Instant now = clock.instant();

        if (inCooldown(now)) {
            LOG.trace("Cooldown active since {}, suppressing group {}", lastIncidentTime, group);
            return Optional.empty();
        }

        Set<String> components = group.components();
        if (components.size() < 2) {
            return Optional.empty();
        }

        int strong = group.strongCount();
        if (strong == 0) {
            LOG.debug("No strong deviation in group across {}, not escalating", components);
            return Optional.empty();
        }

        boolean criticalInvolved = !Collections.disjoint(components, criticalComponents);
        double confidence = Math.min(1.0,
                BASE_CONFIDENCE + STRONG_WEIGHT * strong + (criticalInvolved ? CRITICAL_WEIGHT : 0.0));

        if (confidence < MIN_CONFIDENCE) {
            LOG.debug("Confidence {} below {} for group across {}", confidence, MIN_CONFIDENCE, components);
            return Optional.empty();
        }

        lastIncidentTime = now;

        Incident incident = Incident.builder()
                .incidentId(idSupplier.get())
                .timestamp(now)
                .severity(criticalInvolved ? Severity.HIGH : Severity.MEDIUM)
                .confidence(roundConfidence(confidence))
                .affectedComponents(components)
                .criticalInvolved(criticalInvolved)
                .details(group)
                .build();

        LOG.info("Incident {} raised: severity={} confidence={} components={}",
                incident.getIncidentId(), incident.getSeverity(), incident.getConfidence(), components);
        return Optional.of(incident);
    }

    /**
     * @return time of the last accepted incident, or empty if none yet
     */
    public synchronized Optional<Instant> getLastIncidentTime() {
        return Optional.ofNullable(lastIncidentTime);
    }

    private boolean inCooldown(Instant now) {
        return lastIncidentTime != null
                && Duration.between(lastIncidentTime, now).compareTo(cooldown) < 0;
    }

    private static double roundConfidence(double confidence) {
        return new BigDecimal(confidence).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }
}
