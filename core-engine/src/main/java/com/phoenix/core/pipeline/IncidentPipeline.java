package com.phoenix.core.pipeline;

import com.phoenix.core.config.EngineSettings;
import com.phoenix.core.correlation.Correlator;
import com.phoenix.core.detection.BaselineLearner;
import com.phoenix.core.detection.DeviationDetector;
import com.phoenix.core.incident.IncidentIds;
import com.phoenix.core.incident.IncidentManager;
import com.phoenix.core.model.CorrelationGroup;
import com.phoenix.core.model.Deviation;
import com.phoenix.core.model.Incident;
import com.phoenix.core.model.Observation;
import com.phoenix.core.topology.Topology;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Runs one observation through the whole decision chain.
 *
 * <pre>
 *   observation
 *     → BaselineLearner.update
 *     → DeviationDetector.evaluate
 *     → Correlator.recordDeviation + Correlator.correlate   (if a deviation was scored)
 *     → IncidentManager.evaluate                            (per correlation group)
 *     → incidents
 * </pre>
 *
 * <p>
 * The value updates its own baseline before it is scored. Every scored
 * deviation is recorded, including {@code NORMAL} ones; only the incident
 * stage looks at the level.
 * </p>
 *
 * @since 1.0.0
 */
public class IncidentPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(IncidentPipeline.class);

    private final BaselineLearner baselineLearner;
    private final DeviationDetector deviationDetector;
    private final Correlator correlator;
    private final IncidentManager incidentManager;

    public IncidentPipeline(BaselineLearner baselineLearner,
            DeviationDetector deviationDetector,
            Correlator correlator,
            IncidentManager incidentManager) {
        this.baselineLearner = Objects.requireNonNull(baselineLearner, "baselineLearner must not be null");
        this.deviationDetector = Objects.requireNonNull(deviationDetector, "deviationDetector must not be null");
        this.correlator = Objects.requireNonNull(correlator, "correlator must not be null");
        this.incidentManager = Objects.requireNonNull(incidentManager, "incidentManager must not be null");
    }

    /**
     * Assemble a pipeline from validated settings and topology.
     *
     * @param settings   engine tunables
     * @param topology   topology, validated here
     * @param clock      time source shared by every stage
     * @param idSupplier incident id generator
     * @return a ready pipeline
     */
    public static IncidentPipeline create(EngineSettings settings, Topology topology,
            Clock clock, Supplier<String> idSupplier) {
        Objects.requireNonNull(settings, "settings must not be null");
        Objects.requireNonNull(topology, "topology must not be null");
        settings.validate();
        topology.validate();

        BaselineLearner learner = new BaselineLearner(settings.getMinSamples());
        DeviationDetector detector = new DeviationDetector(learner, settings.getStrongThreshold(), clock);
        Correlator correlator = new Correlator(topology, settings.timeWindow(), clock);
        IncidentManager manager = new IncidentManager(topology, settings.cooldown(), clock, idSupplier);

        LOG.info("Incident pipeline created with {} over {} node(s)", settings, topology.getNodes().size());
        return new IncidentPipeline(learner, detector, correlator, manager);
    }

    public static IncidentPipeline create(EngineSettings settings, Topology topology) {
        return create(settings, topology, Clock.systemUTC(), IncidentIds.randomUuid());
    }

    /**
     * Process a single observation.
     *
     * @param observation the telemetry reading
     * @return incidents raised by this observation; usually empty
     * @throws IllegalArgumentException if component or metric is missing, or the value is not finite
     */
    public List<Incident> process(Observation observation) {
        Objects.requireNonNull(observation, "observation must not be null");
        if (!observation.isComplete()) {
            throw new IllegalArgumentException("Observation requires component and metric: " + observation);
        }
        return process(observation.getComponent(), observation.getMetric(), observation.getValue());
    }

    /**
     * Process a single reading.
     *
     * @param component component id
     * @param metric    metric name
     * @param value     observed value
     * @return incidents raised by this reading; usually empty
     * @throws IllegalArgumentException if {@code value} is NaN or infinite
     */
    public List<Incident> process(String component, String metric, double value) {
        baselineLearner.update(component, metric, value);

        Optional<Deviation> deviation = deviationDetector.evaluate(component, metric, value);
        if (deviation.isEmpty()) {
            return Collections.emptyList();
        }

        correlator.recordDeviation(deviation.get());

        List<Incident> incidents = new ArrayList<>();
        for (CorrelationGroup group : correlator.correlate()) {
            incidentManager.evaluate(group).ifPresent(incidents::add);
        }
        return incidents;
    }

    public BaselineLearner getBaselineLearner() {
        return baselineLearner;
    }

    public Correlator getCorrelator() {
        return correlator;
    }

    public IncidentManager getIncidentManager() {
        return incidentManager;
    }
}
