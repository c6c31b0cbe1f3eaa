package com.phoenix.flink;

import com.phoenix.core.config.EngineSettings;
import com.phoenix.core.model.Incident;
import com.phoenix.core.model.Observation;
import com.phoenix.core.pipeline.IncidentPipeline;
import com.phoenix.core.topology.Topology;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.ProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Flink {@link ProcessFunction} hosting one {@link IncidentPipeline}.
 *
 * <p>
 * Correlation spans components, so a single pipeline instance must see the
 * whole observation stream: the job runs this operator with parallelism 1.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * Baselines, the deviation buffer and the cooldown live on the heap of the
 * operator and are not checkpointed. After a restart the pipeline learns its
 * baselines again.
 * </p>
 *
 * @since 1.0.0
 */
public class IncidentProcessFunction extends ProcessFunction<Observation, Incident> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(IncidentProcessFunction.class);

    private final EngineSettings settings;
    private final Topology topology;

    private transient IncidentPipeline pipeline;
    private transient PhoenixMetrics metrics;

    /**
     * @param settings validated engine tunables
     * @param topology validated topology
     */
    public IncidentProcessFunction(EngineSettings settings, Topology topology) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.topology = Objects.requireNonNull(topology, "topology must not be null");
    }

    @Override
    public void open(Configuration parameters) {
        pipeline = IncidentPipeline.create(settings, topology);
        metrics = new PhoenixMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("IncidentProcessFunction opened with {}", settings);
    }

    @Override
    public void close() {
        if (pipeline != null) {
            LOG.info("IncidentProcessFunction closing: {} signal(s) tracked, {} deviation(s) buffered",
                    pipeline.getBaselineLearner().trackedSignals(),
                    pipeline.getCorrelator().bufferedDeviations());
        }
    }

    @Override
    public void processElement(Observation observation,
            ProcessFunction<Observation, Incident>.Context ctx,
            Collector<Incident> out) {
        long startNanos = System.nanoTime();

        if (!observation.isComplete()) {
            LOG.warn("Dropping observation without component or metric: {}", observation);
            metrics.incrementObservationsDropped();
            return;
        }
        if (!Double.isFinite(observation.getValue())) {
            LOG.warn("Dropping observation with non-finite value: {}", observation);
            metrics.incrementObservationsDropped();
            return;
        }

        int bufferedBefore = pipeline.getCorrelator().bufferedDeviations();
        List<Incident> incidents = pipeline.process(observation);
        metrics.addDeviationsRecorded(pipeline.getCorrelator().bufferedDeviations() - bufferedBefore);

        for (Incident incident : incidents) {
            out.collect(incident);
            metrics.incrementIncidentsRaised();
        }

        metrics.incrementObservationsProcessed();
        metrics.recordLatency((System.nanoTime() - startNanos) / 1_000_000);
    }
}
