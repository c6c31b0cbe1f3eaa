package com.phoenix.flink;

import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

/**
 * Flink metrics of the incident pipeline operator, exposed through the
 * cluster's configured reporters.
 *
 * <ul>
 *   <li>{@code observations_processed_total}: observations run through the pipeline</li>
 *   <li>{@code observations_dropped_total}: incomplete observations skipped</li>
 *   <li>{@code deviations_recorded_total}: deviations buffered for correlation</li>
 *   <li>{@code incidents_raised_total}: incidents emitted</li>
 *   <li>{@code processing_latency_ms}: per-observation latency</li>
 * </ul>
 */
public class PhoenixMetrics {

    private final Counter observationsProcessed;
    private final Counter observationsDropped;
    private final Counter deviationsRecorded;
    private final Counter incidentsRaised;
    private final Histogram processingLatency;

    public PhoenixMetrics(MetricGroup metricGroup) {
        MetricGroup phoenixGroup = metricGroup.addGroup("phoenix");

        this.observationsProcessed = phoenixGroup.counter("observations_processed_total");
        this.observationsDropped = phoenixGroup.counter("observations_dropped_total");
        this.deviationsRecorded = phoenixGroup.counter("deviations_recorded_total");
        this.incidentsRaised = phoenixGroup.counter("incidents_raised_total");
        this.processingLatency = phoenixGroup
                .histogram("processing_latency_ms", new DescriptiveStatisticsHistogram(350));
    }

    public void incrementObservationsProcessed() {
        observationsProcessed.inc();
    }

    public void incrementObservationsDropped() {
        observationsDropped.inc();
    }

    public void addDeviationsRecorded(long count) {
        deviationsRecorded.inc(count);
    }

    public void incrementIncidentsRaised() {
        incidentsRaised.inc();
    }

    public void recordLatency(long milliseconds) {
        processingLatency.update(milliseconds);
    }
}
