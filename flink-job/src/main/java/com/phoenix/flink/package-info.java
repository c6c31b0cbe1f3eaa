/**
 * Apache Flink streaming job for Phoenix.
 *
 * <p>
 * Wires the core decision pipeline into a Flink job that consumes telemetry
 * observations from Kafka and publishes raised incidents back to Kafka.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.phoenix.flink.PhoenixJob}: main entry point</li>
 * <li>{@link com.phoenix.flink.IncidentProcessFunction}: hosts the pipeline</li>
 * <li>{@link com.phoenix.flink.JobConfig}: environment-driven configuration</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.phoenix.flink;
