/**
 * Domain model classes for Phoenix Sentinel.
 *
 * <p>
 * Shared between the decision engine and the Flink job layer:
 * </p>
 * <ul>
 * <li>{@link com.phoenix.core.model.Observation}: telemetry reading as
 * received from the signal source</li>
 * <li>{@link com.phoenix.core.model.Deviation}: scored departure from a
 * baseline</li>
 * <li>{@link com.phoenix.core.model.CorrelationGroup}: topology-linked
 * deviations</li>
 * <li>{@link com.phoenix.core.model.Incident}: escalation output</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.phoenix.core.model;
