package com.phoenix.flink;

import com.phoenix.core.model.Observation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ObservationDeserializationSchema}.
 */
class ObservationDeserializationSchemaTest {

    private final ObservationDeserializationSchema schema = new ObservationDeserializationSchema();

    @Test
    @DisplayName("Should read a complete observation with an ISO instant")
    void shouldReadObservation() {
        Observation observation = deserialize(
                "{\"component\":\"api-gateway\",\"metric\":\"error_rate\",\"value\":0.004,"
                        + "\"timestamp\":\"2024-03-01T12:00:00Z\",\"host\":\"ignored\"}");

        assertThat(observation).isNotNull();
        assertThat(observation.getComponent()).isEqualTo("api-gateway");
        assertThat(observation.getMetric()).isEqualTo("error_rate");
        assertThat(observation.getValue()).isEqualTo(0.004);
        assertThat(observation.getTimestamp()).isEqualTo(Instant.parse("2024-03-01T12:00:00Z"));
    }

    @Test
    @DisplayName("Should read a zone-less timestamp as UTC")
    void shouldReadLocalTimestampAsUtc() {
        Observation observation = deserialize(
                "{\"component\":\"router-edge\",\"metric\":\"latency_ms\",\"value\":21.5,"
                        + "\"timestamp\":\"2024-03-01T12:00:00.250000\"}");

        assertThat(observation.getTimestamp()).isEqualTo(Instant.parse("2024-03-01T12:00:00.250Z"));
    }

    @Test
    @DisplayName("Should keep the observation when only the timestamp is unreadable")
    void shouldDropBadTimestampOnly() {
        Observation observation = deserialize(
                "{\"component\":\"router-edge\",\"metric\":\"latency_ms\",\"value\":\"21.5\","
                        + "\"timestamp\":\"yesterday\"}");

        assertThat(observation).isNotNull();
        assertThat(observation.getValue()).isEqualTo(21.5);
        assertThat(observation.getTimestamp()).isNull();
    }

    @Test
    @DisplayName("Should drop an observation without a numeric value")
    void shouldDropMissingValue() {
        assertThat(deserialize("{\"component\":\"router-edge\",\"metric\":\"latency_ms\"}")).isNull();
        assertThat(deserialize(
                "{\"component\":\"router-edge\",\"metric\":\"latency_ms\",\"value\":\"high\"}")).isNull();
    }

    @Test
    @DisplayName("Should drop an observation whose value is NaN, infinite or overflows")
    void shouldDropNonFiniteValue() {
        assertThat(deserialize(
                "{\"component\":\"A\",\"metric\":\"X\",\"value\":\"NaN\"}")).isNull();
        assertThat(deserialize(
                "{\"component\":\"A\",\"metric\":\"X\",\"value\":\"Infinity\"}")).isNull();
        assertThat(deserialize(
                "{\"component\":\"A\",\"metric\":\"X\",\"value\":\"-Infinity\"}")).isNull();
        assertThat(deserialize(
                "{\"component\":\"A\",\"metric\":\"X\",\"value\":\"1e999\"}")).isNull();
        assertThat(deserialize(
                "{\"component\":\"A\",\"metric\":\"X\",\"value\":1e999}")).isNull();
    }

    @Test
    @DisplayName("Should drop malformed and empty payloads")
    void shouldDropMalformedPayloads() {
        assertThat(deserialize("{not json")).isNull();
        assertThat(deserialize("[1, 2, 3]")).isNull();
        assertThat(schema.deserialize(new byte[0])).isNull();
        assertThat(schema.deserialize(null)).isNull();
    }

    @Test
    @DisplayName("Should pass through observations missing component for the operator to drop")
    void shouldKeepIncompleteObservation() {
        Observation observation = deserialize("{\"metric\":\"latency_ms\",\"value\":1}");

        assertThat(observation).isNotNull();
        assertThat(observation.isComplete()).isFalse();
    }

    private Observation deserialize(String json) {
        return schema.deserialize(json.getBytes(StandardCharsets.UTF_8));
    }
}
