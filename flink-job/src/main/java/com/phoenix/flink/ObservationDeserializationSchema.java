package com.phoenix.flink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phoenix.core.model.Observation;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Flink {@link DeserializationSchema} that converts raw Kafka bytes into an
 * {@link Observation}.
 *
 * <p>
 * Expected payload: {@code {"component": "...", "metric": "...", "value": 12.5,
 * "timestamp": "..."}}. {@code value} may be a JSON number or a numeric
 * string and must be finite. {@code timestamp} is optional and accepted either as an ISO-8601
 * instant or as a zone-less local date-time in UTC; an unparseable timestamp
 * is dropped, not the observation.
 * </p>
 * <p>
 * Malformed messages are logged and dropped (returns {@code null}) so that a
 * single bad record does not stop the pipeline.
 * </p>
 */
public class ObservationDeserializationSchema implements DeserializationSchema<Observation> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ObservationDeserializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public Observation deserialize(byte[] message) {
        if (message == null || message.length == 0) {
            return null;
        }
        try {
            JsonNode root = objectMapper().readTree(message);
            if (root == null || !root.isObject()) {
                LOG.warn("Observation payload is not a JSON object, skipping");
                return null;
            }

            Optional<Double> value = numeric(root.get("value"));
            if (value.isEmpty()) {
                LOG.warn("Observation without numeric 'value', skipping: {}", root);
                return null;
            }

            Observation observation = new Observation(
                    text(root.get("component")),
                    text(root.get("metric")),
                    value.get());
            observation.setTimestamp(timestamp(root.get("timestamp")));
            return observation;
        } catch (Exception e) {
            LOG.warn("Failed to deserialize observation, skipping: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(Observation nextElement) {
        return false; // unbounded stream
    }

    @Override
    public TypeInformation<Observation> getProducedType() {
        return TypeInformation.of(Observation.class);
    }

    // ---------------------------------------------------------------
    // Field coercion
    // ---------------------------------------------------------------

    private static String text(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }

    private static Optional<Double> numeric(JsonNode node) {
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        double value;
        if (node.isNumber()) {
            value = node.doubleValue();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.asText());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        } else {
            return Optional.empty();
        }
        // NaN and overflow would poison the running baseline
        return Double.isFinite(value) ? Optional.of(value) : Optional.empty();
    }

    static Instant timestamp(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return null;
        }
        String raw = node.asText();
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException notAnInstant) {
            try {
                return LocalDateTime.parse(raw).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e) {
                LOG.debug("Ignoring unparseable observation timestamp '{}'", raw);
                return null;
            }
        }
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
        }
        return mapper;
    }
}
