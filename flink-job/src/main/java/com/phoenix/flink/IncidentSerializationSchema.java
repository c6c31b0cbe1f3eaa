package com.phoenix.flink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.phoenix.core.model.Incident;
import org.apache.flink.api.common.serialization.SerializationSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flink {@link SerializationSchema} that converts an {@link Incident} into
 * JSON bytes for the incidents topic.
 *
 * <p>
 * Property names are snake_case ({@code incident_id},
 * {@code affected_components}, ...) and timestamps ISO-8601 strings. The
 * correlation group is written under {@code details}.
 * </p>
 */
public class IncidentSerializationSchema implements SerializationSchema<Incident> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(IncidentSerializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public byte[] serialize(Incident incident) {
        try {
            return objectMapper().writeValueAsBytes(incident);
        } catch (Exception e) {
            LOG.error("Failed to serialize incident {}: {}", incident.getIncidentId(), e.getMessage(), e);
            return new byte[0];
        }
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
            mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        }
        return mapper;
    }
}
