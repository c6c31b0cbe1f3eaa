package com.phoenix.flink;

import java.io.Serializable;
import java.util.Objects;

/**
 * Typed, immutable configuration object for the Phoenix Flink job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults so
 * the job can be configured from a Kubernetes Deployment, Docker {@code -e}
 * flags or a shell environment. Engine tunables and the topology are not
 * held here: only the paths to load them from.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for tests. The builder validates inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String kafkaObservationTopic;
    private final String kafkaIncidentTopic;
    private final String kafkaGroupId;

    // ---------------------------------------------------------------
    // Flink
    // ---------------------------------------------------------------
    private final long checkpointIntervalMs;

    // ---------------------------------------------------------------
    // Engine inputs (blank = loader default resolution)
    // ---------------------------------------------------------------
    private final String topologyPath;
    private final String settingsPath;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaObservationTopic = b.kafkaObservationTopic;
        this.kafkaIncidentTopic = b.kafkaIncidentTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.topologyPath = b.topologyPath;
        this.settingsPath = b.settingsPath;
    }

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return new Builder()
                    .kafkaBootstrapServers(env("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaObservationTopic(env("KAFKA_OBSERVATION_TOPIC", "telemetry"))
                    .kafkaIncidentTopic(env("KAFKA_INCIDENT_TOPIC", "incidents"))
                    .kafkaGroupId(env("KAFKA_GROUP_ID", "phoenix"))
                    .checkpointIntervalMs(Long.parseLong(env("FLINK_CHECKPOINT_INTERVAL_MS", "60000")))
                    .topologyPath(env("PHOENIX_TOPOLOGY_PATH", ""))
                    .settingsPath(env("PHOENIX_SETTINGS_PATH", ""))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaObservationTopic() {
        return kafkaObservationTopic;
    }

    public String getKafkaIncidentTopic() {
        return kafkaIncidentTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    public String getTopologyPath() {
        return topologyPath;
    }

    public String getSettingsPath() {
        return settingsPath;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * {@link #build()} rejects blank topic and group names and a
     * non-positive checkpoint interval.
     * </p>
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaObservationTopic = "telemetry";
        private String kafkaIncidentTopic = "incidents";
        private String kafkaGroupId = "phoenix";
        private long checkpointIntervalMs = 60_000;
        private String topologyPath = "";
        private String settingsPath = "";

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaObservationTopic(String v) {
            this.kafkaObservationTopic = v;
            return this;
        }

        public Builder kafkaIncidentTopic(String v) {
            this.kafkaIncidentTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder checkpointIntervalMs(long v) {
            this.checkpointIntervalMs = v;
            return this;
        }

        public Builder topologyPath(String v) {
            this.topologyPath = v;
            return this;
        }

        public Builder settingsPath(String v) {
            this.settingsPath = v;
            return this;
        }

        /**
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            requireNonBlank(kafkaObservationTopic, "kafkaObservationTopic");
            requireNonBlank(kafkaIncidentTopic, "kafkaIncidentTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");

            if (kafkaObservationTopic.equals(kafkaIncidentTopic)) {
                throw new IllegalArgumentException(
                        "Observation and incident topics must differ, both are: " + kafkaIncidentTopic);
            }
            if (checkpointIntervalMs < 1) {
                throw new IllegalArgumentException(
                        "checkpointIntervalMs must be >= 1, got: " + checkpointIntervalMs);
            }
            if (topologyPath == null) {
                topologyPath = "";
            }
            if (settingsPath == null) {
                settingsPath = "";
            }

            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaObservationTopic='" + kafkaObservationTopic + '\'' +
                ", kafkaIncidentTopic='" + kafkaIncidentTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", checkpointIntervalMs=" + checkpointIntervalMs +
                ", topologyPath='" + topologyPath + '\'' +
                ", settingsPath='" + settingsPath + '\'' +
                '}';
    }
}
