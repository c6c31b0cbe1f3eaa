package com.phoenix.flink;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Builder defaults should be valid")
    void defaultsShouldBuild() {
        JobConfig config = new JobConfig.Builder().build();

        assertThat(config.getKafkaObservationTopic()).isEqualTo("telemetry");
        assertThat(config.getKafkaIncidentTopic()).isEqualTo("incidents");
        assertThat(config.getKafkaGroupId()).isEqualTo("phoenix");
        assertThat(config.getCheckpointIntervalMs()).isEqualTo(60_000);
        assertThat(config.getTopologyPath()).isEmpty();
        assertThat(config.getSettingsPath()).isEmpty();
    }

    @Test
    @DisplayName("Null paths should be normalised to blank")
    void nullPathsShouldBecomeBlank() {
        JobConfig config = new JobConfig.Builder()
                .topologyPath(null)
                .settingsPath(null)
                .build();

        assertThat(config.getTopologyPath()).isEmpty();
        assertThat(config.getSettingsPath()).isEmpty();
    }

    @Test
    @DisplayName("Should reject a blank incident topic")
    void shouldRejectBlankTopic() {
        assertThatThrownBy(() -> new JobConfig.Builder().kafkaIncidentTopic(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("kafkaIncidentTopic");
    }

    @Test
    @DisplayName("Should reject reading and writing the same topic")
    void shouldRejectSameTopic() {
        assertThatThrownBy(() -> new JobConfig.Builder()
                .kafkaObservationTopic("telemetry")
                .kafkaIncidentTopic("telemetry")
                .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must differ");
    }

    @Test
    @DisplayName("Should reject a non-positive checkpoint interval")
    void shouldRejectCheckpointInterval() {
        assertThatThrownBy(() -> new JobConfig.Builder().checkpointIntervalMs(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("checkpointIntervalMs");
    }
}
