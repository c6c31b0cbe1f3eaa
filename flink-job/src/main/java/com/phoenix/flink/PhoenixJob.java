package com.phoenix.flink;

import com.phoenix.core.config.EngineSettings;
import com.phoenix.core.config.SettingsLoader;
import com.phoenix.core.model.Incident;
import com.phoenix.core.model.Observation;
import com.phoenix.core.topology.Topology;
import com.phoenix.core.topology.TopologyLoader;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Main entry point for the Phoenix Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (telemetry topic)
 *     → Deserialize JSON → Observation
 *     → IncidentProcessFunction (parallelism 1: baseline, deviation, correlation, escalation)
 *     → Serialize Incident → JSON
 *     → Kafka (incidents topic)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Job wiring comes from environment variables via {@link JobConfig}. Engine
 * tunables and the topology are loaded and validated here, before the job
 * graph is built, so a bad file fails the submission rather than a task.
 * </p>
 *
 * @since 1.0.0
 */
public final class PhoenixJob {

    private static final Logger LOG = LoggerFactory.getLogger(PhoenixJob.class);

    private PhoenixJob() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) throws Exception {
        JobConfig config = JobConfig.fromEnvironment();
        LOG.info("Starting Phoenix with config: {}", config);

        EngineSettings settings = loadSettings(config);
        Topology topology = loadTopology(config);

        StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
        configureCheckpointing(env, config);

        buildPipeline(env, config, settings, topology);

        env.execute("Phoenix - Incident Escalation");
    }

    /**
     * Build the Kafka → Flink → Kafka pipeline.
     */
    static void buildPipeline(StreamExecutionEnvironment env,
            JobConfig config,
            EngineSettings settings,
            Topology topology) {
        KafkaSource<Observation> source = KafkaSource.<Observation>builder()
                .setBootstrapServers(config.getKafkaBootstrapServers())
                .setTopics(config.getKafkaObservationTopic())
                .setGroupId(config.getKafkaGroupId())
                .setStartingOffsets(OffsetsInitializer.latest())
                .setValueOnlyDeserializer(new ObservationDeserializationSchema())
                .build();

        // Processing time only: the engine stamps wall-clock time itself.
        DataStream<Observation> observations = env.fromSource(
                source,
                WatermarkStrategy.noWatermarks(),
                "kafka-telemetry-source");

        DataStream<Incident> incidents = observations
                .filter(Objects::nonNull) // drop deserialization failures
                .name("drop-malformed")
                .process(new IncidentProcessFunction(settings, topology))
                .name("incident-pipeline")
                .setParallelism(1)
                .setMaxParallelism(1);

        KafkaSink<Incident> sink = KafkaSink.<Incident>builder()
                .setBootstrapServers(config.getKafkaBootstrapServers())
                .setRecordSerializer(
                        KafkaRecordSerializationSchema.builder()
                                .setTopic(config.getKafkaIncidentTopic())
                                .setValueSerializationSchema(new IncidentSerializationSchema())
                                .build())
                .build();

        incidents.sinkTo(sink).name("kafka-incidents-sink");
    }

    private static EngineSettings loadSettings(JobConfig config) {
        String path = config.getSettingsPath();
        return path.isBlank() ? SettingsLoader.load() : SettingsLoader.fromFile(path);
    }

    private static Topology loadTopology(JobConfig config) {
        String path = config.getTopologyPath();
        return path.isBlank() ? TopologyLoader.load() : TopologyLoader.fromFile(path);
    }

    private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
        long interval = config.getCheckpointIntervalMs();
        env.enableCheckpointing(interval, CheckpointingMode.AT_LEAST_ONCE);

        CheckpointConfig cpConfig = env.getCheckpointConfig();
        cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
        cpConfig.setCheckpointTimeout(interval * 2);
        cpConfig.setMaxConcurrentCheckpoints(1);
    }
}
