package com.phoenix.core.topology;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates a {@link Topology} from JSON.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_TOPOLOGY_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <p>
 * A malformed topology is a configuration error: every {@code from*} method
 * validates after parsing and fails fast.
 * </p>
 *
 * @since 1.0.0
 */
public final class TopologyLoader {

    private static final Logger LOG = LoggerFactory.getLogger(TopologyLoader.class);

    /** Environment variable that can override the default topology location. */
    public static final String ENV_TOPOLOGY_PATH = "PHOENIX_TOPOLOGY_PATH";

    /** Classpath fallback used by {@link #load()}. */
    public static final String DEFAULT_RESOURCE = "topology.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private TopologyLoader() {
        // utility class, not instantiable
    }

    /**
     * Load the topology from {@code PHOENIX_TOPOLOGY_PATH} if it points at an
     * existing file, otherwise from {@value #DEFAULT_RESOURCE} on the classpath.
     *
     * @return parsed and validated topology
     */
    public static Topology load() {
        String envPath = System.getenv(ENV_TOPOLOGY_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading topology from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading topology from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path file system path to the JSON file
     * @return parsed and validated topology
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static Topology fromFile(String path) {
        Objects.requireNonNull(path, "Topology file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Topology file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read topology file: " + path, e);
        }
    }

    /**
     * @param resource classpath resource name
     * @return parsed and validated topology
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static Topology fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = TopologyLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    /**
     * @param json topology document
     * @return parsed and validated topology
     * @throws IllegalStateException if parsing or validation fails
     */
    public static Topology fromJson(String json) {
        Objects.requireNonNull(json, "Topology JSON must not be null");
        try {
            Topology topology = MAPPER.readValue(json, Topology.class);
            return validated(topology, "inline JSON");
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Malformed topology JSON: " + e.getOriginalMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static Topology parseAndValidate(InputStream is, String source) throws IOException {
        Topology topology;
        try {
            topology = MAPPER.readValue(is, Topology.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(
                    "Malformed topology JSON in " + source + ": " + e.getOriginalMessage(), e);
        }
        return validated(topology, source);
    }

    private static Topology validated(Topology topology, String source) {
        if (topology == null) {
            throw new IllegalStateException("Topology source is empty: " + source);
        }
        topology.validate();
        LOG.info("Loaded topology from {}: {} node(s), {} edge(s), {} critical",
                source, topology.getNodes().size(), topology.getEdges().size(),
                topology.criticalComponents().size());
        return topology;
    }
}
