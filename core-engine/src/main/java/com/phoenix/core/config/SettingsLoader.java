package com.phoenix.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link EngineSettings} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_SETTINGS_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <p>
 * An empty document yields {@link EngineSettings#defaults()}. Everything else
 * is validated after parsing so the pipeline fails fast on bad tunables.
 * </p>
 *
 * @since 1.0.0
 */
public final class SettingsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SettingsLoader.class);

    /** Environment variable that can override the default settings location. */
    public static final String ENV_SETTINGS_PATH = "PHOENIX_SETTINGS_PATH";

    /** Classpath fallback used by {@link #load()}. */
    public static final String DEFAULT_RESOURCE = "phoenix.yml";

    private SettingsLoader() {
        // utility class, not instantiable
    }

    /**
     * Load settings from {@code PHOENIX_SETTINGS_PATH} if it points at an
     * existing file, otherwise from {@value #DEFAULT_RESOURCE} on the classpath.
     *
     * @return parsed and validated settings
     */
    public static EngineSettings load() {
        String envPath = System.getenv(ENV_SETTINGS_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading engine settings from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading engine settings from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path file system path to the YAML file
     * @return parsed and validated settings
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static EngineSettings fromFile(String path) {
        Objects.requireNonNull(path, "Settings file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Settings file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings file: " + path, e);
        }
    }

    /**
     * @param resource classpath resource name
     * @return parsed and validated settings
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static EngineSettings fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = SettingsLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static EngineSettings parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(EngineSettings.class, options));

        EngineSettings settings;
        try {
            settings = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed engine settings: " + e.getMessage(), e);
        }

        if (settings == null) {
            LOG.warn("Engine settings document is empty, using defaults");
            settings = EngineSettings.defaults();
        }
        settings.validate();

        LOG.info("Loaded {}", settings);
        return settings;
    }
}
