package com.alertsentinel.core.config;

import com.alertsentinel.core.model.AlertDetectorsConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Loads an {@link AlertDetectorsConfig} from YAML or JSON.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * The tree shape is checked while parsing so that malformed configurations
 * <strong>fail fast</strong>. Detector parameters are validated when the
 * detectors are built.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(AlertConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "ALERT_DETECTORS_CONFIG_PATH";

    /** Classpath resource used when no path is configured. */
    public static final String DEFAULT_RESOURCE = "alert-detectors.yml";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private AlertConfigLoader() {
        // utility class — not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load using automatic resolution.
     *
     * <ol>
     * <li>If {@code ALERT_DETECTORS_CONFIG_PATH} is set and the file exists,
     * load from there.</li>
     * <li>Otherwise, fall back to {@value #DEFAULT_RESOURCE} on the classpath.</li>
     * </ol>
     *
     * @return parsed configuration
     */
    public static AlertDetectorsConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading alert detectors from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading alert detectors from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load from a YAML (or JSON) file.
     *
     * @param path path to the file; must not be {@code null}
     * @return parsed configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading fails
     */
    public static AlertDetectorsConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parse(new Yaml(new SafeConstructor(loaderOptions())).load(is), path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Alert detectors file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read alert detectors file: " + path, e);
        }
    }

    /**
     * Load from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading fails
     */
    public static AlertDetectorsConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = AlertConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parse(new Yaml(new SafeConstructor(loaderOptions())).load(is), resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    /**
     * @param yaml YAML document
     * @return parsed configuration
     */
    public static AlertDetectorsConfig fromYaml(String yaml) {
        Objects.requireNonNull(yaml, "YAML must not be null");
        return parse(new Yaml(new SafeConstructor(loaderOptions())).load(new StringReader(yaml)), "<yaml>");
    }

    /**
     * Parse the JSON form persisted by the alerting layer.
     *
     * @param json JSON document
     * @return parsed configuration
     * @throws IllegalArgumentException if the document is not valid JSON
     */
    public static AlertDetectorsConfig fromJson(String json) {
        Objects.requireNonNull(json, "JSON must not be null");
        try {
            Map<String, Object> tree = MAPPER.readValue(json, new TypeReference<Map<String, Object>>() {
            });
            return parse(tree, "<json>");
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid alert detectors JSON: " + e.getOriginalMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static LoaderOptions loaderOptions() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        return options;
    }

    private static AlertDetectorsConfig parse(Object document, String source) {
        if (!(document instanceof Map<?, ?> map)) {
            throw new IllegalStateException("Alert detectors config in " + source + " must be a map, got: " + document);
        }
        AlertDetectorsConfig config = AlertConfigParser.parse(map);
        if (config.getGroups().isEmpty()) {
            LOG.warn("No detectors defined in {}", source);
        }
        LOG.info("Loaded {} top-level detector node(s) from {}", config.getGroups().size(), source);
        return config;
    }
}
