package com.anomalybench.core.config;

import com.anomalybench.core.error.ConfigurationException;
import com.anomalybench.core.model.ExecutionType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Binds harness configuration to {@link AlgorithmArgs}.
 *
 * <h3>Sources</h3>
 * <ol>
 * <li>an inline JSON object, as passed by the harness on the command line
 * ({@link #fromJson(String, Algorithm)})</li>
 * <li>a YAML or JSON file ({@link #fromFile(Path, Algorithm)})</li>
 * <li>a classpath resource ({@link #fromClasspath(String, Algorithm)})</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * Unknown keys are rejected rather than silently dropped, integer parameters
 * only accept whole numbers, and every
 * {@code load*} method validates the result, so a run <strong>fails
 * fast</strong> before any data is touched.
 * </p>
 *
 * @since 1.0.0
 */
public final class ArgsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ArgsLoader.class);

    /** Environment variable naming a configuration file when no argument is given. */
    public static final String ENV_ARGS_PATH = "ANOMALYBENCH_ARGS_PATH";

    private static final Set<String> TOP_LEVEL_KEYS = Set.of(
            "executionType", "dataInput", "dataOutput", "modelInput", "modelOutput", "customParameters");

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .registerModule(IntegralNumberDeserializer.module());

    private ArgsLoader() {
        // utility class, not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Resolve a command-line argument: inline JSON when it starts with
     * <code>{</code>, otherwise a file path. A {@code null} argument falls
     * back to {@value #ENV_ARGS_PATH}.
     *
     * @param argument  raw argument, may be {@code null}
     * @param algorithm algorithm whose parameter schema applies
     * @return validated arguments
     * @throws ConfigurationException if nothing can be resolved or validation fails
     */
    public static AlgorithmArgs resolve(String argument, Algorithm algorithm) {
        if (argument == null || argument.isBlank()) {
            String envPath = System.getenv(ENV_ARGS_PATH);
            if (envPath == null || envPath.isBlank()) {
                throw new ConfigurationException("No configuration given and " + ENV_ARGS_PATH + " is not set");
            }
            LOG.info("Loading configuration from environment path: {}", envPath);
            return fromFile(Path.of(envPath), algorithm);
        }
        String trimmed = argument.trim();
        if (trimmed.startsWith("{")) {
            return fromJson(trimmed, algorithm);
        }
        return fromFile(Path.of(trimmed), algorithm);
    }

    /**
     * Bind an inline JSON configuration.
     *
     * @param json      JSON object text; must not be {@code null}
     * @param algorithm algorithm whose parameter schema applies
     * @return validated arguments
     * @throws ConfigurationException if the JSON is malformed or invalid
     */
    public static AlgorithmArgs fromJson(String json, Algorithm algorithm) {
        Objects.requireNonNull(json, "JSON configuration must not be null");
        Map<String, Object> raw;
        try {
            raw = MAPPER.readValue(json, new TypeReference<Map<String, Object>>() {
            });
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed JSON configuration: " + e.getOriginalMessage(), e);
        }
        return fromMap(raw, algorithm);
    }

    /**
     * Bind a YAML (or JSON) configuration file.
     *
     * @param path      file path; must not be {@code null}
     * @param algorithm algorithm whose parameter schema applies
     * @return validated arguments
     * @throws ConfigurationException if the file is missing, malformed or invalid
     * @throws IllegalStateException  if reading fails
     */
    public static AlgorithmArgs fromFile(Path path, Algorithm algorithm) {
        Objects.requireNonNull(path, "Configuration file path must not be null");
        try (InputStream is = Files.newInputStream(path)) {
            return fromMap(parseYaml(is, path.toString()), algorithm);
        } catch (NoSuchFileException e) {
            throw new ConfigurationException("Configuration file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read configuration file: " + path, e);
        }
    }

    /**
     * Bind a configuration held as a classpath resource.
     *
     * @param resource  classpath resource name; must not be {@code null}
     * @param algorithm algorithm whose parameter schema applies
     * @return validated arguments
     * @throws ConfigurationException if the resource is missing or invalid
     * @throws IllegalStateException  if reading fails
     */
    public static AlgorithmArgs fromClasspath(String resource, Algorithm algorithm) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = ArgsLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new ConfigurationException("Classpath resource not found: " + resource);
        }
        try (is) {
            return fromMap(parseYaml(is, resource), algorithm);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    /**
     * Bind an already-parsed configuration tree.
     *
     * @param raw       top-level configuration map
     * @param algorithm algorithm whose parameter schema applies
     * @return validated arguments
     * @throws ConfigurationException if keys are unknown or values invalid
     */
    public static AlgorithmArgs fromMap(Map<String, Object> raw, Algorithm algorithm) {
        Objects.requireNonNull(algorithm, "Algorithm must not be null");
        if (raw == null) {
            throw new ConfigurationException("Configuration is empty");
        }

        List<String> unknown = new ArrayList<>();
        for (String key : raw.keySet()) {
            if (!TOP_LEVEL_KEYS.contains(key)) {
                unknown.add(key);
            }
        }
        if (!unknown.isEmpty()) {
            throw new ConfigurationException("Unknown configuration key(s): " + unknown
                    + ". Supported: " + TOP_LEVEL_KEYS);
        }

        AlgorithmArgs args = AlgorithmArgs.builder(algorithm)
                .executionType(executionTypeValue(raw))
                .dataInput(pathValue(raw, "dataInput"))
                .dataOutput(pathValue(raw, "dataOutput"))
                .modelInput(pathValue(raw, "modelInput"))
                .modelOutput(pathValue(raw, "modelOutput"))
                .customParameters(bindParameters(raw.get("customParameters"), algorithm))
                .build();
        LOG.info("Config: {}", args);
        return args;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static Map<String, Object> parseYaml(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new SafeConstructor(options));
        Object loaded;
        try {
            loaded = yaml.load(is);
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed configuration in " + source + ": " + e.getMessage(), e);
        }
        if (!(loaded instanceof Map<?, ?> map)) {
            throw new ConfigurationException("Configuration in " + source + " must be a mapping");
        }
        return MAPPER.convertValue(map, new TypeReference<Map<String, Object>>() {
        });
    }

    private static DetectorParameters bindParameters(Object raw, Algorithm algorithm) {
        if (raw == null) {
            return algorithm.defaultParameters();
        }
        if (!(raw instanceof Map)) {
            throw new ConfigurationException("'customParameters' must be an object");
        }
        try {
            return MAPPER.convertValue(raw, algorithm.getParametersType());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid customParameters for '" + algorithm.getId() + "': "
                    + rootMessage(e), e);
        }
    }

    private static ExecutionType executionTypeValue(Map<String, Object> raw) {
        String value = stringValue(raw, "executionType");
        return value == null ? null : ExecutionType.parse(value);
    }

    private static String stringValue(Map<String, Object> raw, String key) {
        Object value = raw.get(key);
        return value == null ? null : value.toString();
    }

    private static Path pathValue(Map<String, Object> raw, String key) {
        String value = stringValue(raw, key);
        return value == null || value.isBlank() ? null : Path.of(value);
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }
}
