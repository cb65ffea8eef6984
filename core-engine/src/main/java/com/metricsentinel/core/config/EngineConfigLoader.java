package com.metricsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads the engine's YAML configuration into an {@link EngineConfig}.
 *
 * <p>
 * A configuration file holds the scheduler and retention settings at the top
 * level plus two optional lists, {@code models} (parameter overrides for the
 * built-in detection models) and {@code patterns} (named detection
 * patterns). Keys left out keep their defaults; an empty document yields
 * the default configuration.
 * </p>
 *
 * <pre>
 * sweepIntervalSeconds: 30
 * seriesCapacity: 1000
 * models:
 *   - id: statistical-zscore
 *     parameters: { threshold: 3.0 }
 * patterns:
 *   - id: cpu-saturation
 *     name: CPU Saturation
 *     matchExpression: cpu_usage &gt; 95%
 *     severity: high
 * </pre>
 *
 * <p>
 * Duplicate keys are rejected. Every parsed document goes through
 * {@link EngineConfig#validate()}, so a loader call either returns a usable
 * configuration or throws {@link IllegalStateException} listing every
 * problem found.
 * </p>
 *
 * @since 1.0.0
 */
public final class EngineConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(EngineConfigLoader.class);

    /** Environment variable naming a configuration file on disk. */
    public static final String ENV_CONFIG_PATH = "ENGINE_CONFIG_PATH";

    /** Classpath resource used when no file is named. */
    public static final String DEFAULT_RESOURCE = "anomaly-engine.yml";

    private EngineConfigLoader() {
    }

    /**
     * Load the file named by {@value #ENV_CONFIG_PATH}, or the bundled
     * {@value #DEFAULT_RESOURCE} when the variable is unset.
     */
    public static EngineConfig load() {
        return load(System.getenv(ENV_CONFIG_PATH));
    }

    /**
     * Load {@code path} if one is given, otherwise the bundled
     * {@value #DEFAULT_RESOURCE}. A named file that does not exist is an
     * error, not a reason to fall back.
     *
     * @param path configuration file, may be {@code null} or blank
     */
    public static EngineConfig load(String path) {
        if (path != null && !path.isBlank()) {
            return fromFile(path);
        }
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if the file cannot be read, is not
     *                                  valid YAML or fails validation
     */
    public static EngineConfig fromFile(String path) {
        Objects.requireNonNull(path, "Engine configuration path must not be null");
        LOG.info("Loading engine configuration from file: {}", path);
        try (Reader reader = Files.newBufferedReader(Path.of(path), StandardCharsets.UTF_8)) {
            return parse(reader, path);
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Engine configuration file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read engine configuration file: " + path, e);
        }
    }

    /**
     * @throws IllegalArgumentException if no such resource is on the classpath
     * @throws IllegalStateException    if the resource is not valid YAML or
     *                                  fails validation
     */
    public static EngineConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = EngineConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        LOG.info("Loading engine configuration from classpath: {}", resource);
        try (Reader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
            return parse(reader, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read classpath resource: " + resource, e);
        }
    }

    /**
     * Parse an inline YAML document.
     *
     * @throws IllegalStateException if the document is not valid YAML or
     *                               fails validation
     */
    public static EngineConfig fromString(String yaml) {
        Objects.requireNonNull(yaml, "YAML document must not be null");
        return parse(new StringReader(yaml), "<inline>");
    }

    private static EngineConfig parse(Reader reader, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(EngineConfig.class, options));

        EngineConfig config;
        try {
            config = yaml.load(reader);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed engine configuration in " + source
                    + ": " + e.getMessage(), e);
        }
        if (config == null) {
            LOG.warn("Engine configuration {} is empty, using defaults", source);
            config = new EngineConfig();
        }
        config.validate();

        LOG.info("Engine configuration {}: {} model override(s), {} pattern(s)",
                source, config.getModels().size(), config.getPatterns().size());
        LOG.debug("Effective engine configuration: {}", config);
        return config;
    }
}
