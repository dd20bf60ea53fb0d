package com.hostsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Function;

/**
 * Finds the engine's YAML configuration and turns it into a validated
 * {@link MonitorConfig}.
 *
 * <h3>Where the configuration comes from</h3>
 * <p>
 * {@link #resolve()} settles on exactly one {@link ConfigSource}:
 * </p>
 * <ol>
 * <li>{@link ConfigSource#ENVIRONMENT}: {@value #ENV_CONFIG_PATH} names a
 * file. The file must exist; a dangling override is an error rather than a
 * silent fall-through.</li>
 * <li>{@link ConfigSource#CLASSPATH}: {@value #DEFAULT_RESOURCE} is visible to
 * the loader's class loader.</li>
 * <li>{@link ConfigSource#DEFAULTS}: neither is present, so every setting
 * keeps its built-in value.</li>
 * </ol>
 * <p>
 * A document that parses to nothing (empty file, comments only) also yields
 * the built-in values, but the reported source stays the one that was read.
 * </p>
 *
 * <h3>Validation</h3>
 * <p>
 * Whatever the source, {@link MonitorConfig#validate()} runs before the
 * configuration is returned, so a bad value fails at startup.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Environment variable naming a configuration file. */
    public static final String ENV_CONFIG_PATH = "HOST_SENTINEL_CONFIG";

    /** Classpath resource consulted when the environment variable is unset. */
    public static final String DEFAULT_RESOURCE = "host-sentinel.yml";

    /** The place a configuration was taken from. */
    public enum ConfigSource {
        ENVIRONMENT,
        CLASSPATH,
        DEFAULTS
    }

    private final Function<String, String> environment;
    private final ClassLoader classLoader;

    /**
     * @param environment lookup for environment variables, usually {@code System::getenv}
     * @param classLoader class loader searched for {@value #DEFAULT_RESOURCE}
     */
    public ConfigLoader(Function<String, String> environment, ClassLoader classLoader) {
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader must not be null");
    }

    /**
     * Resolve against the process environment and this library's class loader.
     *
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if {@value #ENV_CONFIG_PATH} names a missing file
     * @throws IllegalStateException    if parsing or validation fails
     */
    public static MonitorConfig load() {
        return new ConfigLoader(System::getenv, ConfigLoader.class.getClassLoader()).resolve().getConfig();
    }

    /**
     * Pick the first available source and load from it.
     *
     * @return the configuration together with where it came from
     * @throws IllegalArgumentException if {@value #ENV_CONFIG_PATH} names a missing file
     * @throws IllegalStateException    if parsing or validation fails
     */
    public LoadedConfig resolve() {
        String override = environment.apply(ENV_CONFIG_PATH);
        if (override != null && !override.isBlank()) {
            Path path = Path.of(override.trim());
            if (!Files.isRegularFile(path)) {
                throw new IllegalArgumentException(ENV_CONFIG_PATH + " points to a missing file: " + path);
            }
            return loaded(fromFile(path.toString()), ConfigSource.ENVIRONMENT, path.toString());
        }
        if (classLoader.getResource(DEFAULT_RESOURCE) != null) {
            return loaded(readResource(classLoader, DEFAULT_RESOURCE), ConfigSource.CLASSPATH, DEFAULT_RESOURCE);
        }
        return loaded(defaults(), ConfigSource.DEFAULTS, "built-in");
    }

    /**
     * Load configuration from a file system path.
     *
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static MonitorConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = Files.newInputStream(Path.of(path))) {
            return parse(is, path);
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config file: " + path, e);
        }
    }

    /**
     * Load configuration from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static MonitorConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        return readResource(ConfigLoader.class.getClassLoader(), resource);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static MonitorConfig readResource(ClassLoader loader, String resource) {
        InputStream is = loader.getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parse(is, "classpath:" + resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    private static MonitorConfig parse(InputStream is, String origin) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        MonitorConfig parsed;
        try {
            parsed = new Yaml(new Constructor(MonitorConfig.class, options)).load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed configuration in " + origin + ": " + e.getMessage(), e);
        }
        if (parsed == null) {
            LOG.warn("{} has no settings, using built-in values", origin);
            return defaults();
        }
        if (parsed.getAlertThresholds().isEmpty()) {
            LOG.warn("{} defines no alert thresholds; threshold alerts are disabled", origin);
        }
        parsed.validate();
        return parsed;
    }

    private static MonitorConfig defaults() {
        MonitorConfig config = new MonitorConfig();
        config.validate();
        return config;
    }

    private static LoadedConfig loaded(MonitorConfig config, ConfigSource source, String location) {
        LOG.info("Configuration from {} ({}): interval={}s, {} alert threshold(s)", source, location,
                config.getMonitoringIntervalSeconds(), config.getAlertThresholds().size());
        return new LoadedConfig(config, source, location);
    }

    /**
     * A validated configuration and the source it was resolved from.
     */
    public static final class LoadedConfig {

        private final MonitorConfig config;
        private final ConfigSource source;
        private final String location;

        LoadedConfig(MonitorConfig config, ConfigSource source, String location) {
            this.config = config;
            this.source = source;
            this.location = location;
        }

        public MonitorConfig getConfig() {
            return config;
        }

        public ConfigSource getSource() {
            return source;
        }

        /** File path, resource name, or {@code "built-in"}. */
        public String getLocation() {
            return location;
        }
    }
}
