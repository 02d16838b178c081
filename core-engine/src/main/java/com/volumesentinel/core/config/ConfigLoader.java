package com.volumesentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.introspector.BeanAccess;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link MonitoringConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE}</li>
 * <li>Built-in defaults (medium sensitivity, no overrides)</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * Every parsed configuration is validated so that the run <strong>fails
 * fast</strong> on a bad preset or override.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "MONITORING_CONFIG_PATH";

    public static final String DEFAULT_RESOURCE = "monitoring.yml";

    private ConfigLoader() {
        // utility class: not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load the configuration using automatic resolution.
     *
     * @return parsed and validated configuration
     * @throws IllegalStateException if validation fails
     */
    public static MonitoringConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading monitoring config from environment path: {}", envPath);
            return fromFile(envPath);
        }
        if (ConfigLoader.class.getClassLoader().getResource(DEFAULT_RESOURCE) != null) {
            LOG.info("Loading monitoring config from classpath: {}", DEFAULT_RESOURCE);
            return fromClasspath(DEFAULT_RESOURCE);
        }
        LOG.info("No monitoring config found - using built-in presets");
        return new MonitoringConfig();
    }

    /**
     * @param path absolute or relative path to the YAML file
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static MonitoringConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Monitoring config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read monitoring config file: " + path, e);
        }
    }

    /**
     * @param resource classpath resource name
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static MonitoringConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = ConfigLoader.class.getClassLoader().getResourceAsStream(resource);
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

    private static MonitoringConfig parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(MonitoringConfig.class, options));
        // field access keeps YAML keys identical to field names (zScore)
        yaml.setBeanAccess(BeanAccess.FIELD);
        MonitoringConfig config = yaml.load(is);

        if (config == null) {
            LOG.warn("Monitoring configuration is empty - using built-in presets");
            config = new MonitoringConfig();
        }
        config.validate();

        LOG.info("Loaded monitoring config: default sensitivity '{}', {} custom preset(s), {} override(s)",
                config.getSensitivity(), config.getPresets().size(), config.getOverrides().size());
        return config;
    }
}
