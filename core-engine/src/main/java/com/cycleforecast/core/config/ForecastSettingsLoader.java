package com.cycleforecast.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Loads and validates {@link ForecastSettings} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <p>
 * {@link #resolve(String)} picks the first source that applies:
 * </p>
 * <ol>
 * <li>Configured file system path; it must exist</li>
 * <li>Environment variable {@value #ENV_CONFIG_PATH}, when it names an
 * existing file</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE}</li>
 * </ol>
 *
 * <p>
 * Every {@code from*} method validates after parsing so a bad configuration
 * fails at startup. An empty document yields the built-in defaults.
 * </p>
 *
 * @since 1.0.0
 */
public final class ForecastSettingsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ForecastSettingsLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "FORECAST_CONFIG_PATH";

    /** Classpath resource used when no path is configured. */
    public static final String DEFAULT_RESOURCE = "forecast.yml";

    private ForecastSettingsLoader() {
        // utility class - not instantiable
    }

    /**
     * Load settings without a configured path.
     *
     * @return parsed and validated settings
     * @throws IllegalStateException if validation fails
     * @see #resolve(String)
     */
    public static ForecastSettings load() {
        return resolve(null);
    }

    /**
     * Load settings from the first source in the resolution order.
     *
     * @param configuredPath file system path, or {@code null}/blank to fall
     *                       through to the environment and the classpath
     * @return parsed and validated settings
     * @throws IllegalArgumentException if {@code configuredPath} names a
     *                                  missing file
     * @throws IllegalStateException    if reading or validation fails
     */
    public static ForecastSettings resolve(String configuredPath) {
        return resolve(configuredPath, System::getenv);
    }

    static ForecastSettings resolve(String configuredPath, UnaryOperator<String> env) {
        if (configuredPath != null && !configuredPath.isBlank()) {
            LOG.info("Loading forecast settings from configured path: {}", configuredPath);
            return fromFile(configuredPath);
        }
        String envPath = env.apply(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank()) {
            if (Files.isRegularFile(Path.of(envPath))) {
                LOG.info("Loading forecast settings from {}: {}", ENV_CONFIG_PATH, envPath);
                return fromFile(envPath);
            }
            LOG.warn("{} points at missing file {}, falling back to classpath", ENV_CONFIG_PATH, envPath);
        }
        LOG.info("Loading forecast settings from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path YAML file path; must not be {@code null}
     * @return parsed and validated settings
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static ForecastSettings fromFile(String path) {
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
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated settings
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static ForecastSettings fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = ForecastSettingsLoader.class.getClassLoader().getResourceAsStream(resource);
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

    private static ForecastSettings parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(ForecastSettings.class, options));
        ForecastSettings settings = yaml.load(is);

        if (settings == null) {
            LOG.warn("Empty forecast settings document, using defaults");
            settings = new ForecastSettings();
        }
        settings.validate();

        LOG.info("Loaded {}", settings);
        return settings;
    }
}
