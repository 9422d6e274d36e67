package com.seasonalesd.core.config;

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
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads {@link DetectionConfig} from YAML.
 *
 * <h3>Sources</h3>
 * <ul>
 * <li>{@link #load()}: the file named by {@value #ENV_CONFIG_PATH} when it
 * exists, else the classpath resource {@value #DEFAULT_RESOURCE}</li>
 * <li>{@link #fromFile(Path)}: a file on disk</li>
 * <li>{@link #fromClasspath(String)}: a resource of this class loader</li>
 * <li>{@link #fromReader(Reader, String)}: any character stream</li>
 * </ul>
 *
 * <p>
 * Every source is parsed as UTF-8 with duplicate keys rejected, then
 * {@link DetectionConfig#validate() validated}. A document with no profiles
 * yields an empty configuration. Syntax errors surface as
 * {@link IllegalStateException} naming the source.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionConfigLoader.class);

    /** Environment variable naming a profile file that overrides the default. */
    public static final String ENV_CONFIG_PATH = "ESD_CONFIG_PATH";

    /** Classpath resource used when no override file is present. */
    public static final String DEFAULT_RESOURCE = "detection.yml";

    private DetectionConfigLoader() {
        // utility class, not instantiable
    }

    /**
     * Load from the override file if configured, else from the bundled
     * profiles.
     *
     * @return parsed and validated configuration
     */
    public static DetectionConfig load() {
        Optional<Path> override = overridePath(System.getenv(ENV_CONFIG_PATH));
        if (override.isPresent()) {
            return fromFile(override.get());
        }
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @see #fromFile(Path)
     */
    public static DetectionConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        return fromFile(Path.of(path));
    }

    /**
     * @param path YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws UncheckedIOException     if the file cannot be read
     * @throws IllegalStateException    if the YAML is malformed or a profile
     *                                  is invalid
     */
    public static DetectionConfig fromFile(Path path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return fromReader(reader, path.toString());
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Config file not found: " + path, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read config file: " + path, e);
        }
    }

    /**
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if the YAML is malformed or a profile
     *                                  is invalid
     */
    public static DetectionConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = DetectionConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (Reader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
            return fromReader(reader, "classpath:" + resource);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read classpath resource: " + resource, e);
        }
    }

    /**
     * Parse and validate profiles from a character stream. The reader is not
     * closed.
     *
     * @param reader YAML text; must not be {@code null}
     * @param source description of the origin, used in log and error messages
     * @return parsed and validated configuration
     * @throws IllegalStateException if the YAML is malformed or a profile is
     *                               invalid
     */
    public static DetectionConfig fromReader(Reader reader, String source) {
        Objects.requireNonNull(reader, "Reader must not be null");

        DetectionConfig config;
        try {
            config = newYaml().load(reader);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed detection config " + source + ": " + e.getMessage(), e);
        }

        if (config == null || config.getProfiles().isEmpty()) {
            LOG.warn("No detection profiles defined in {}", source);
            return new DetectionConfig();
        }
        config.validate();
        LOG.info("Loaded detection profiles {} from {}", config.getProfileNames(), source);
        return config;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    static Optional<Path> overridePath(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        Path path = Path.of(value.trim());
        if (!Files.isRegularFile(path)) {
            LOG.warn("{} points to {}, which is not a file; using classpath:{}",
                    ENV_CONFIG_PATH, path, DEFAULT_RESOURCE);
            return Optional.empty();
        }
        return Optional.of(path);
    }

    private static Yaml newYaml() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        return new Yaml(new Constructor(DetectionConfig.class, options));
    }
}
