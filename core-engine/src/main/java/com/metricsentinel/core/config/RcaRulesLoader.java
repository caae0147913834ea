package com.metricsentinel.core.config;

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
 * Loads and validates {@link RcaRulesConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Explicit file system path passed to {@link #load(String)} (normally
 * {@link SentinelConfig#getRulesPath()}, i.e. {@value #ENV_RULES_PATH})</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE}</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * All {@code load*} methods call {@link RcaRulesConfig#validate()} after
 * parsing so that a misconfigured rule set <strong>fails fast</strong> at
 * startup.
 * </p>
 *
 * @since 1.0.0
 */
public final class RcaRulesLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RcaRulesLoader.class);

    /** Environment variable that can override the default rules location. */
    public static final String ENV_RULES_PATH = "RCA_RULES_PATH";

    /** Rule set bundled with the library. */
    public static final String DEFAULT_RESOURCE = "rca-rules.yml";

    private RcaRulesLoader() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load rules from {@code path} when it names an existing file, otherwise
     * from the bundled classpath default.
     *
     * @param path file system path, may be {@code null} or blank
     * @return parsed and validated configuration
     * @throws IllegalStateException if parsing or validation fails
     */
    public static RcaRulesConfig load(String path) {
        if (path != null && !path.isBlank()) {
            if (Files.exists(Path.of(path))) {
                LOG.info("Loading RCA rules from path: {}", path);
                return fromFile(path);
            }
            LOG.warn("RCA rules file not found: path={} – using bundled {}", path, DEFAULT_RESOURCE);
        }
        LOG.info("Loading RCA rules from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @throws NullPointerException     if {@code path} is {@code null}
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static RcaRulesConfig fromFile(String path) {
        Objects.requireNonNull(path, "Rules file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Rules file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read rules file: " + path, e);
        }
    }

    /**
     * @throws NullPointerException     if {@code resource} is {@code null}
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static RcaRulesConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = RcaRulesLoader.class.getClassLoader().getResourceAsStream(resource);
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

    private static RcaRulesConfig parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(RcaRulesConfig.class, options));

        RcaRulesConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed RCA rules YAML: " + e.getMessage(), e);
        }

        if (config == null) {
            LOG.warn("No RCA rules defined in configuration");
            config = new RcaRulesConfig();
        }
        config.validate();

        LOG.info("Loaded RCA rules: rules={} correlations={}",
                config.getRules().size(), config.getCorrelations().size());
        return config;
    }
}
