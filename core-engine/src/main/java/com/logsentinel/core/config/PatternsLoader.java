package com.logsentinel.core.config;

import com.logsentinel.core.model.AnomalyPattern;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parses and validates custom pattern documents.
 *
 * <h3>Sources</h3>
 * <ul>
 * <li>a file system path via {@link #fromFile(Path)}</li>
 * <li>a classpath resource via {@link #fromClasspath(String)}</li>
 * <li>an in-memory document via {@link #fromString(String)}</li>
 * <li>an in-memory mapping via {@link #fromMap(Map)}</li>
 * </ul>
 *
 * <h3>Safety</h3>
 * <p>
 * Documents are data, never code: SnakeYAML only builds a
 * {@link PatternsConfig} and plain maps/scalars from them, global tags are
 * refused and duplicate keys are rejected.
 * </p>
 *
 * <h3>Validation</h3>
 * <p>
 * Every entry is validated before anything is returned, so a document with a
 * single bad regex yields no patterns at all.
 * </p>
 *
 * @since 1.0.0
 */
public final class PatternsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(PatternsLoader.class);

    /** Environment variable naming a custom pattern file. */
    public static final String ENV_PATTERNS_PATH = "PATTERNS_CONFIG_PATH";

    /** Classpath resource used when no file is configured. */
    public static final String DEFAULT_RESOURCE = "patterns.yml";

    private PatternsLoader() {
        // utility class: not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load custom patterns using automatic resolution.
     *
     * <ol>
     * <li>If {@code PATTERNS_CONFIG_PATH} is set, load that file.</li>
     * <li>Otherwise load {@code patterns.yml} from the classpath if it is
     * present.</li>
     * <li>Otherwise there are no custom patterns.</li>
     * </ol>
     *
     * @return validated custom patterns, possibly empty
     * @throws PatternLoadException if the resolved source is invalid
     */
    public static List<AnomalyPattern> load() {
        return load(System.getenv(ENV_PATTERNS_PATH));
    }

    /**
     * Same as {@link #load()} with an explicit file taking the place of the
     * environment variable.
     *
     * @param explicitPath pattern file, or {@code null}/blank for the
     *                     classpath fallback
     * @return validated custom patterns, possibly empty
     * @throws PatternLoadException if the resolved source is invalid
     */
    public static List<AnomalyPattern> load(String explicitPath) {
        if (explicitPath != null && !explicitPath.isBlank()) {
            LOG.info("Loading custom patterns from file: {}", explicitPath);
            return fromFile(Path.of(explicitPath));
        }
        if (PatternsLoader.class.getClassLoader().getResource(DEFAULT_RESOURCE) != null) {
            LOG.info("Loading custom patterns from classpath: {}", DEFAULT_RESOURCE);
            return fromClasspath(DEFAULT_RESOURCE);
        }
        LOG.debug("No custom pattern source configured");
        return List.of();
    }

    /**
     * Load patterns from a file system path.
     *
     * @param path YAML document; must not be {@code null}
     * @return validated custom patterns in document order
     * @throws NullPointerException if {@code path} is {@code null}
     * @throws PatternLoadException if the file is missing, unreadable,
     *                              malformed or contains an invalid entry
     */
    public static List<AnomalyPattern> fromFile(Path path) {
        Objects.requireNonNull(path, "Pattern file path must not be null");
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parseAndValidate(reader, path.toString());
        } catch (NoSuchFileException e) {
            throw new PatternLoadException("Pattern file not found: " + path, e);
        } catch (IOException e) {
            throw new PatternLoadException("Failed to read pattern file: " + path, e);
        }
    }

    /**
     * Load patterns from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return validated custom patterns in document order
     * @throws NullPointerException if {@code resource} is {@code null}
     * @throws PatternLoadException if the resource is missing, malformed or
     *                              contains an invalid entry
     */
    public static List<AnomalyPattern> fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = PatternsLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new PatternLoadException("Classpath resource not found: " + resource);
        }
        try (Reader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
            return parseAndValidate(reader, "classpath:" + resource);
        } catch (IOException e) {
            throw new PatternLoadException("Failed to read classpath resource: " + resource, e);
        }
    }

    /**
     * Load patterns from an in-memory document.
     *
     * @param document YAML text; must not be {@code null}
     * @return validated custom patterns in document order
     * @throws PatternLoadException if the document is malformed or contains an
     *                              invalid entry
     */
    public static List<AnomalyPattern> fromString(String document) {
        Objects.requireNonNull(document, "Pattern document must not be null");
        return parseAndValidate(new StringReader(document), "inline document");
    }

    /**
     * Validate an in-memory regex source → category mapping.
     *
     * @param patterns mapping in registration order; must not be {@code null}
     * @return validated custom patterns in iteration order
     * @throws PatternLoadException if any entry is invalid
     */
    public static List<AnomalyPattern> fromMap(Map<String, String> patterns) {
        Objects.requireNonNull(patterns, "Pattern mapping must not be null");
        PatternsConfig config = new PatternsConfig();
        config.setPatterns(new LinkedHashMap<Object, Object>(patterns));
        return config.toCustomPatterns();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static List<AnomalyPattern> parseAndValidate(Reader reader, String description) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(PatternsConfig.class, options));

        PatternsConfig config;
        try {
            config = yaml.load(reader);
        } catch (YAMLException e) {
            LOG.warn("Malformed pattern document {}: {}", description, e.getMessage());
            throw new PatternLoadException(
                    "Malformed pattern document " + description + ": " + e.getMessage(), e);
        }

        if (config == null) {
            throw new PatternLoadException("Pattern document " + description + " is empty");
        }

        try {
            List<AnomalyPattern> patterns = config.toCustomPatterns();
            LOG.info("Parsed {} custom pattern(s) from {}", patterns.size(), description);
            return patterns;
        } catch (PatternLoadException e) {
            LOG.warn("Rejected pattern document {}: {}", description, e.getMessage());
            throw e;
        }
    }
}
