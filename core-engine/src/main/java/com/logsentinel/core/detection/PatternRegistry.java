package com.logsentinel.core.detection;

import com.logsentinel.core.config.DefaultPatterns;
import com.logsentinel.core.config.PatternLoadException;
import com.logsentinel.core.config.PatternLoadResult;
import com.logsentinel.core.config.PatternsLoader;
import com.logsentinel.core.model.AnomalyPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Owns the rule → category mappings and publishes them as immutable
 * {@link PatternSet} snapshots.
 *
 * <h3>Layers</h3>
 * <p>
 * Rules live in two ordered layers: defaults and custom. The published order
 * is every default rule in its registration order, with a custom category
 * substituted where a custom rule has the same source, followed by the
 * remaining custom rules in their own order.
 * </p>
 *
 * <h3>Atomicity</h3>
 * <p>
 * Every mutation validates its input, builds and compiles the next snapshot,
 * and only then swaps the layers and the published snapshot. A rejected
 * input leaves the registry exactly as it was. Mutations are serialised;
 * {@link #snapshot()} is lock-free.
 * </p>
 *
 * @since 1.0.0
 */
public class PatternRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(PatternRegistry.class);

    /** The catalogue {@link #loadDefaults()} installs. */
    private final Map<String, String> builtIns;

    private Map<String, String> defaults = new LinkedHashMap<>();
    private Map<String, String> custom = new LinkedHashMap<>();

    private final AtomicLong versions = new AtomicLong();
    private volatile PatternSet current = PatternSet.empty();

    /**
     * Create an empty registry whose defaults are the built-in catalogue.
     */
    public PatternRegistry() {
        this(DefaultPatterns.asMap());
    }

    /**
     * Create an empty registry with an explicit default catalogue.
     *
     * @param builtIns regex source → category installed by
     *                 {@link #loadDefaults()}; must not be {@code null}
     * @throws IllegalArgumentException if any entry is invalid
     */
    public PatternRegistry(Map<String, String> builtIns) {
        Objects.requireNonNull(builtIns, "Default patterns must not be null");
        try {
            PatternsLoader.fromMap(builtIns);
        } catch (PatternLoadException e) {
            throw new IllegalArgumentException("Invalid default patterns: " + e.getMessage(), e);
        }
        this.builtIns = Collections.unmodifiableMap(new LinkedHashMap<>(builtIns));
    }

    /**
     * Create a registry with the built-in catalogue already installed.
     *
     * @return registry with defaults loaded
     */
    public static PatternRegistry withDefaults() {
        PatternRegistry registry = new PatternRegistry();
        registry.loadDefaults();
        return registry;
    }

    // ---------------------------------------------------------------
    // Mutations
    // ---------------------------------------------------------------

    /**
     * Install the default catalogue. Calling it again when the defaults are
     * already in place publishes nothing new.
     *
     * @return the current snapshot
     */
    public synchronized PatternSet loadDefaults() {
        if (defaults.equals(builtIns)) {
            return current;
        }
        return commit(new LinkedHashMap<>(builtIns), custom, "defaults loaded");
    }

    /**
     * Load a custom pattern document, replacing the current custom rules.
     *
     * @param document YAML text
     * @return success with the number of rules loaded, or the rejection
     */
    public PatternLoadResult loadCustom(String document) {
        return replaceCustom(() -> PatternsLoader.fromString(document), "inline document");
    }

    /**
     * Load a custom pattern file, replacing the current custom rules.
     *
     * @param file YAML document on disk
     * @return success with the number of rules loaded, or the rejection
     */
    public PatternLoadResult loadCustom(Path file) {
        return replaceCustom(() -> PatternsLoader.fromFile(file), String.valueOf(file));
    }

    /**
     * Load custom rules from the resolved source: the given file when set,
     * otherwise {@code patterns.yml} on the classpath when present. With no
     * source at all the custom rules are cleared.
     *
     * @param explicitPath pattern file, or {@code null}/blank
     * @return success with the number of rules loaded, or the rejection
     * @see PatternsLoader#load(String)
     */
    public PatternLoadResult loadCustomResolved(String explicitPath) {
        return replaceCustom(() -> PatternsLoader.load(explicitPath),
                explicitPath != null && !explicitPath.isBlank() ? explicitPath : "resolved source");
    }

    /**
     * Add custom rules on top of the current ones. On a source collision the
     * incoming category wins, whether the existing rule is default or custom.
     *
     * @param patterns regex source → category, in registration order
     * @return success with the number of rules merged, or the rejection
     */
    public PatternLoadResult merge(Map<String, String> patterns) {
        List<AnomalyPattern> validated;
        try {
            validated = PatternsLoader.fromMap(patterns);
        } catch (PatternLoadException e) {
            LOG.warn("Rejected custom patterns: {}", e.getMessage());
            return PatternLoadResult.failure(e);
        }

        synchronized (this) {
            Map<String, String> nextCustom = new LinkedHashMap<>(custom);
            validated.forEach(p -> nextCustom.put(p.getSource(), p.getCategory()));
            commit(defaults, nextCustom, "merged " + validated.size() + " custom pattern(s)");
        }
        return PatternLoadResult.success(validated.size(),
                "Merged " + validated.size() + " custom pattern(s)");
    }

    /**
     * Register a single custom rule.
     *
     * @param source   regex source
     * @param category category label
     * @return success, or the rejection if the rule is invalid
     */
    public PatternLoadResult add(String source, String category) {
        Map<String, String> single = new LinkedHashMap<>();
        single.put(source, category);
        PatternLoadResult result = merge(single);
        return result.isSuccess()
                ? PatternLoadResult.success(1, "Added pattern: " + source + " -> " + category)
                : result;
    }

    /**
     * Replace a rule with an edited one. The edited rule is a custom rule and
     * is registered after the existing ones.
     *
     * @param oldSource   source of the rule to replace
     * @param newSource   new regex source
     * @param newCategory new category label
     * @return success, or the rejection if the old rule is unknown or the new
     *         one is invalid
     */
    public PatternLoadResult update(String oldSource, String newSource, String newCategory) {
        Map<String, String> single = new LinkedHashMap<>();
        single.put(newSource, newCategory);
        List<AnomalyPattern> validated;
        try {
            validated = PatternsLoader.fromMap(single);
        } catch (PatternLoadException e) {
            LOG.warn("Rejected edit of pattern '{}': {}", oldSource, e.getMessage());
            return PatternLoadResult.failure(e);
        }

        synchronized (this) {
            if (!defaults.containsKey(oldSource) && !custom.containsKey(oldSource)) {
                return PatternLoadResult.failure(
                        new PatternLoadException("Unknown pattern: '" + oldSource + "'", oldSource, null));
            }
            Map<String, String> nextDefaults = new LinkedHashMap<>(defaults);
            Map<String, String> nextCustom = new LinkedHashMap<>(custom);
            nextDefaults.remove(oldSource);
            nextCustom.remove(oldSource);
            AnomalyPattern edited = validated.get(0);
            nextCustom.put(edited.getSource(), edited.getCategory());
            commit(nextDefaults, nextCustom, "pattern '" + oldSource + "' edited");
        }
        return PatternLoadResult.success(1, "Updated pattern: " + newSource + " -> " + newCategory);
    }

    /**
     * Remove a rule from both layers.
     *
     * @param source regex source
     * @return {@code true} if a rule was removed
     */
    public synchronized boolean remove(String source) {
        if (!defaults.containsKey(source) && !custom.containsKey(source)) {
            return false;
        }
        Map<String, String> nextDefaults = new LinkedHashMap<>(defaults);
        Map<String, String> nextCustom = new LinkedHashMap<>(custom);
        nextDefaults.remove(source);
        nextCustom.remove(source);
        commit(nextDefaults, nextCustom, "pattern '" + source + "' removed");
        return true;
    }

    /**
     * Drop every custom rule and reinstall the default catalogue.
     *
     * @return the new snapshot
     */
    public synchronized PatternSet resetToDefaults() {
        return commit(new LinkedHashMap<>(builtIns), new LinkedHashMap<>(), "reset to defaults");
    }

    // ---------------------------------------------------------------
    // Inspection
    // ---------------------------------------------------------------

    /**
     * @return the published snapshot; scans should capture it once and use
     *         it throughout
     */
    public PatternSet snapshot() {
        return current;
    }

    /**
     * @return every rule of the published snapshot, in registration order
     */
    public List<AnomalyPattern> list() {
        return current.getPatterns();
    }

    /**
     * @return the custom rules of the published snapshot, in registration
     *         order
     */
    public List<AnomalyPattern> listCustom() {
        return current.getPatterns().stream()
                .filter(AnomalyPattern::isCustom)
                .toList();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private PatternLoadResult replaceCustom(Supplier<List<AnomalyPattern>> parser, String description) {
        List<AnomalyPattern> parsed;
        try {
            parsed = parser.get();
        } catch (PatternLoadException e) {
            LOG.warn("Custom patterns from {} not loaded, registry unchanged", description);
            return PatternLoadResult.failure(e);
        }

        synchronized (this) {
            Map<String, String> nextCustom = new LinkedHashMap<>();
            parsed.forEach(p -> nextCustom.put(p.getSource(), p.getCategory()));
            commit(defaults, nextCustom, "custom patterns loaded from " + description);
        }
        return PatternLoadResult.success(parsed.size(), "Loaded " + parsed.size() + " custom patterns");
    }

    /** Compile the merged view of the given layers, then publish it. */
    private PatternSet commit(Map<String, String> nextDefaults, Map<String, String> nextCustom, String reason) {
        List<AnomalyPattern> merged = new ArrayList<>(nextDefaults.size() + nextCustom.size());
        nextDefaults.forEach((source, category) -> {
            String override = nextCustom.get(source);
            merged.add(override != null
                    ? AnomalyPattern.custom(source, override)
                    : AnomalyPattern.builtIn(source, category));
        });
        nextCustom.forEach((source, category) -> {
            if (!nextDefaults.containsKey(source)) {
                merged.add(AnomalyPattern.custom(source, category));
            }
        });

        PatternSet next = PatternSet.of(versions.incrementAndGet(), merged);

        this.defaults = nextDefaults;
        this.custom = nextCustom;
        this.current = next;
        LOG.info("Published pattern set v{} ({}): {} pattern(s), {} default + {} custom",
                next.getVersion(), reason, next.size(), nextDefaults.size(), nextCustom.size());
        return next;
    }

    @Override
    public String toString() {
        return "PatternRegistry{current=" + current + '}';
    }
}
