package com.logsentinel.core.detection;

import com.logsentinel.core.model.AnomalyPattern;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, versioned snapshot of a pattern registry: the ordered rules plus
 * the {@link CompiledMatcher} derived from exactly those rules.
 *
 * <p>
 * A snapshot is compiled once, when it is published, and is then shared
 * read-only by any number of concurrent scanners. Registry mutations publish
 * new snapshots and never touch existing ones.
 * </p>
 *
 * @since 1.0.0
 */
public final class PatternSet {

    private static final PatternSet EMPTY = new PatternSet(0, List.of(), CompiledMatcher.empty());

    private final long version;
    private final List<AnomalyPattern> patterns;
    private final CompiledMatcher matcher;
    private final Set<String> categories;

    private PatternSet(long version, List<AnomalyPattern> patterns, CompiledMatcher matcher) {
        this.version = version;
        this.patterns = patterns;
        this.matcher = matcher;
        Set<String> names = new LinkedHashSet<>();
        patterns.forEach(p -> names.add(p.getCategory()));
        this.categories = Collections.unmodifiableSet(names);
    }

    /**
     * Build and compile a snapshot.
     *
     * @param version  snapshot version
     * @param patterns rules in registration order; sources must be unique
     * @return the compiled snapshot
     * @throws IllegalArgumentException if two rules share a source
     * @throws java.util.regex.PatternSyntaxException if a rule does not compile
     */
    public static PatternSet of(long version, List<AnomalyPattern> patterns) {
        Objects.requireNonNull(patterns, "patterns must not be null");
        List<AnomalyPattern> copy = List.copyOf(patterns);
        Set<String> sources = new HashSet<>();
        for (AnomalyPattern p : copy) {
            if (!sources.add(p.getSource())) {
                throw new IllegalArgumentException("Duplicate pattern source: '" + p.getSource() + "'");
            }
        }
        return new PatternSet(version, copy, CompiledMatcher.compile(copy));
    }

    /**
     * Build an unversioned snapshot, mostly for tests and one-off use.
     *
     * @param patterns rules in registration order
     * @return the compiled snapshot, version {@code 0}
     */
    public static PatternSet of(List<AnomalyPattern> patterns) {
        return of(0, patterns);
    }

    /**
     * @return the snapshot with no rules, which never matches
     */
    public static PatternSet empty() {
        return EMPTY;
    }

    /**
     * Classify a line with this snapshot's compiled matcher.
     *
     * @param line line text
     * @return the winning rule, or empty
     */
    public Optional<PatternHit> match(CharSequence line) {
        return matcher.match(line);
    }

    /**
     * @param source regex source
     * @return the rule registered under {@code source}, if any
     */
    public Optional<AnomalyPattern> find(String source) {
        return patterns.stream().filter(p -> p.getSource().equals(source)).findFirst();
    }

    public long getVersion() {
        return version;
    }

    /**
     * @return unmodifiable rules in registration order
     */
    public List<AnomalyPattern> getPatterns() {
        return patterns;
    }

    public CompiledMatcher getMatcher() {
        return matcher;
    }

    /**
     * @return unmodifiable category names, in order of first registration
     */
    public Set<String> getCategories() {
        return categories;
    }

    public int size() {
        return patterns.size();
    }

    public boolean isEmpty() {
        return patterns.isEmpty();
    }

    @Override
    public String toString() {
        return "PatternSet{" +
                "version=" + version +
                ", patterns=" + patterns.size() +
                ", categories=" + categories.size() +
                '}';
    }
}
