package com.logsentinel.core.detection;

import com.logsentinel.core.model.AnomalyPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Classifies a line against an ordered list of rules in one regex pass.
 *
 * <h3>Combined expression</h3>
 * <p>
 * Every rule becomes one alternative of a single expression:
 * </p>
 *
 * <pre>
 * (?=(?s:.*?)(?&lt;lsAlt0&gt;rule0))|(?=(?s:.*?)(?&lt;lsAlt1&gt;rule1))|...
 * </pre>
 *
 * <p>
 * The expression is evaluated once per line, anchored at the start. Each
 * alternative is a look-ahead that searches the whole line for its rule, and
 * the engine tries alternatives left to right, so the first one to succeed
 * is the earliest-registered rule that occurs anywhere in the line. That is
 * exactly the result of trying the rules one by one in registration order.
 * </p>
 *
 * <h3>Fallback</h3>
 * <p>
 * Rules using numeric back-references cannot be embedded (group numbers
 * shift), and rules declaring the same named group cannot share one
 * expression. For such sets, or whenever the combined expression does not
 * compile cleanly, the matcher evaluates the rules individually in
 * registration order. Results are the same, only slower.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Immutable. {@link #match(CharSequence)} may be called concurrently.
 * </p>
 *
 * @since 1.0.0
 */
public final class CompiledMatcher {

    private static final Logger LOG = LoggerFactory.getLogger(CompiledMatcher.class);

    /** Prefix of the named group that tags each alternative. */
    static final String GROUP_PREFIX = "lsAlt";

    /** A backslash-digit escape that is not itself escaped. */
    private static final Pattern NUMERIC_BACKREFERENCE = Pattern.compile("(?<!\\\\)(?:\\\\\\\\)*\\\\[1-9]");

    private static final CompiledMatcher EMPTY = new CompiledMatcher(List.of(), null, new int[0], List.of());

    private final List<AnomalyPattern> patterns;
    private final Pattern combined;
    private final int[] groupIndexes;
    private final List<Pattern> individual;

    private CompiledMatcher(List<AnomalyPattern> patterns, Pattern combined, int[] groupIndexes,
            List<Pattern> individual) {
        this.patterns = patterns;
        this.combined = combined;
        this.groupIndexes = groupIndexes;
        this.individual = individual;
    }

    /**
     * Compile the rules, in the given order.
     *
     * @param patterns rules in registration order; must not be {@code null}
     * @return a matcher reflecting exactly these rules
     * @throws PatternSyntaxException if a rule does not compile on its own
     */
    public static CompiledMatcher compile(List<AnomalyPattern> patterns) {
        Objects.requireNonNull(patterns, "patterns must not be null");
        if (patterns.isEmpty()) {
            return EMPTY;
        }

        List<AnomalyPattern> rules = List.copyOf(patterns);
        List<Pattern> compiled = new ArrayList<>(rules.size());
        for (AnomalyPattern rule : rules) {
            compiled.add(rule.compile());
        }

        String reason = combinationBlocker(rules);
        if (reason == null) {
            int[] groupIndexes = new int[rules.size()];
            StringBuilder expression = new StringBuilder();
            int group = 0;
            for (int i = 0; i < rules.size(); i++) {
                if (i > 0) {
                    expression.append('|');
                }
                expression.append("(?=(?s:.*?)(?<").append(GROUP_PREFIX).append(i).append('>')
                        .append(rules.get(i).getSource())
                        .append("))");
                groupIndexes[i] = ++group;
                group += compiled.get(i).matcher("").groupCount();
            }

            try {
                Pattern combined = Pattern.compile(expression.toString(), AnomalyPattern.REGEX_FLAGS);
                if (combined.matcher("").groupCount() == group) {
                    LOG.debug("Compiled {} rule(s) into one expression", rules.size());
                    return new CompiledMatcher(rules, combined, groupIndexes, List.of());
                }
                reason = "combined group count mismatch";
            } catch (PatternSyntaxException e) {
                reason = "combined expression does not compile: " + e.getDescription();
            }
        }

        LOG.warn("Evaluating {} rule(s) one by one ({})", rules.size(), reason);
        return new CompiledMatcher(rules, null, null, Collections.unmodifiableList(compiled));
    }

    /**
     * @return a matcher with no rules; it never matches
     */
    public static CompiledMatcher empty() {
        return EMPTY;
    }

    /**
     * Classify a line.
     *
     * @param line the line to classify; must not be {@code null}
     * @return the earliest-registered rule that matches, or empty
     */
    public Optional<PatternHit> match(CharSequence line) {
        Objects.requireNonNull(line, "line must not be null");
        if (combined != null) {
            Matcher m = combined.matcher(line);
            if (!m.lookingAt()) {
                return Optional.empty();
            }
            for (int i = 0; i < groupIndexes.length; i++) {
                if (m.start(groupIndexes[i]) >= 0) {
                    return Optional.of(hit(i, m.group(groupIndexes[i])));
                }
            }
            return Optional.empty();
        }

        for (int i = 0; i < individual.size(); i++) {
            Matcher m = individual.get(i).matcher(line);
            if (m.find()) {
                return Optional.of(hit(i, m.group()));
            }
        }
        return Optional.empty();
    }

    /**
     * @return the rules this matcher was compiled from, in order
     */
    public List<AnomalyPattern> getPatterns() {
        return patterns;
    }

    /**
     * @return {@code true} if lines are classified with the single combined
     *         expression, {@code false} in rule-by-rule fallback mode
     */
    public boolean isCombined() {
        return combined != null || patterns.isEmpty();
    }

    public boolean isEmpty() {
        return patterns.isEmpty();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private PatternHit hit(int index, String matchedText) {
        AnomalyPattern rule = patterns.get(index);
        return new PatternHit(rule.getCategory(), rule.getSource(), matchedText);
    }

    private static String combinationBlocker(List<AnomalyPattern> rules) {
        for (AnomalyPattern rule : rules) {
            if (NUMERIC_BACKREFERENCE.matcher(rule.getSource()).find()) {
                return "rule '" + rule.getSource() + "' uses a numeric back-reference";
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "CompiledMatcher{" +
                "rules=" + patterns.size() +
                ", combined=" + isCombined() +
                '}';
    }
}
