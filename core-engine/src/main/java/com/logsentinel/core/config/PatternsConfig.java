package com.logsentinel.core.config;

import com.logsentinel.core.model.AnomalyPattern;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Top-level POJO for a custom pattern document.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * patterns:
 *   "ERROR|FAIL": GENERIC_ERROR
 *   Timeout: TIMEOUT
 * </pre>
 *
 * <p>
 * Keys are regex sources, values are category labels. Document order is
 * registration order. Call {@link #toCustomPatterns()} to validate the entries
 * and obtain them as {@link AnomalyPattern}s.
 * </p>
 *
 * @since 1.0.0
 */
public class PatternsConfig {

    /** Raw mapping as produced by SnakeYAML; validated lazily. */
    private Map<Object, Object> patterns;

    /**
     * @return unmodifiable raw mapping, or {@code null} if the document had no
     *         {@code patterns} key
     */
    public Map<Object, Object> getPatterns() {
        return patterns != null ? Collections.unmodifiableMap(patterns) : null;
    }

    /**
     * Set the raw mapping (used by SnakeYAML during deserialization).
     *
     * @param patterns regex source → category
     */
    public void setPatterns(Map<Object, Object> patterns) {
        this.patterns = patterns != null ? new LinkedHashMap<>(patterns) : null;
    }

    /**
     * Validate every entry and convert the mapping to custom patterns.
     *
     * <p>
     * All entries are checked; if any is invalid nothing is returned and the
     * exception lists every problem, naming the first rejected source as the
     * offending pattern.
     * </p>
     *
     * @return patterns in document order
     * @throws PatternLoadException if the mapping is missing or any entry is
     *                              invalid
     */
    public List<AnomalyPattern> toCustomPatterns() {
        if (patterns == null) {
            throw new PatternLoadException("Pattern document does not contain a 'patterns' mapping");
        }

        List<AnomalyPattern> result = new ArrayList<>(patterns.size());
        List<String> errors = new ArrayList<>();
        String firstOffender = null;

        for (Map.Entry<Object, Object> entry : patterns.entrySet()) {
            String source = entry.getKey() != null ? entry.getKey().toString() : "";
            Object value = entry.getValue();

            String error = null;
            if (!(value instanceof String || value instanceof Number || value instanceof Boolean)) {
                error = "Category for pattern '" + source + "' must be a plain string, got: "
                        + (value == null ? "nothing" : value.getClass().getSimpleName());
            } else {
                AnomalyPattern pattern = AnomalyPattern.custom(source, value.toString());
                try {
                    pattern.validate();
                    result.add(pattern);
                } catch (IllegalStateException e) {
                    error = e.getMessage();
                }
            }

            if (error != null) {
                errors.add(error);
                if (firstOffender == null) {
                    firstOffender = source;
                }
            }
        }

        if (!errors.isEmpty()) {
            throw new PatternLoadException(
                    "Pattern document rejected, " + errors.size() + " invalid entr"
                            + (errors.size() == 1 ? "y" : "ies") + ":\n  - "
                            + String.join("\n  - ", errors),
                    firstOffender, null);
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public String toString() {
        return "PatternsConfig{patterns=" + patterns + '}';
    }
}
