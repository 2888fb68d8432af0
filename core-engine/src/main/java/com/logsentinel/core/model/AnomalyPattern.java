package com.logsentinel.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A single classification rule: a regular expression and the anomaly category
 * assigned to lines it matches.
 *
 * <p>
 * The regex {@code source} is the identity of a pattern inside a registry;
 * two patterns with the same source are the same rule, whatever their
 * category. Instances are immutable.
 * </p>
 *
 * <p>
 * Matching is always case-insensitive, non-ASCII letters included
 * ({@link #REGEX_FLAGS}). Call
 * {@link #validate()} before registering a pattern that came from outside.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyPattern {

    /** Flags every rule is compiled with. */
    public static final int REGEX_FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private final String source;
    private final String category;
    private final PatternOrigin origin;

    /**
     * @param source   regex source; must not be {@code null}
     * @param category category label; must not be {@code null}
     * @param origin   default or custom; must not be {@code null}
     * @throws NullPointerException if any argument is {@code null}
     */
    public AnomalyPattern(String source, String category, PatternOrigin origin) {
        this.source = Objects.requireNonNull(source, "Pattern source must not be null");
        this.category = Objects.requireNonNull(category, "Pattern category must not be null");
        this.origin = Objects.requireNonNull(origin, "Pattern origin must not be null");
    }

    public static AnomalyPattern builtIn(String source, String category) {
        return new AnomalyPattern(source, category, PatternOrigin.DEFAULT);
    }

    public static AnomalyPattern custom(String source, String category) {
        return new AnomalyPattern(source, category, PatternOrigin.CUSTOM);
    }

    public String getSource() {
        return source;
    }

    public String getCategory() {
        return category;
    }

    public PatternOrigin getOrigin() {
        return origin;
    }

    public boolean isCustom() {
        return origin == PatternOrigin.CUSTOM;
    }

    /**
     * Compile this rule on its own.
     *
     * @return the compiled regex
     * @throws PatternSyntaxException if the source is not a valid regex
     */
    public Pattern compile() {
        return Pattern.compile(source, REGEX_FLAGS);
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that the source is a non-blank, compilable regex and the
     * category is non-blank.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (source.isBlank()) {
            errors.add("Pattern source must not be blank");
        } else {
            try {
                compile();
            } catch (PatternSyntaxException e) {
                errors.add("Invalid regex '" + source + "': " + e.getDescription()
                        + " near index " + e.getIndex());
            }
        }
        if (category.isBlank()) {
            errors.add("Category for pattern '" + source + "' must not be blank");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid AnomalyPattern: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyPattern that))
            return false;
        return source.equals(that.source)
                && category.equals(that.category)
                && origin == that.origin;
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, category, origin);
    }

    @Override
    public String toString() {
        return "AnomalyPattern{" +
                "source='" + source + '\'' +
                ", category='" + category + '\'' +
                ", origin=" + origin +
                '}';
    }
}
