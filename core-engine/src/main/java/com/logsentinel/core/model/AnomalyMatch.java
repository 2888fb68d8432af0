package com.logsentinel.core.model;

import java.util.Objects;

/**
 * One classified log line.
 *
 * <p>
 * Produced by the line scanner when a line satisfies a rule of the pattern
 * snapshot in use. The {@code category} is always one of that snapshot's
 * categories and {@code matchedPattern} is the regex source of the winning
 * rule. Instances are immutable.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyMatch {

    private final long lineNumber;
    private final String lineText;
    private final String category;
    private final String matchedPattern;
    private final String matchedText;

    /**
     * @param lineNumber     1-based line number
     * @param lineText       the line as read, without its terminator
     * @param category       category of the winning rule
     * @param matchedPattern regex source of the winning rule
     * @param matchedText    the part of the line the rule matched
     * @throws IllegalArgumentException if {@code lineNumber < 1}
     * @throws NullPointerException     if any text argument is {@code null}
     */
    public AnomalyMatch(long lineNumber, String lineText, String category,
            String matchedPattern, String matchedText) {
        if (lineNumber < 1) {
            throw new IllegalArgumentException("lineNumber must be >= 1, got: " + lineNumber);
        }
        this.lineNumber = lineNumber;
        this.lineText = Objects.requireNonNull(lineText, "lineText must not be null");
        this.category = Objects.requireNonNull(category, "category must not be null");
        this.matchedPattern = Objects.requireNonNull(matchedPattern, "matchedPattern must not be null");
        this.matchedText = Objects.requireNonNull(matchedText, "matchedText must not be null");
    }

    public long getLineNumber() {
        return lineNumber;
    }

    public String getLineText() {
        return lineText;
    }

    public String getCategory() {
        return category;
    }

    public String getMatchedPattern() {
        return matchedPattern;
    }

    public String getMatchedText() {
        return matchedText;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyMatch that))
            return false;
        return lineNumber == that.lineNumber
                && lineText.equals(that.lineText)
                && category.equals(that.category)
                && matchedPattern.equals(that.matchedPattern)
                && matchedText.equals(that.matchedText);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lineNumber, lineText, category, matchedPattern, matchedText);
    }

    @Override
    public String toString() {
        return "AnomalyMatch{" +
                "line=" + lineNumber +
                ", category='" + category + '\'' +
                ", matchedPattern='" + matchedPattern + '\'' +
                ", lineText='" + lineText + '\'' +
                '}';
    }
}
