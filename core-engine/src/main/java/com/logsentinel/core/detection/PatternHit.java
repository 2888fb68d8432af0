package com.logsentinel.core.detection;

import java.util.Objects;

/**
 * The rule that classified a line: its category, its regex source and the
 * text it matched.
 *
 * @since 1.0.0
 */
public final class PatternHit {

    private final String category;
    private final String patternSource;
    private final String matchedText;

    PatternHit(String category, String patternSource, String matchedText) {
        this.category = Objects.requireNonNull(category, "category must not be null");
        this.patternSource = Objects.requireNonNull(patternSource, "patternSource must not be null");
        this.matchedText = matchedText != null ? matchedText : "";
    }

    public String getCategory() {
        return category;
    }

    public String getPatternSource() {
        return patternSource;
    }

    public String getMatchedText() {
        return matchedText;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PatternHit that))
            return false;
        return category.equals(that.category)
                && patternSource.equals(that.patternSource)
                && matchedText.equals(that.matchedText);
    }

    @Override
    public int hashCode() {
        return Objects.hash(category, patternSource, matchedText);
    }

    @Override
    public String toString() {
        return "PatternHit{" +
                "category='" + category + '\'' +
                ", patternSource='" + patternSource + '\'' +
                ", matchedText='" + matchedText + '\'' +
                '}';
    }
}
