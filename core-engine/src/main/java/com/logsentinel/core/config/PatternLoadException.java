package com.logsentinel.core.config;

import java.util.Optional;

/**
 * Raised when a pattern source is malformed or contains a rule that does not
 * compile.
 *
 * <p>
 * The registry converts it into a failed
 * {@link PatternLoadResult}; it never terminates the running process.
 * </p>
 *
 * @since 1.0.0
 */
public class PatternLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String offendingPattern;

    public PatternLoadException(String message) {
        this(message, null, null);
    }

    public PatternLoadException(String message, Throwable cause) {
        this(message, null, cause);
    }

    /**
     * @param message          description of every problem found
     * @param offendingPattern source of the first rejected entry, if the
     *                         failure is tied to one
     * @param cause            underlying parser or I/O failure, may be
     *                         {@code null}
     */
    public PatternLoadException(String message, String offendingPattern, Throwable cause) {
        super(message, cause);
        this.offendingPattern = offendingPattern;
    }

    /**
     * @return source of the first entry that was rejected, empty when the
     *         document as a whole is malformed
     */
    public Optional<String> getOffendingPattern() {
        return Optional.ofNullable(offendingPattern);
    }
}
