package com.logsentinel.core.config;

import java.util.Objects;
import java.util.Optional;

/**
 * Recoverable outcome of a pattern registry mutation that takes external
 * input (document load, merge, add, edit).
 *
 * @since 1.0.0
 */
public final class PatternLoadResult {

    private final boolean success;
    private final int loadedCount;
    private final String message;
    private final String offendingPattern;

    private PatternLoadResult(boolean success, int loadedCount, String message, String offendingPattern) {
        this.success = success;
        this.loadedCount = loadedCount;
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.offendingPattern = offendingPattern;
    }

    public static PatternLoadResult success(int loadedCount, String message) {
        return new PatternLoadResult(true, loadedCount, message, null);
    }

    public static PatternLoadResult failure(PatternLoadException cause) {
        Objects.requireNonNull(cause, "cause must not be null");
        return new PatternLoadResult(false, 0, cause.getMessage(),
                cause.getOffendingPattern().orElse(null));
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * @return number of patterns accepted, {@code 0} on failure
     */
    public int getLoadedCount() {
        return loadedCount;
    }

    public String getMessage() {
        return message;
    }

    public Optional<String> getOffendingPattern() {
        return Optional.ofNullable(offendingPattern);
    }

    @Override
    public String toString() {
        return "PatternLoadResult{" +
                "success=" + success +
                ", loadedCount=" + loadedCount +
                ", message='" + message + '\'' +
                (offendingPattern != null ? ", offendingPattern='" + offendingPattern + '\'' : "") +
                '}';
    }
}
