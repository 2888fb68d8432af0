package com.logsentinel.core.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Record of a file that could not be opened or read during a scan.
 *
 * <p>
 * Deliberately a value rather than a {@link Throwable}: it is folded into the
 * per-file {@link ScanResult} and never propagates past the scan orchestrator.
 * </p>
 *
 * @since 1.0.0
 */
public final class FileAccessError {

    private final Path filePath;
    private final String errorType;
    private final String message;

    public FileAccessError(Path filePath, String errorType, String message) {
        this.filePath = Objects.requireNonNull(filePath, "filePath must not be null");
        this.errorType = Objects.requireNonNull(errorType, "errorType must not be null");
        this.message = message != null ? message : "";
    }

    /**
     * Describe the failure of {@code filePath} from the exception that caused it.
     *
     * @param filePath the file that failed
     * @param cause    the I/O (or other) failure
     * @return a new error record
     */
    public static FileAccessError of(Path filePath, Throwable cause) {
        Objects.requireNonNull(cause, "cause must not be null");
        return new FileAccessError(filePath, cause.getClass().getSimpleName(), cause.getMessage());
    }

    public Path getFilePath() {
        return filePath;
    }

    /**
     * @return simple class name of the underlying exception, e.g.
     *         {@code AccessDeniedException}
     */
    public String getErrorType() {
        return errorType;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FileAccessError that))
            return false;
        return filePath.equals(that.filePath)
                && errorType.equals(that.errorType)
                && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(filePath, errorType, message);
    }

    @Override
    public String toString() {
        return "FileAccessError{" +
                "filePath=" + filePath +
                ", errorType='" + errorType + '\'' +
                ", message='" + message + '\'' +
                '}';
    }
}
