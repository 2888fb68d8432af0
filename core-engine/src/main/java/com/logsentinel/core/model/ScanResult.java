package com.logsentinel.core.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of scanning one file.
 *
 * <p>
 * Exactly one of three shapes:
 * </p>
 * <ul>
 * <li>completed, no error: the whole file was read</li>
 * <li>completed, with {@link FileAccessError}: the file could not be read;
 * {@code matches} is empty</li>
 * <li>cancelled: the scan was stopped; {@code matches} holds what was found
 * before the signal</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class ScanResult {

    private final Path filePath;
    private final List<AnomalyMatch> matches;
    private final FileAccessError error;
    private final ScanStatus status;

    private ScanResult(Path filePath, List<AnomalyMatch> matches, FileAccessError error, ScanStatus status) {
        this.filePath = Objects.requireNonNull(filePath, "filePath must not be null");
        this.matches = List.copyOf(Objects.requireNonNull(matches, "matches must not be null"));
        this.error = error;
        this.status = Objects.requireNonNull(status, "status must not be null");
    }

    // ---------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------

    public static ScanResult completed(Path filePath, List<AnomalyMatch> matches) {
        return new ScanResult(filePath, matches, null, ScanStatus.COMPLETED);
    }

    public static ScanResult cancelled(Path filePath, List<AnomalyMatch> matches) {
        return new ScanResult(filePath, matches, null, ScanStatus.CANCELLED);
    }

    public static ScanResult failed(Path filePath, FileAccessError error) {
        Objects.requireNonNull(error, "error must not be null");
        return new ScanResult(filePath, List.of(), error, ScanStatus.COMPLETED);
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public Path getFilePath() {
        return filePath;
    }

    /**
     * @return unmodifiable matches in line order
     */
    public List<AnomalyMatch> getMatches() {
        return matches;
    }

    public Optional<FileAccessError> getError() {
        return Optional.ofNullable(error);
    }

    public ScanStatus getStatus() {
        return status;
    }

    public boolean isFailed() {
        return error != null;
    }

    public boolean isCancelled() {
        return status == ScanStatus.CANCELLED;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ScanResult that))
            return false;
        return filePath.equals(that.filePath)
                && matches.equals(that.matches)
                && Objects.equals(error, that.error)
                && status == that.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(filePath, matches, error, status);
    }

    @Override
    public String toString() {
        return "ScanResult{" +
                "filePath=" + filePath +
                ", matches=" + matches.size() +
                ", error=" + error +
                ", status=" + status +
                '}';
    }
}
