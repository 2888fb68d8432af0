package com.logsentinel.core.config;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Typed, immutable tuning options for folder scans.
 *
 * <p>
 * Use {@link #defaults()} or the {@link Builder}; the builder validates
 * inputs at {@link Builder#build()} time.
 * </p>
 *
 * <h3>Worker sizing</h3>
 * <p>
 * {@code workers = max(1, min(processors × workersPerProcessor, fileCount, maxWorkers))}.
 * Scanning is I/O-heavy, hence more workers than processors, while the cap
 * keeps huge jobs from flooding the machine.
 * </p>
 *
 * @since 1.0.0
 */
public final class ScanOptions {

    /** Extensions scanned when nothing else is configured. */
    public static final List<String> DEFAULT_EXTENSIONS = List.of(".log", ".txt", ".out");

    private final int workersPerProcessor;
    private final int maxWorkers;
    private final int lineBatchSize;
    private final Set<String> fileExtensions;
    private final boolean followLinks;

    private ScanOptions(Builder b) {
        this.workersPerProcessor = b.workersPerProcessor;
        this.maxWorkers = b.maxWorkers;
        this.lineBatchSize = b.lineBatchSize;
        this.fileExtensions = Collections.unmodifiableSet(new LinkedHashSet<>(b.fileExtensions));
        this.followLinks = b.followLinks;
    }

    public static ScanOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Derived values
    // ---------------------------------------------------------------

    /**
     * Compute the worker pool size for a scan.
     *
     * @param fileCount  number of files to scan
     * @param processors available processors
     * @return pool size, at least {@code 1}
     */
    public int workerCount(int fileCount, int processors) {
        long byCpu = (long) Math.max(1, processors) * workersPerProcessor;
        long bounded = Math.min(Math.min(byCpu, fileCount), maxWorkers);
        return (int) Math.max(1, bounded);
    }

    /**
     * @param file candidate file
     * @return {@code true} if the file name ends with one of the configured
     *         extensions (case-insensitive), or no extensions are configured
     */
    public boolean accepts(Path file) {
        if (fileExtensions.isEmpty()) {
            return true;
        }
        Path name = file.getFileName();
        if (name == null) {
            return false;
        }
        String lower = name.toString().toLowerCase(Locale.ROOT);
        for (String extension : fileExtensions) {
            if (lower.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public int getWorkersPerProcessor() {
        return workersPerProcessor;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public int getLineBatchSize() {
        return lineBatchSize;
    }

    /**
     * @return lower-case extensions including the dot; empty means every file
     */
    public Set<String> getFileExtensions() {
        return fileExtensions;
    }

    public boolean isFollowLinks() {
        return followLinks;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ScanOptions}.
     */
    public static class Builder {
        private int workersPerProcessor = 3;
        private int maxWorkers = 16;
        private int lineBatchSize = 1024;
        private Set<String> fileExtensions = new LinkedHashSet<>(DEFAULT_EXTENSIONS);
        private boolean followLinks = false;

        public Builder workersPerProcessor(int v) {
            this.workersPerProcessor = v;
            return this;
        }

        public Builder maxWorkers(int v) {
            this.maxWorkers = v;
            return this;
        }

        public Builder lineBatchSize(int v) {
            this.lineBatchSize = v;
            return this;
        }

        /**
         * Replace the extension filter. Entries are trimmed, lower-cased and
         * given a leading dot if they lack one; blank entries are ignored.
         *
         * @param extensions extensions to accept; empty accepts every file
         * @return this builder
         */
        public Builder fileExtensions(Iterable<String> extensions) {
            Objects.requireNonNull(extensions, "extensions must not be null");
            Set<String> normalised = new LinkedHashSet<>();
            for (String extension : extensions) {
                if (extension == null || extension.isBlank()) {
                    continue;
                }
                String e = extension.trim().toLowerCase(Locale.ROOT);
                normalised.add(e.startsWith(".") ? e : "." + e);
            }
            this.fileExtensions = normalised;
            return this;
        }

        public Builder allFiles() {
            this.fileExtensions = new LinkedHashSet<>();
            return this;
        }

        public Builder followLinks(boolean v) {
            this.followLinks = v;
            return this;
        }

        /**
         * Build and validate the options.
         *
         * @return validated {@link ScanOptions}
         * @throws IllegalArgumentException if any value is out of range
         */
        public ScanOptions build() {
            if (workersPerProcessor < 1) {
                throw new IllegalArgumentException(
                        "workersPerProcessor must be >= 1, got: " + workersPerProcessor);
            }
            if (maxWorkers < 1) {
                throw new IllegalArgumentException("maxWorkers must be >= 1, got: " + maxWorkers);
            }
            if (lineBatchSize < 1) {
                throw new IllegalArgumentException("lineBatchSize must be >= 1, got: " + lineBatchSize);
            }
            return new ScanOptions(this);
        }
    }

    @Override
    public String toString() {
        return "ScanOptions{" +
                "workersPerProcessor=" + workersPerProcessor +
                ", maxWorkers=" + maxWorkers +
                ", lineBatchSize=" + lineBatchSize +
                ", fileExtensions=" + fileExtensions +
                ", followLinks=" + followLinks +
                '}';
    }
}
