package com.logsentinel.job;

import com.logsentinel.core.config.ScanOptions;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Typed, immutable configuration of the offline scan job.
 *
 * <p>
 * Values are resolved from environment variables with defaults, so the job
 * runs the same from a shell, a cron entry or a container.
 * </p>
 *
 * <h3>Variables</h3>
 * <table>
 * <caption>Environment</caption>
 * <tr><td>{@code LOG_ROOT}</td><td>folder to scan, default {@code .}</td></tr>
 * <tr><td>{@code PATTERNS_CONFIG_PATH}</td><td>optional custom pattern file</td></tr>
 * <tr><td>{@code REPORT_OUTPUT_DIR}</td><td>report folder, default {@code reports}</td></tr>
 * <tr><td>{@code SCAN_MAX_WORKERS}</td><td>pool size cap, default 16</td></tr>
 * <tr><td>{@code SCAN_WORKERS_PER_CPU}</td><td>workers per processor, default 3</td></tr>
 * <tr><td>{@code SCAN_LINE_BATCH_SIZE}</td><td>lines between cancellation checks, default 1024</td></tr>
 * <tr><td>{@code SCAN_FILE_EXTENSIONS}</td><td>comma-separated, {@code *} for every file</td></tr>
 * <tr><td>{@code SCAN_FOLLOW_LINKS}</td><td>follow symbolic links, default false</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public final class JobConfig {

    /** Extension list value that disables the extension filter. */
    public static final String ALL_FILES = "*";

    // ---------------------------------------------------------------
    // Input / output
    // ---------------------------------------------------------------
    private final String logRoot;
    private final String patternsConfigPath;
    private final String reportOutputDir;

    // ---------------------------------------------------------------
    // Scan tuning
    // ---------------------------------------------------------------
    private final int maxWorkers;
    private final int workersPerProcessor;
    private final int lineBatchSize;
    private final List<String> fileExtensions;
    private final boolean followLinks;

    private JobConfig(Builder b) {
        this.logRoot = b.logRoot;
        this.patternsConfigPath = b.patternsConfigPath;
        this.reportOutputDir = b.reportOutputDir;
        this.maxWorkers = b.maxWorkers;
        this.workersPerProcessor = b.workersPerProcessor;
        this.lineBatchSize = b.lineBatchSize;
        this.fileExtensions = List.copyOf(b.fileExtensions);
        this.followLinks = b.followLinks;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    static JobConfig fromEnvironment(UnaryOperator<String> environment) {
        Objects.requireNonNull(environment, "environment must not be null");
        try {
            return new Builder()
                    .logRoot(env(environment, "LOG_ROOT", "."))
                    .patternsConfigPath(env(environment, "PATTERNS_CONFIG_PATH", ""))
                    .reportOutputDir(env(environment, "REPORT_OUTPUT_DIR", "reports"))
                    .maxWorkers(Integer.parseInt(env(environment, "SCAN_MAX_WORKERS", "16")))
                    .workersPerProcessor(Integer.parseInt(env(environment, "SCAN_WORKERS_PER_CPU", "3")))
                    .lineBatchSize(Integer.parseInt(env(environment, "SCAN_LINE_BATCH_SIZE", "1024")))
                    .fileExtensions(splitList(env(environment, "SCAN_FILE_EXTENSIONS",
                            String.join(",", ScanOptions.DEFAULT_EXTENSIONS))))
                    .followLinks(Boolean.parseBoolean(env(environment, "SCAN_FOLLOW_LINKS", "false")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    /**
     * @param root folder to scan instead of the configured one
     * @return a copy with {@code logRoot} replaced
     */
    public JobConfig withLogRoot(String root) {
        return toBuilder().logRoot(root).build();
    }

    /**
     * @return scan options for the core engine
     */
    public ScanOptions toScanOptions() {
        ScanOptions.Builder options = ScanOptions.builder()
                .maxWorkers(maxWorkers)
                .workersPerProcessor(workersPerProcessor)
                .lineBatchSize(lineBatchSize)
                .followLinks(followLinks);
        if (fileExtensions.contains(ALL_FILES)) {
            options.allFiles();
        } else {
            options.fileExtensions(fileExtensions);
        }
        return options.build();
    }

    public Builder toBuilder() {
        return new Builder()
                .logRoot(logRoot)
                .patternsConfigPath(patternsConfigPath)
                .reportOutputDir(reportOutputDir)
                .maxWorkers(maxWorkers)
                .workersPerProcessor(workersPerProcessor)
                .lineBatchSize(lineBatchSize)
                .fileExtensions(fileExtensions)
                .followLinks(followLinks);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getLogRoot() {
        return logRoot;
    }

    /**
     * @return custom pattern file, or an empty string when none is configured
     */
    public String getPatternsConfigPath() {
        return patternsConfigPath;
    }

    public String getReportOutputDir() {
        return reportOutputDir;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public int getWorkersPerProcessor() {
        return workersPerProcessor;
    }

    public int getLineBatchSize() {
        return lineBatchSize;
    }

    public List<String> getFileExtensions() {
        return fileExtensions;
    }

    public boolean isFollowLinks() {
        return followLinks;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method checks that the paths are set and the
     * numeric values are positive.
     * </p>
     */
    public static class Builder {
        private String logRoot = ".";
        private String patternsConfigPath = "";
        private String reportOutputDir = "reports";
        private int maxWorkers = 16;
        private int workersPerProcessor = 3;
        private int lineBatchSize = 1024;
        private List<String> fileExtensions = ScanOptions.DEFAULT_EXTENSIONS;
        private boolean followLinks = false;

        public Builder logRoot(String v) {
            this.logRoot = v;
            return this;
        }

        public Builder patternsConfigPath(String v) {
            this.patternsConfigPath = v;
            return this;
        }

        public Builder reportOutputDir(String v) {
            this.reportOutputDir = v;
            return this;
        }

        public Builder maxWorkers(int v) {
            this.maxWorkers = v;
            return this;
        }

        public Builder workersPerProcessor(int v) {
            this.workersPerProcessor = v;
            return this;
        }

        public Builder lineBatchSize(int v) {
            this.lineBatchSize = v;
            return this;
        }

        public Builder fileExtensions(List<String> v) {
            this.fileExtensions = v;
            return this;
        }

        public Builder followLinks(boolean v) {
            this.followLinks = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            requireNonBlank(logRoot, "logRoot");
            requireNonBlank(reportOutputDir, "reportOutputDir");
            Objects.requireNonNull(fileExtensions, "fileExtensions required");
            if (patternsConfigPath == null) {
                patternsConfigPath = "";
            }

            if (maxWorkers < 1) {
                throw new IllegalArgumentException("maxWorkers must be >= 1, got: " + maxWorkers);
            }
            if (workersPerProcessor < 1) {
                throw new IllegalArgumentException(
                        "workersPerProcessor must be >= 1, got: " + workersPerProcessor);
            }
            if (lineBatchSize < 1) {
                throw new IllegalArgumentException("lineBatchSize must be >= 1, got: " + lineBatchSize);
            }

            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(UnaryOperator<String> environment, String name, String defaultValue) {
        String value = environment.apply(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "logRoot='" + logRoot + '\'' +
                ", patternsConfigPath='" + patternsConfigPath + '\'' +
                ", reportOutputDir='" + reportOutputDir + '\'' +
                ", maxWorkers=" + maxWorkers +
                ", workersPerProcessor=" + workersPerProcessor +
                ", lineBatchSize=" + lineBatchSize +
                ", fileExtensions=" + fileExtensions +
                ", followLinks=" + followLinks +
                '}';
    }
}
