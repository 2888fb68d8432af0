package com.logsentinel.core.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.logsentinel.core.model.AggregateReport;
import com.logsentinel.core.model.AnomalyMatch;
import com.logsentinel.core.model.FileAccessError;
import com.logsentinel.core.model.ScanResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Writes an {@link AggregateReport} as indented JSON.
 *
 * <h3>Layout</h3>
 * <pre>
 * {
 *   "summary":   { "total_files", "successful_files", "failed_files",
 *                  "cancelled_files", "total_matches", "cancelled",
 *                  "category_counts": { category: count } },
 *   "anomalies": [ { "file_path", "device", "line_number", "line_text",
 *                    "category", "matched_pattern" } ],
 *   "failures":  [ { "file_path", "error_type", "message" } ]
 * }
 * </pre>
 *
 * <p>
 * Rows follow the report order (file path, then line number). The output
 * holds no timestamps, so the same report always serialises to the same
 * bytes.
 * </p>
 *
 * @since 1.0.0
 */
public class ReportExporter {

    private static final Logger LOG = LoggerFactory.getLogger(ReportExporter.class);

    private final ObjectMapper mapper;

    public ReportExporter() {
        this.mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    /**
     * @param report report to render
     * @return the JSON document
     */
    public String toJson(AggregateReport report) {
        try {
            return mapper.writeValueAsString(toDocument(report));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialise report", e);
        }
    }

    /**
     * Write the report to {@code target}, creating missing parent
     * directories.
     *
     * @param report report to write
     * @param target destination file; replaced if it exists
     * @throws IOException if the file cannot be written
     */
    public void write(AggregateReport report, Path target) throws IOException {
        Objects.requireNonNull(target, "target must not be null");
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            mapper.writeValue(writer, toDocument(report));
        }
        LOG.info("Wrote report with {} anomaly row(s) to {}", report.getTotalMatches(), target);
    }

    /**
     * Device name of a log file: its file name without the last extension.
     */
    static String deviceOf(Path file) {
        Path name = file.getFileName();
        String fileName = name != null ? name.toString() : file.toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    // ---------------------------------------------------------------
    // Document
    // ---------------------------------------------------------------

    ReportDocument toDocument(AggregateReport report) {
        Objects.requireNonNull(report, "report must not be null");
        List<AnomalyRow> anomalies = new ArrayList<>();
        List<FailureRow> failures = new ArrayList<>();
        for (ScanResult result : report.getResults()) {
            String filePath = result.getFilePath().toString();
            String device = deviceOf(result.getFilePath());
            for (AnomalyMatch match : result.getMatches()) {
                anomalies.add(new AnomalyRow(filePath, device, match));
            }
            result.getError().ifPresent(error -> failures.add(new FailureRow(filePath, error)));
        }
        return new ReportDocument(new Summary(report), anomalies, failures);
    }

    @JsonPropertyOrder({"summary", "anomalies", "failures"})
    static final class ReportDocument {
        @JsonProperty("summary")
        final Summary summary;
        @JsonProperty("anomalies")
        final List<AnomalyRow> anomalies;
        @JsonProperty("failures")
        final List<FailureRow> failures;

        ReportDocument(Summary summary, List<AnomalyRow> anomalies, List<FailureRow> failures) {
            this.summary = summary;
            this.anomalies = anomalies;
            this.failures = failures;
        }
    }

    @JsonPropertyOrder({"total_files", "successful_files", "failed_files", "cancelled_files",
            "total_matches", "cancelled", "category_counts"})
    static final class Summary {
        @JsonProperty("total_files")
        final int totalFiles;
        @JsonProperty("successful_files")
        final int successfulFiles;
        @JsonProperty("failed_files")
        final int failedFiles;
        @JsonProperty("cancelled_files")
        final int cancelledFiles;
        @JsonProperty("total_matches")
        final long totalMatches;
        @JsonProperty("cancelled")
        final boolean cancelled;
        @JsonProperty("category_counts")
        final Map<String, Long> categoryCounts;

        Summary(AggregateReport report) {
            this.totalFiles = report.getTotalFiles();
            this.successfulFiles = report.getSuccessfulFiles();
            this.failedFiles = report.getFailedFiles();
            this.cancelledFiles = report.getCancelledFiles();
            this.totalMatches = report.getTotalMatches();
            this.cancelled = report.isCancelled();
            this.categoryCounts = report.getCategoryCounts();
        }
    }

    @JsonPropertyOrder({"file_path", "device", "line_number", "line_text", "category", "matched_pattern"})
    static final class AnomalyRow {
        @JsonProperty("file_path")
        final String filePath;
        @JsonProperty("device")
        final String device;
        @JsonProperty("line_number")
        final long lineNumber;
        @JsonProperty("line_text")
        final String lineText;
        @JsonProperty("category")
        final String category;
        @JsonProperty("matched_pattern")
        final String matchedPattern;

        AnomalyRow(String filePath, String device, AnomalyMatch match) {
            this.filePath = filePath;
            this.device = device;
            this.lineNumber = match.getLineNumber();
            this.lineText = match.getLineText();
            this.category = match.getCategory();
            this.matchedPattern = match.getMatchedPattern();
        }
    }

    @JsonPropertyOrder({"file_path", "error_type", "message"})
    static final class FailureRow {
        @JsonProperty("file_path")
        final String filePath;
        @JsonProperty("error_type")
        final String errorType;
        @JsonProperty("message")
        final String message;

        FailureRow(String filePath, FileAccessError error) {
            this.filePath = filePath;
            this.errorType = error.getErrorType();
            this.message = error.getMessage();
        }
    }
}
