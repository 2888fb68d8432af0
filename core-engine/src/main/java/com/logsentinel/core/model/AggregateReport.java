package com.logsentinel.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Deterministic summary of a folder scan.
 *
 * <p>
 * Results are sorted by file path and category counts by category name, so
 * two scans of the same unchanged folder yield equal reports whatever the
 * order in which files finished.
 * </p>
 *
 * <h3>Counting</h3>
 * <ul>
 * <li>{@code failedFiles}: results carrying a {@link FileAccessError}</li>
 * <li>{@code successfulFiles}: every other result, cancelled ones
 * included</li>
 * <li>{@code cancelledFiles}: results with status
 * {@link ScanStatus#CANCELLED}</li>
 * </ul>
 * <p>
 * so {@code totalFiles == successfulFiles + failedFiles} always holds.
 * </p>
 * <p>
 * A result is not always a regular file: an entry the directory walk could
 * not visit (an unlistable directory, a symbolic link loop) is reported as a
 * failed result under its own path and counts toward {@code totalFiles} and
 * {@code failedFiles}.
 * </p>
 *
 * @since 1.0.0
 */
public final class AggregateReport {

    /** Orders results by the string form of their path. */
    public static final Comparator<ScanResult> BY_FILE_PATH =
            Comparator.comparing(result -> result.getFilePath().toString());

    private final int successfulFiles;
    private final int failedFiles;
    private final int cancelledFiles;
    private final long totalMatches;
    private final SortedMap<String, Long> categoryCounts;
    private final List<ScanResult> results;
    private final boolean cancelled;

    private AggregateReport(List<ScanResult> sortedResults, boolean cancelled) {
        int failed = 0;
        int cancelledCount = 0;
        long matchCount = 0;
        SortedMap<String, Long> counts = new TreeMap<>();

        for (ScanResult result : sortedResults) {
            if (result.isFailed()) {
                failed++;
            }
            if (result.isCancelled()) {
                cancelledCount++;
            }
            for (AnomalyMatch match : result.getMatches()) {
                counts.merge(match.getCategory(), 1L, Long::sum);
                matchCount++;
            }
        }

        this.results = Collections.unmodifiableList(sortedResults);
        this.failedFiles = failed;
        this.successfulFiles = sortedResults.size() - failed;
        this.cancelledFiles = cancelledCount;
        this.totalMatches = matchCount;
        this.categoryCounts = Collections.unmodifiableSortedMap(counts);
        this.cancelled = cancelled;
    }

    /**
     * Aggregate per-file results, given in any order.
     *
     * @param results   per-file results; must not be {@code null}
     * @param cancelled whether the scan was stopped by a cancellation request
     * @return the sorted report
     */
    public static AggregateReport of(List<ScanResult> results, boolean cancelled) {
        Objects.requireNonNull(results, "results must not be null");
        List<ScanResult> sorted = new ArrayList<>(results);
        sorted.sort(BY_FILE_PATH);
        return new AggregateReport(sorted, cancelled);
    }

    /**
     * @return report of a scan that found no files
     */
    public static AggregateReport empty() {
        return of(List.of(), false);
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    /**
     * @return number of results: files scanned plus entries the walk could
     *         not visit
     */
    public int getTotalFiles() {
        return results.size();
    }

    public int getSuccessfulFiles() {
        return successfulFiles;
    }

    public int getFailedFiles() {
        return failedFiles;
    }

    public int getCancelledFiles() {
        return cancelledFiles;
    }

    public long getTotalMatches() {
        return totalMatches;
    }

    /**
     * @return unmodifiable category → match count, ordered by category
     */
    public Map<String, Long> getCategoryCounts() {
        return categoryCounts;
    }

    /**
     * @return unmodifiable results ordered by file path
     */
    public List<ScanResult> getResults() {
        return results;
    }

    /**
     * @return {@code true} if the scan was cancelled before every file finished
     */
    public boolean isCancelled() {
        return cancelled;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AggregateReport that))
            return false;
        return cancelled == that.cancelled && results.equals(that.results);
    }

    @Override
    public int hashCode() {
        return Objects.hash(results, cancelled);
    }

    @Override
    public String toString() {
        return "AggregateReport{" +
                "totalFiles=" + getTotalFiles() +
                ", successfulFiles=" + successfulFiles +
                ", failedFiles=" + failedFiles +
                ", cancelledFiles=" + cancelledFiles +
                ", totalMatches=" + totalMatches +
                ", categoryCounts=" + categoryCounts +
                ", cancelled=" + cancelled +
                '}';
    }
}
