package com.logsentinel.core;

import com.logsentinel.core.config.ScanOptions;
import com.logsentinel.core.detection.LineScanner;
import com.logsentinel.core.detection.PatternRegistry;
import com.logsentinel.core.model.AggregateReport;
import com.logsentinel.core.model.AnomalyMatch;
import com.logsentinel.core.scan.FolderScanOrchestrator;
import com.logsentinel.core.scan.ScanHandle;
import com.logsentinel.core.scan.ScanListener;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Entry point of the classifier: one registry of rules plus the means to
 * apply its current snapshot to text and to folders.
 *
 * <p>
 * Create one instance at startup and pass it to whatever needs it. Every
 * {@code detect} call and every scan captures the snapshot published at the
 * moment it starts.
 * </p>
 *
 * <pre>{@code
 * AnomalyEngine engine = AnomalyEngine.withDefaults();
 * engine.getRegistry().loadCustom(Path.of("patterns.yml"));
 * AggregateReport report = engine.scanFolder(Path.of("/var/log/devices"));
 * }</pre>
 *
 * @since 1.0.0
 */
public class AnomalyEngine {

    private final PatternRegistry registry;
    private final FolderScanOrchestrator orchestrator;

    public AnomalyEngine(PatternRegistry registry, ScanOptions options) {
        this(registry, new FolderScanOrchestrator(
                Objects.requireNonNull(registry, "PatternRegistry must not be null")::snapshot, options));
    }

    /**
     * @param registry     rule store
     * @param orchestrator folder scanner, expected to read snapshots from
     *                     {@code registry}
     */
    public AnomalyEngine(PatternRegistry registry, FolderScanOrchestrator orchestrator) {
        this.registry = Objects.requireNonNull(registry, "PatternRegistry must not be null");
        this.orchestrator = Objects.requireNonNull(orchestrator, "FolderScanOrchestrator must not be null");
    }

    /**
     * @return an engine with the built-in catalogue loaded and default scan
     *         options
     */
    public static AnomalyEngine withDefaults() {
        return new AnomalyEngine(PatternRegistry.withDefaults(), ScanOptions.defaults());
    }

    // ---------------------------------------------------------------
    // Detection
    // ---------------------------------------------------------------

    /**
     * Classify every line of an in-memory blob.
     *
     * @param text log text, split on line terminators
     * @return matches in line order; empty when the pattern set is empty
     */
    public List<AnomalyMatch> detect(String text) {
        Objects.requireNonNull(text, "text must not be null");
        return detect(new StringReader(text));
    }

    /**
     * Classify every line read from {@code reader}. The reader is not closed.
     *
     * @param reader line source
     * @return matches in line order
     * @throws UncheckedIOException if reading fails
     */
    public List<AnomalyMatch> detect(Reader reader) {
        Objects.requireNonNull(reader, "reader must not be null");
        BufferedReader buffered = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
        try {
            return new LineScanner(registry.snapshot()).scan(buffered).getMatches();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read log text", e);
        }
    }

    // ---------------------------------------------------------------
    // Folder scans
    // ---------------------------------------------------------------

    public ScanHandle startScan(Path root) {
        return orchestrator.start(root);
    }

    public ScanHandle startScan(Path root, ScanListener listener) {
        return orchestrator.start(root, listener);
    }

    /**
     * Scan {@code root} recursively and wait for the report.
     *
     * @param root directory to scan
     * @return the aggregate report, sorted by file path
     * @throws IllegalArgumentException if {@code root} is not a directory
     */
    public AggregateReport scanFolder(Path root) {
        return orchestrator.scanFolder(root);
    }

    public PatternRegistry getRegistry() {
        return registry;
    }

    public FolderScanOrchestrator getOrchestrator() {
        return orchestrator;
    }
}
