package com.logsentinel.core.scan;

import com.logsentinel.core.config.ScanOptions;
import com.logsentinel.core.detection.CancellationSignal;
import com.logsentinel.core.detection.LineScanner;
import com.logsentinel.core.detection.PatternSet;
import com.logsentinel.core.model.AggregateReport;
import com.logsentinel.core.model.FileAccessError;
import com.logsentinel.core.model.ScanResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntSupplier;
import java.util.function.Supplier;

/**
 * Scans every log file under a folder concurrently and aggregates the
 * results.
 *
 * <h3>Flow</h3>
 * <ol>
 * <li>Capture the current {@link PatternSet} snapshot; later registry changes
 * do not affect this scan.</li>
 * <li>Enumerate the accepted files under the root.</li>
 * <li>Run one {@link LineScanner} pass per file on a fixed pool sized by
 * {@link ScanOptions#workerCount(int, int)}.</li>
 * <li>Once every task has finished, sort the results by path and build the
 * {@link AggregateReport}.</li>
 * </ol>
 *
 * <h3>Failure isolation</h3>
 * <p>
 * A file that cannot be opened or read produces a failed {@link ScanResult};
 * the other files are unaffected. No file error escapes this class.
 * </p>
 *
 * <h3>Threading</h3>
 * <p>
 * {@link #start(Path, ScanListener)} returns immediately. Enumeration runs on
 * a {@code log-scan-coordinator} thread, file tasks on a per-scan pool of
 * {@code log-scan-worker-N} daemon threads that is shut down when the scan
 * ends.
 * </p>
 *
 * @since 1.0.0
 */
public class FolderScanOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(FolderScanOrchestrator.class);

    /** Files taking longer than this are reported at INFO. */
    static final long SLOW_FILE_MILLIS = 5_000;

    private static final AtomicInteger SCAN_IDS = new AtomicInteger();

    private final Supplier<PatternSet> snapshots;
    private final ScanOptions options;
    private final LogFileOpener opener;
    private final IntSupplier processors;

    /**
     * @param snapshots source of the pattern set captured at scan start,
     *                  typically {@code registry::snapshot}
     * @param options   scan tuning
     */
    public FolderScanOrchestrator(Supplier<PatternSet> snapshots, ScanOptions options) {
        this(snapshots, options, LogFileOpener.lenientUtf8(), () -> Runtime.getRuntime().availableProcessors());
    }

    /**
     * @param snapshots  source of the pattern set captured at scan start
     * @param options    scan tuning
     * @param opener     how files are opened
     * @param processors available parallelism used to size the pool
     */
    public FolderScanOrchestrator(Supplier<PatternSet> snapshots, ScanOptions options,
            LogFileOpener opener, IntSupplier processors) {
        this.snapshots = Objects.requireNonNull(snapshots, "snapshot supplier must not be null");
        this.options = Objects.requireNonNull(options, "ScanOptions must not be null");
        this.opener = Objects.requireNonNull(opener, "LogFileOpener must not be null");
        this.processors = Objects.requireNonNull(processors, "processor supplier must not be null");
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    public ScanHandle start(Path root) {
        return start(root, ScanListener.NONE);
    }

    /**
     * Start scanning {@code root} in the background.
     *
     * @param root     directory to scan recursively
     * @param listener per-file progress callback
     * @return handle to observe, await or cancel the scan
     * @throws IllegalArgumentException if {@code root} does not exist or is
     *                                  not a directory
     */
    public ScanHandle start(Path root, ScanListener listener) {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(listener, "listener must not be null");
        if (!Files.exists(root)) {
            throw new IllegalArgumentException("Scan root does not exist: " + root);
        }
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("Scan root is not a directory: " + root);
        }

        PatternSet snapshot = Objects.requireNonNull(snapshots.get(), "pattern set snapshot must not be null");
        ScanHandle handle = new ScanHandle(root, snapshot.getVersion());
        int scanId = SCAN_IDS.incrementAndGet();

        Thread coordinator = new Thread(() -> run(scanId, handle, snapshot, listener),
                "log-scan-coordinator-" + scanId);
        coordinator.setDaemon(true);
        coordinator.start();
        return handle;
    }

    /**
     * Scan {@code root} and wait for the report.
     *
     * @param root directory to scan recursively
     * @return the aggregate report
     * @throws IllegalArgumentException if {@code root} is not a directory
     */
    public AggregateReport scanFolder(Path root) {
        return start(root).await();
    }

    public ScanOptions getOptions() {
        return options;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void run(int scanId, ScanHandle handle, PatternSet snapshot, ScanListener listener) {
        Path root = handle.getRoot();
        CancellationSignal signal = handle.signal();
        long started = System.nanoTime();
        try {
            handle.transition(ScanState.ENUMERATING);
            LogFileCollector.Enumeration found = LogFileCollector.collect(root, options, signal);
            List<Path> files = found.getFiles();

            if (files.isEmpty()) {
                handle.transition(ScanState.AGGREGATING);
                finish(handle, found, List.of(), started);
                return;
            }

            int workers = options.workerCount(files.size(), processors.getAsInt());
            LOG.info("Scanning {} file(s) under {} with {} worker(s), pattern set v{}",
                    files.size(), root, workers, snapshot.getVersion());
            handle.transition(ScanState.RUNNING);

            ExecutorService pool = Executors.newFixedThreadPool(workers, workerThreads(scanId));
            AtomicInteger completed = new AtomicInteger();
            int total = files.size();

            List<CompletableFuture<ScanResult>> tasks = files.stream()
                    .map(file -> CompletableFuture
                            .supplyAsync(() -> scanFile(file, snapshot, signal), pool)
                            .handle((result, failure) -> result != null ? result : unexpected(file, failure))
                            .thenApply(result -> {
                                notifyListener(listener, result, completed.incrementAndGet(), total);
                                return result;
                            }))
                    .toList();

            CompletableFuture.allOf(tasks.toArray(new CompletableFuture<?>[0]))
                    .whenComplete((ignored, failure) -> {
                        pool.shutdown();
                        try {
                            handle.transition(ScanState.AGGREGATING);
                            List<ScanResult> results = tasks.stream().map(CompletableFuture::join).toList();
                            finish(handle, found, results, started);
                        } catch (RuntimeException e) {
                            LOG.error("Aggregation of scan under {} failed", root, e);
                            handle.fail(e);
                        }
                    });
        } catch (IOException e) {
            LOG.error("Enumeration of {} failed", root, e);
            handle.fail(new UncheckedIOException(e));
        } catch (RuntimeException e) {
            LOG.error("Scan of {} failed", root, e);
            handle.fail(e);
        }
    }

    private void finish(ScanHandle handle, LogFileCollector.Enumeration found,
            List<ScanResult> scanned, long startedNanos) {
        List<ScanResult> all = new ArrayList<>(found.getFailures().size() + scanned.size());
        all.addAll(found.getFailures());
        all.addAll(scanned);
        boolean cancelled = found.isTruncated() || all.stream().anyMatch(ScanResult::isCancelled);

        AggregateReport report = AggregateReport.of(all, cancelled);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
        LOG.info("Scan of {} {} in {} ms: {} file(s), {} failed, {} match(es)",
                handle.getRoot(), cancelled ? "cancelled" : "finished", elapsedMs,
                report.getTotalFiles(), report.getFailedFiles(), report.getTotalMatches());
        handle.complete(report);
    }

    /**
     * One streaming pass over one file. Never throws.
     */
    ScanResult scanFile(Path file, PatternSet snapshot, CancellationSignal signal) {
        if (signal.isCancelled()) {
            return ScanResult.cancelled(file, List.of());
        }
        long started = System.nanoTime();
        try (BufferedReader reader = opener.open(file)) {
            LineScanner.Outcome outcome =
                    new LineScanner(snapshot, signal, options.getLineBatchSize()).scan(reader);

            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            if (elapsedMs > SLOW_FILE_MILLIS) {
                LOG.info("Slow file {}: {} line(s) in {} ms", file, outcome.getLinesRead(), elapsedMs);
            }
            LOG.debug("Scanned {}: {} line(s), {} match(es)",
                    file, outcome.getLinesRead(), outcome.getMatches().size());

            return outcome.isCancelled()
                    ? ScanResult.cancelled(file, outcome.getMatches())
                    : ScanResult.completed(file, outcome.getMatches());
        } catch (IOException e) {
            LOG.warn("Cannot read {}: {}", file, e.toString());
            return ScanResult.failed(file, FileAccessError.of(file, e));
        } catch (UncheckedIOException e) {
            LOG.warn("Cannot read {}: {}", file, e.getCause().toString());
            return ScanResult.failed(file, FileAccessError.of(file, e.getCause()));
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure while scanning {}", file, e);
            return ScanResult.failed(file, FileAccessError.of(file, e));
        }
    }

    private static ScanResult unexpected(Path file, Throwable failure) {
        Throwable cause = failure.getCause() != null ? failure.getCause() : failure;
        LOG.error("Scan task for {} failed", file, cause);
        return ScanResult.failed(file, FileAccessError.of(file, cause));
    }

    private static void notifyListener(ScanListener listener, ScanResult result, int completed, int total) {
        try {
            listener.onFileScanned(result, completed, total);
        } catch (RuntimeException e) {
            LOG.warn("Scan listener failed on {}", result.getFilePath(), e);
        }
    }

    private static ThreadFactory workerThreads(int scanId) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "log-scan-worker-" + scanId + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
