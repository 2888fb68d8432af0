package com.logsentinel.core.scan;

import com.logsentinel.core.detection.CancellationSignal;
import com.logsentinel.core.model.AggregateReport;

import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A running (or finished) folder scan.
 *
 * <p>
 * Returned by {@link FolderScanOrchestrator#start(Path, ScanListener)}. The
 * report future completes once every file task has finished, or has stopped
 * after {@link #cancel()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ScanHandle {

    private final Path root;
    private final long patternSetVersion;
    private final CancellationSignal signal = new CancellationSignal();
    private final AtomicReference<ScanState> state = new AtomicReference<>(ScanState.IDLE);
    private final CompletableFuture<AggregateReport> report = new CompletableFuture<>();

    ScanHandle(Path root, long patternSetVersion) {
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.patternSetVersion = patternSetVersion;
    }

    /**
     * Request cooperative cancellation. Files already scanned keep their
     * results; files in progress stop at the next line batch; files not yet
     * started are reported as cancelled with no matches.
     *
     * @return {@code true} if this call requested cancellation
     */
    public boolean cancel() {
        if (state.get().isTerminal()) {
            return false;
        }
        return signal.cancel();
    }

    public boolean isCancellationRequested() {
        return signal.isCancelled();
    }

    public ScanState getState() {
        return state.get();
    }

    public Path getRoot() {
        return root;
    }

    /**
     * @return version of the pattern set snapshot this scan uses
     */
    public long getPatternSetVersion() {
        return patternSetVersion;
    }

    /**
     * @return a future of the final report; completing the returned copy does
     *         not affect the scan
     */
    public CompletableFuture<AggregateReport> report() {
        return report.copy();
    }

    /**
     * Block until the report is available.
     *
     * @return the final report
     * @throws CompletionException if the scan failed unexpectedly
     */
    public AggregateReport await() {
        return report.join();
    }

    /**
     * Block until the report is available or the timeout elapses.
     *
     * @param timeout maximum time to wait
     * @param unit    unit of {@code timeout}
     * @return the final report
     * @throws InterruptedException if the waiting thread is interrupted
     * @throws TimeoutException     if the scan is still running
     * @throws CompletionException  if the scan failed unexpectedly
     */
    public AggregateReport await(long timeout, TimeUnit unit) throws InterruptedException, TimeoutException {
        try {
            return report.get(timeout, unit);
        } catch (ExecutionException e) {
            throw new CompletionException(e.getCause());
        }
    }

    // ---------------------------------------------------------------
    // Orchestrator side
    // ---------------------------------------------------------------

    CancellationSignal signal() {
        return signal;
    }

    void transition(ScanState next) {
        state.set(next);
    }

    void complete(AggregateReport finalReport) {
        state.set(finalReport.isCancelled() ? ScanState.CANCELLED : ScanState.DONE);
        report.complete(finalReport);
    }

    void fail(Throwable failure) {
        state.set(ScanState.DONE);
        report.completeExceptionally(failure);
    }

    @Override
    public String toString() {
        return "ScanHandle{root=" + root + ", state=" + state.get()
                + ", patternSetVersion=" + patternSetVersion + '}';
    }
}
