package com.logsentinel.job;

import com.logsentinel.core.AnomalyEngine;
import com.logsentinel.core.config.PatternLoadResult;
import com.logsentinel.core.detection.PatternRegistry;
import com.logsentinel.core.export.ReportExporter;
import com.logsentinel.core.model.AggregateReport;
import com.logsentinel.core.scan.FolderScanOrchestrator;
import com.logsentinel.core.scan.ScanHandle;
import com.logsentinel.core.scan.ScanListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point of the offline scan job.
 *
 * <h3>Run</h3>
 *
 * <pre>
 *   JobConfig (env, optional root argument)
 *     → PatternRegistry (built-in catalogue + optional custom file)
 *     → FolderScanOrchestrator (one task per log file)
 *     → AggregateReport
 *     → REPORT_OUTPUT_DIR/offline_anomalies_yyyyMMdd_HHmmss.json
 * </pre>
 *
 * <h3>Interruption</h3>
 * <p>
 * A shutdown hook cancels the running scan and waits briefly for the partial
 * report to be written, so Ctrl-C still leaves a usable report behind.
 * </p>
 *
 * @since 1.0.0
 */
public final class LogSentinelJob {

    private static final Logger LOG = LoggerFactory.getLogger(LogSentinelJob.class);

    private static final DateTimeFormatter REPORT_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    /** How long the shutdown hook waits for the partial report. */
    private static final long SHUTDOWN_GRACE_SECONDS = 30;

    private LogSentinelJob() {
        // entry-point class: not instantiable
    }

    public static void main(String[] args) throws Exception {
        // 1. Load configuration
        JobConfig config = JobConfig.fromEnvironment();
        if (args.length > 0) {
            config = config.withLogRoot(args[0]);
        }
        LOG.info("Starting Log Sentinel with config: {}", config);

        // 2. Build the engine
        AnomalyEngine engine = buildEngine(config);

        // 3. Scan, with a shutdown hook that turns Ctrl-C into a cancellation
        Path root = Path.of(config.getLogRoot());
        ScanHandle handle = engine.startScan(root, progressLogger());
        CountDownLatch reportWritten = new CountDownLatch(1);
        Thread shutdownHook = new Thread(() -> {
            if (handle.cancel()) {
                LOG.warn("Shutdown requested, cancelling scan of {}", root);
            }
            awaitReport(reportWritten);
        }, "scan-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        try {
            AggregateReport report = handle.await();
            logSummary(report);

            // 4. Write the report
            Path target = Path.of(config.getReportOutputDir()).resolve(reportFileName(LocalDateTime.now()));
            new ReportExporter().write(report, target);
        } finally {
            reportWritten.countDown();
        }

        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            LOG.debug("JVM already shutting down, hook stays registered");
        }
    }

    // ---------------------------------------------------------------
    // Assembly (extracted for testability)
    // ---------------------------------------------------------------

    /**
     * Build the engine for {@code config}. A rejected custom pattern source is
     * logged and the job continues with the built-in catalogue.
     */
    static AnomalyEngine buildEngine(JobConfig config) {
        PatternRegistry registry = PatternRegistry.withDefaults();
        PatternLoadResult custom = registry.loadCustomResolved(config.getPatternsConfigPath());
        if (!custom.isSuccess()) {
            LOG.warn("Custom patterns rejected, continuing with defaults only: {}", custom.getMessage());
        } else if (custom.getLoadedCount() > 0) {
            LOG.info("{}", custom.getMessage());
        }
        LOG.info("Active pattern set v{}: {} pattern(s)",
                registry.snapshot().getVersion(), registry.snapshot().size());

        FolderScanOrchestrator orchestrator =
                new FolderScanOrchestrator(registry::snapshot, config.toScanOptions());
        return new AnomalyEngine(registry, orchestrator);
    }

    static String reportFileName(LocalDateTime timestamp) {
        return "offline_anomalies_" + REPORT_STAMP.format(timestamp) + ".json";
    }

    /**
     * Logs progress at every tenth of the file count and on the last file.
     */
    static ScanListener progressLogger() {
        return (result, completed, total) -> {
            int step = Math.max(1, total / 10);
            if (completed == total || completed % step == 0) {
                LOG.info("Progress: {}/{} file(s) scanned", completed, total);
            }
        };
    }

    private static void logSummary(AggregateReport report) {
        LOG.info("Scan {}: {} file(s), {} successful, {} failed, {} cancelled, {} anomal{}",
                report.isCancelled() ? "cancelled" : "complete",
                report.getTotalFiles(), report.getSuccessfulFiles(), report.getFailedFiles(),
                report.getCancelledFiles(), report.getTotalMatches(),
                report.getTotalMatches() == 1 ? "y" : "ies");
        for (Map.Entry<String, Long> entry : report.getCategoryCounts().entrySet()) {
            LOG.info("  {}: {}", entry.getKey(), entry.getValue());
        }
        report.getResults().stream()
                .filter(r -> r.getError().isPresent())
                .forEach(r -> LOG.warn("  unreadable: {} ({})", r.getFilePath(),
                        r.getError().get().getMessage()));
    }

    private static void awaitReport(CountDownLatch reportWritten) {
        try {
            if (!reportWritten.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("Report not written within {} s of shutdown", SHUTDOWN_GRACE_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
