package com.logsentinel.core.scan;

import com.logsentinel.core.config.ScanOptions;
import com.logsentinel.core.detection.CancellationSignal;
import com.logsentinel.core.model.FileAccessError;
import com.logsentinel.core.model.ScanResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Recursive enumeration of the files a scan will read.
 *
 * <p>
 * Regular files accepted by {@link ScanOptions#accepts(Path)} are collected
 * and sorted by path. Entries the walk cannot visit are turned into failed
 * {@link ScanResult}s rather than aborting the enumeration.
 * </p>
 *
 * @since 1.0.0
 */
final class LogFileCollector {

    private static final Logger LOG = LoggerFactory.getLogger(LogFileCollector.class);

    private LogFileCollector() {
        // utility class: not instantiable
    }

    /**
     * Walk {@code root}.
     *
     * @param root    directory to walk
     * @param options extension filter and link policy
     * @param signal  stops the walk early when cancelled
     * @return the files found and the entries that failed
     * @throws IOException if the walk itself cannot proceed
     */
    static Enumeration collect(Path root, ScanOptions options, CancellationSignal signal) throws IOException {
        Objects.requireNonNull(root, "root must not be null");
        Set<FileVisitOption> visitOptions = options.isFollowLinks()
                ? EnumSet.of(FileVisitOption.FOLLOW_LINKS)
                : EnumSet.noneOf(FileVisitOption.class);

        Visitor visitor = new Visitor(options, signal);
        Files.walkFileTree(root, visitOptions, Integer.MAX_VALUE, visitor);

        visitor.files.sort(Comparator.comparing(Path::toString));
        LOG.debug("Enumerated {} file(s) and {} failed entries under {}",
                visitor.files.size(), visitor.failures.size(), root);
        return new Enumeration(visitor.files, visitor.failures, visitor.truncated);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static final class Visitor extends SimpleFileVisitor<Path> {
        private final ScanOptions options;
        private final CancellationSignal signal;
        private final List<Path> files = new ArrayList<>();
        private final List<ScanResult> failures = new ArrayList<>();
        private boolean truncated;

        Visitor(ScanOptions options, CancellationSignal signal) {
            this.options = options;
            this.signal = signal;
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            return stopIfCancelled();
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (stopIfCancelled() == FileVisitResult.TERMINATE) {
                return FileVisitResult.TERMINATE;
            }
            if (attrs.isRegularFile() && options.accepts(file)) {
                files.add(file);
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) {
            LOG.warn("Cannot visit {}: {}", file, exc.toString());
            failures.add(ScanResult.failed(file, FileAccessError.of(file, exc)));
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
            if (exc != null) {
                LOG.warn("Directory listing of {} ended early: {}", dir, exc.toString());
                failures.add(ScanResult.failed(dir, FileAccessError.of(dir, exc)));
            }
            return FileVisitResult.CONTINUE;
        }

        private FileVisitResult stopIfCancelled() {
            if (signal.isCancelled()) {
                truncated = true;
                return FileVisitResult.TERMINATE;
            }
            return FileVisitResult.CONTINUE;
        }
    }

    /**
     * Outcome of one walk.
     */
    static final class Enumeration {
        private final List<Path> files;
        private final List<ScanResult> failures;
        private final boolean truncated;

        Enumeration(List<Path> files, List<ScanResult> failures, boolean truncated) {
            this.files = Collections.unmodifiableList(files);
            this.failures = Collections.unmodifiableList(failures);
            this.truncated = truncated;
        }

        List<Path> getFiles() {
            return files;
        }

        List<ScanResult> getFailures() {
            return failures;
        }

        boolean isTruncated() {
            return truncated;
        }
    }
}
