package com.logsentinel.core.detection;

import com.logsentinel.core.model.AnomalyMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single forward pass of a {@link PatternSet} snapshot over a sequence of
 * lines.
 *
 * <p>
 * Lines are pulled one at a time, so only the current line is held in
 * memory. Line numbers are 1-based and count every line, blank ones
 * included; blank lines are never classified.
 * </p>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * One instance scans one input. A second call to any {@code scan} method
 * throws {@link IllegalStateException}. Distinct instances sharing a snapshot
 * can run concurrently.
 * </p>
 *
 * <h3>Cancellation</h3>
 * <p>
 * The {@link CancellationSignal} is polled before the first line and then
 * every {@code lineBatchSize} lines.
 * </p>
 *
 * @since 1.0.0
 */
public final class LineScanner {

    private static final Logger LOG = LoggerFactory.getLogger(LineScanner.class);

    /** Lines between two cancellation checks when nothing else is configured. */
    public static final int DEFAULT_LINE_BATCH_SIZE = 1024;

    private final PatternSet snapshot;
    private final CancellationSignal signal;
    private final int lineBatchSize;
    private final AtomicBoolean consumed = new AtomicBoolean(false);

    public LineScanner(PatternSet snapshot) {
        this(snapshot, new CancellationSignal(), DEFAULT_LINE_BATCH_SIZE);
    }

    /**
     * @param snapshot      rules to apply; must not be {@code null}
     * @param signal        cancellation signal; must not be {@code null}
     * @param lineBatchSize lines between cancellation checks, at least 1
     * @throws IllegalArgumentException if {@code lineBatchSize < 1}
     */
    public LineScanner(PatternSet snapshot, CancellationSignal signal, int lineBatchSize) {
        this.snapshot = Objects.requireNonNull(snapshot, "PatternSet must not be null");
        this.signal = Objects.requireNonNull(signal, "CancellationSignal must not be null");
        if (lineBatchSize < 1) {
            throw new IllegalArgumentException("lineBatchSize must be >= 1, got: " + lineBatchSize);
        }
        this.lineBatchSize = lineBatchSize;
    }

    /**
     * Scan an open reader until end of input or cancellation. The reader is
     * not closed.
     *
     * @param reader line source
     * @return the matches and whether the pass was cut short
     * @throws IOException if reading fails
     */
    public Outcome scan(BufferedReader reader) throws IOException {
        Objects.requireNonNull(reader, "reader must not be null");
        return run(reader::readLine);
    }

    /**
     * Scan a lazy sequence of lines. {@code null} elements count as blank
     * lines.
     *
     * @param lines line source
     * @return the matches and whether the pass was cut short
     */
    public Outcome scan(Iterator<String> lines) {
        Objects.requireNonNull(lines, "lines must not be null");
        try {
            return run(() -> {
                if (!lines.hasNext()) {
                    return null;
                }
                String line = lines.next();
                return line != null ? line : "";
            });
        } catch (IOException e) {
            // an iterator source cannot throw IOException
            throw new IllegalStateException(e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    @FunctionalInterface
    private interface LineSource {
        String next() throws IOException;
    }

    private Outcome run(LineSource source) throws IOException {
        if (!consumed.compareAndSet(false, true)) {
            throw new IllegalStateException("LineScanner instances scan exactly one input");
        }
        if (snapshot.isEmpty()) {
            return new Outcome(List.of(), false, 0);
        }

        List<AnomalyMatch> matches = new ArrayList<>();
        long lineNumber = 0;
        boolean cancelled = false;

        while (true) {
            if (lineNumber % lineBatchSize == 0 && signal.isCancelled()) {
                cancelled = true;
                break;
            }
            String line = source.next();
            if (line == null) {
                break;
            }
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }

            // anchors see the trimmed text; the stored line stays raw
            Optional<PatternHit> hit = snapshot.match(line.strip());
            if (hit.isPresent()) {
                PatternHit h = hit.get();
                matches.add(new AnomalyMatch(lineNumber, line, h.getCategory(),
                        h.getPatternSource(), h.getMatchedText()));
            }
        }

        if (cancelled) {
            LOG.debug("Line scan cancelled after {} line(s), {} match(es)", lineNumber, matches.size());
        }
        return new Outcome(matches, cancelled, lineNumber);
    }

    /**
     * Result of one pass.
     */
    public static final class Outcome {
        private final List<AnomalyMatch> matches;
        private final boolean cancelled;
        private final long linesRead;

        Outcome(List<AnomalyMatch> matches, boolean cancelled, long linesRead) {
            this.matches = Collections.unmodifiableList(matches);
            this.cancelled = cancelled;
            this.linesRead = linesRead;
        }

        /**
         * @return unmodifiable matches in line order
         */
        public List<AnomalyMatch> getMatches() {
            return matches;
        }

        public boolean isCancelled() {
            return cancelled;
        }

        public long getLinesRead() {
            return linesRead;
        }
    }
}
