package com.logsentinel.core.scan;

/**
 * Lifecycle of one folder scan.
 *
 * <pre>
 * IDLE → ENUMERATING → RUNNING → AGGREGATING → DONE
 *                                           ↘ CANCELLED
 * </pre>
 *
 * <p>
 * {@link #CANCELLED} is terminal like {@link #DONE}; the scan still produces a
 * well-formed, partial report.
 * </p>
 *
 * @since 1.0.0
 */
public enum ScanState {
    IDLE,
    ENUMERATING,
    RUNNING,
    AGGREGATING,
    DONE,
    CANCELLED;

    public boolean isTerminal() {
        return this == DONE || this == CANCELLED;
    }
}
