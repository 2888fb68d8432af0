package com.logsentinel.core.model;

/**
 * Terminal status of a single file scan.
 *
 * <p>
 * A file that could not be read is still {@link #COMPLETED}; the failure is
 * carried by {@link ScanResult#getError()}.
 * </p>
 *
 * @since 1.0.0
 */
public enum ScanStatus {
    COMPLETED,
    CANCELLED
}
