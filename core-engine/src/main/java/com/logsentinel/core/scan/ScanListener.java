package com.logsentinel.core.scan;

import com.logsentinel.core.model.ScanResult;

/**
 * Progress callback of a folder scan.
 *
 * <p>
 * Invoked once per scanned file, from worker threads, so implementations must
 * be thread-safe. Exceptions thrown by a listener are logged and otherwise
 * ignored.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ScanListener {

    /** Listener that ignores every event. */
    ScanListener NONE = (result, completed, total) -> {
    };

    /**
     * @param result    the finished file
     * @param completed files finished so far, this one included
     * @param total     files the scan will process
     */
    void onFileScanned(ScanResult result, int completed, int total);
}
