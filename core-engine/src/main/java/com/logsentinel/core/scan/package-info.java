/**
 * Concurrent folder scanning.
 *
 * <p>
 * {@link com.logsentinel.core.scan.FolderScanOrchestrator} enumerates a
 * folder, scans each file on a bounded pool and aggregates the results;
 * {@link com.logsentinel.core.scan.ScanHandle} observes and cancels a running
 * scan.
 * </p>
 *
 * @since 1.0.0
 */
package com.logsentinel.core.scan;
