/**
 * Command-line job that scans a log folder once and writes a JSON report.
 *
 * @since 1.0.0
 */
package com.logsentinel.job;
