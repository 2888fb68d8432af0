/**
 * Domain model classes for Log Sentinel.
 *
 * <p>
 * Value types shared between the pattern engine, the folder scanner and the
 * exporters:
 * </p>
 * <ul>
 * <li>{@link com.logsentinel.core.model.AnomalyPattern}: regex rule and its
 * category</li>
 * <li>{@link com.logsentinel.core.model.AnomalyMatch}: one classified
 * line</li>
 * <li>{@link com.logsentinel.core.model.ScanResult}: outcome of one
 * file</li>
 * <li>{@link com.logsentinel.core.model.AggregateReport}: sorted summary of a
 * folder scan</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.logsentinel.core.model;
