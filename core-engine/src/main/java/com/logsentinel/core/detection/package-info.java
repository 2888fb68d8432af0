/**
 * Pattern-matching engine.
 *
 * <p>
 * {@link com.logsentinel.core.detection.PatternRegistry} owns the rules and
 * publishes immutable {@link com.logsentinel.core.detection.PatternSet}
 * snapshots, each carrying the
 * {@link com.logsentinel.core.detection.CompiledMatcher} built from it.
 * {@link com.logsentinel.core.detection.LineScanner} runs one snapshot over
 * one stream of lines.
 * </p>
 *
 * @since 1.0.0
 */
package com.logsentinel.core.detection;
