package com.logsentinel.core.model;

/**
 * Where an {@link AnomalyPattern} came from.
 *
 * @since 1.0.0
 */
public enum PatternOrigin {

    /** Part of the built-in pattern catalogue. */
    DEFAULT,

    /** Supplied by the user (pattern document, single add or edit). */
    CUSTOM
}
