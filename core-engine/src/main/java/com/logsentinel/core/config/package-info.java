/**
 * Pattern documents, the built-in catalogue and scan tuning.
 *
 * <p>
 * Custom patterns are defined in YAML and parsed by
 * {@link com.logsentinel.core.config.PatternsLoader} into a
 * {@link com.logsentinel.core.config.PatternsConfig}; every entry is
 * validated before any of them is handed to a registry.
 * </p>
 *
 * @since 1.0.0
 */
package com.logsentinel.core.config;
