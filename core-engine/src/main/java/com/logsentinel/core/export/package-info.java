/**
 * Serialisation of scan reports (JSON, Jackson) and pattern sets (YAML,
 * SnakeYAML).
 *
 * @since 1.0.0
 */
package com.logsentinel.core.export;
