package com.logsentinel.core.export;

import com.logsentinel.core.detection.PatternRegistry;
import com.logsentinel.core.model.AnomalyPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Writes patterns back out in the document format the pattern loader reads.
 *
 * <pre>
 * patterns:
 *   ERROR|FAIL: GENERIC_ERROR
 *   Timeout: TIMEOUT
 * </pre>
 *
 * Entries keep registration order, so loading the document back yields the
 * same tie-breaks.
 *
 * @since 1.0.0
 */
public final class PatternsExporter {

    private static final Logger LOG = LoggerFactory.getLogger(PatternsExporter.class);

    private PatternsExporter() {
        // utility class: not instantiable
    }

    /**
     * @param registry registry to export
     * @param customOnly {@code true} to export only custom rules
     * @return YAML document
     */
    public static String toYaml(PatternRegistry registry, boolean customOnly) {
        Objects.requireNonNull(registry, "PatternRegistry must not be null");
        return toYaml(customOnly ? registry.listCustom() : registry.list());
    }

    /**
     * @param patterns rules to export, in registration order
     * @return YAML document
     */
    public static String toYaml(List<AnomalyPattern> patterns) {
        Objects.requireNonNull(patterns, "patterns must not be null");
        Map<String, String> ordered = new LinkedHashMap<>();
        patterns.forEach(p -> ordered.put(p.getSource(), p.getCategory()));

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("patterns", ordered);

        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setIndent(2);
        options.setWidth(Integer.MAX_VALUE);
        return new Yaml(options).dump(document);
    }

    /**
     * Write the exported document, creating missing parent directories.
     *
     * @param registry   registry to export
     * @param customOnly {@code true} to export only custom rules
     * @param target     destination file; replaced if it exists
     * @throws IOException if the file cannot be written
     */
    public static void write(PatternRegistry registry, boolean customOnly, Path target) throws IOException {
        Objects.requireNonNull(target, "target must not be null");
        String yaml = toYaml(registry, customOnly);
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, yaml, StandardCharsets.UTF_8);
        LOG.info("Exported {} patterns to {}", customOnly ? "custom" : "all", target);
    }
}
