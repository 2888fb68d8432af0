package com.logsentinel.core.detection;

import com.logsentinel.core.config.DefaultPatterns;
import com.logsentinel.core.config.PatternLoadResult;
import com.logsentinel.core.model.AnomalyPattern;
import com.logsentinel.core.model.PatternOrigin;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PatternRegistry}.
 */
class PatternRegistryTest {

    private PatternRegistry registry;

    @BeforeEach
    void setUp() {
        Map<String, String> defaults = new LinkedHashMap<>();
        defaults.put("OOM", "CRASH");
        defaults.put("Kernel panic", "KERNEL_PANIC");
        registry = new PatternRegistry(defaults);
        registry.loadDefaults();
    }

    @Test
    @DisplayName("A new registry should be empty until defaults are loaded")
    void newRegistryShouldBeEmpty() {
        PatternRegistry fresh = new PatternRegistry();

        assertThat(fresh.snapshot().isEmpty()).isTrue();
        assertThat(fresh.snapshot().match("Kernel panic")).isEmpty();

        fresh.loadDefaults();
        assertThat(fresh.list()).hasSize(DefaultPatterns.asMap().size());
        assertThat(fresh.snapshot().match("Kernel panic - not syncing"))
                .map(PatternHit::getCategory).contains("KERNEL_PANIC");
    }

    @Test
    @DisplayName("loadDefaults should be idempotent")
    void loadDefaultsShouldBeIdempotent() {
        PatternSet before = registry.snapshot();

        PatternSet after = registry.loadDefaults();

        assertThat(after).isSameAs(before);
        assertThat(registry.list()).hasSize(2);
    }

    @Test
    @DisplayName("Custom category should win over a colliding default")
    void customShouldOverrideDefault() {
        PatternLoadResult result = registry.merge(Map.of("OOM", "MEMORY"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(registry.snapshot().match("OOM killer invoked"))
                .map(PatternHit::getCategory).contains("MEMORY");
        assertThat(registry.snapshot().find("OOM"))
                .map(AnomalyPattern::getOrigin).contains(PatternOrigin.CUSTOM);
    }

    @Test
    @DisplayName("Overridden defaults keep their position, new custom rules are appended")
    void mergeShouldPreserveOrder() {
        Map<String, String> custom = new LinkedHashMap<>();
        custom.put("Timeout", "TIMEOUT");
        custom.put("Kernel panic", "PANIC");

        registry.merge(custom);

        assertThat(registry.list()).extracting(AnomalyPattern::getSource)
                .containsExactly("OOM", "Kernel panic", "Timeout");
        assertThat(registry.list()).extracting(AnomalyPattern::getCategory)
                .containsExactly("CRASH", "PANIC", "TIMEOUT");
        assertThat(registry.listCustom()).extracting(AnomalyPattern::getSource)
                .containsExactly("Kernel panic", "Timeout");
    }

    @Test
    @DisplayName("A custom document with one invalid regex should be rejected and leave the registry untouched")
    void invalidDocumentShouldBeRejectedAtomically() {
        registry.merge(Map.of("Timeout", "TIMEOUT"));
        PatternSet before = registry.snapshot();

        String document = "patterns:\n"
                + "  \"ERROR|FAIL\": GENERIC_ERROR\n"
                + "  Timeout: OTHER\n"
                + "  'disk\\s+full': DISK_FULL\n"
                + "  'fan\\s+failure': FAN_FAILURE\n"
                + "  \"unclosed(group\": BROKEN\n"
                + "  'temp(erature)?\\s+high': OVERHEAT\n";
        PatternLoadResult result = registry.loadCustom(document);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getOffendingPattern()).contains("unclosed(group");
        assertThat(registry.snapshot()).isSameAs(before);
        assertThat(registry.snapshot().match("disk full")).isEmpty();
        assertThat(registry.snapshot().match("Timeout")).map(PatternHit::getCategory).contains("TIMEOUT");
    }

    @Test
    @DisplayName("A valid custom document should replace the previous custom rules")
    void loadCustomShouldReplaceCustomRules() {
        registry.merge(Map.of("Timeout", "TIMEOUT"));

        PatternLoadResult result = registry.loadCustom("patterns:\n  'disk\\s+full': DISK_FULL\n  OOM: MEMORY\n");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getLoadedCount()).isEqualTo(2);
        assertThat(registry.list()).extracting(AnomalyPattern::getSource)
                .containsExactly("OOM", "Kernel panic", "disk\\s+full");
        assertThat(registry.snapshot().match("connect Timeout")).isEmpty();
    }

    @Test
    @DisplayName("remove should delete a rule from both layers")
    void removeShouldDeleteFromBothLayers() {
        registry.merge(Map.of("OOM", "MEMORY"));

        assertThat(registry.remove("OOM")).isTrue();
        assertThat(registry.snapshot().match("OOM")).isEmpty();
        assertThat(registry.remove("OOM")).isFalse();
        assertThat(registry.list()).extracting(AnomalyPattern::getSource).containsExactly("Kernel panic");
    }

    @Test
    @DisplayName("add and update should validate and publish a new snapshot")
    void addAndUpdate() {
        assertThat(registry.add("Timeout", "TIMEOUT").isSuccess()).isTrue();
        assertThat(registry.add("broken[", "X").isSuccess()).isFalse();

        PatternLoadResult updated = registry.update("Kernel panic", "Kernel (panic|oops)", "KERNEL_FAULT");

        assertThat(updated.isSuccess()).isTrue();
        assertThat(registry.list()).extracting(AnomalyPattern::getSource)
                .containsExactly("OOM", "Timeout", "Kernel (panic|oops)");
        assertThat(registry.snapshot().match("Kernel oops"))
                .map(PatternHit::getCategory).contains("KERNEL_FAULT");
    }

    @Test
    @DisplayName("update of an unknown rule or to an invalid regex should fail without changes")
    void updateShouldFailCleanly() {
        PatternSet before = registry.snapshot();

        assertThat(registry.update("missing", "x", "X").isSuccess()).isFalse();
        assertThat(registry.update("OOM", "(", "X").isSuccess()).isFalse();
        assertThat(registry.snapshot()).isSameAs(before);
    }

    @Test
    @DisplayName("resetToDefaults should drop custom rules and restore removed defaults")
    void resetShouldRestoreDefaults() {
        registry.merge(Map.of("OOM", "MEMORY", "Timeout", "TIMEOUT"));
        registry.remove("Kernel panic");

        registry.resetToDefaults();

        assertThat(registry.listCustom()).isEmpty();
        assertThat(registry.list()).extracting(AnomalyPattern::getCategory)
                .containsExactly("CRASH", "KERNEL_PANIC");
    }

    @Test
    @DisplayName("Snapshots already taken should not see later mutations")
    void snapshotsShouldBeImmutable() {
        PatternSet taken = registry.snapshot();

        registry.merge(Map.of("Timeout", "TIMEOUT"));
        registry.remove("OOM");

        assertThat(taken.getPatterns()).extracting(AnomalyPattern::getSource)
                .containsExactly("OOM", "Kernel panic");
        assertThat(taken.match("Timeout")).isEmpty();
        assertThat(registry.snapshot().getVersion()).isGreaterThan(taken.getVersion());
    }

    @Test
    @DisplayName("Constructor should reject an invalid default catalogue")
    void constructorShouldRejectInvalidDefaults() {
        assertThatThrownBy(() -> new PatternRegistry(Map.of("[", "X")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid default patterns");
    }

    @Test
    @DisplayName("loadCustomResolved should fall back to patterns.yml on the classpath")
    void loadCustomResolvedShouldUseClasspathFallback() {
        PatternLoadResult result = registry.loadCustomResolved(null);

        assertThat(result.isSuccess()).isTrue();
        assertThat(registry.listCustom()).extracting(AnomalyPattern::getCategory)
                .containsExactly("THERMAL_SHUTDOWN");
    }

    @Test
    @DisplayName("Snapshot listings should be unmodifiable")
    void listingsShouldBeUnmodifiable() {
        List<AnomalyPattern> list = registry.list();

        assertThatThrownBy(() -> list.add(AnomalyPattern.custom("x", "X")))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
