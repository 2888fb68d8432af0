package com.logsentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ScanOptions}.
 */
class ScanOptionsTest {

    @Test
    @DisplayName("Worker count should be min(processors x 3, files, 16) and at least 1")
    void workerCountShouldBeBounded() {
        ScanOptions options = ScanOptions.defaults();

        assertThat(options.workerCount(100, 2)).isEqualTo(6);
        assertThat(options.workerCount(4, 8)).isEqualTo(4);
        assertThat(options.workerCount(100, 64)).isEqualTo(16);
        assertThat(options.workerCount(0, 4)).isEqualTo(1);
        assertThat(options.workerCount(10, 0)).isEqualTo(3);
    }

    @Test
    @DisplayName("Worker multiplier and cap should be configurable")
    void workerCountShouldFollowOptions() {
        ScanOptions options = ScanOptions.builder().workersPerProcessor(1).maxWorkers(2).build();

        assertThat(options.workerCount(100, 8)).isEqualTo(2);
        assertThat(options.workerCount(100, 1)).isEqualTo(1);
    }

    @Test
    @DisplayName("Default filter should accept .log, .txt and .out regardless of case")
    void defaultFilterShouldMatchExtensions() {
        ScanOptions options = ScanOptions.defaults();

        assertThat(options.accepts(Path.of("a", "device1.log"))).isTrue();
        assertThat(options.accepts(Path.of("device2.TXT"))).isTrue();
        assertThat(options.accepts(Path.of("console.out"))).isTrue();
        assertThat(options.accepts(Path.of("image.bin"))).isFalse();
        assertThat(options.accepts(Path.of("log"))).isFalse();
    }

    @Test
    @DisplayName("Extensions should be normalised and an empty filter should accept everything")
    void extensionsShouldBeNormalised() {
        ScanOptions custom = ScanOptions.builder().fileExtensions(List.of(" CSV ", "json", "")).build();

        assertThat(custom.getFileExtensions()).containsExactly(".csv", ".json");
        assertThat(custom.accepts(Path.of("x.csv"))).isTrue();
        assertThat(custom.accepts(Path.of("x.log"))).isFalse();

        ScanOptions all = ScanOptions.builder().allFiles().build();
        assertThat(all.getFileExtensions()).isEmpty();
        assertThat(all.accepts(Path.of("anything.bin"))).isTrue();
    }

    @Test
    @DisplayName("Builder should reject out-of-range values")
    void builderShouldValidate() {
        assertThatThrownBy(() -> ScanOptions.builder().workersPerProcessor(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("workersPerProcessor");
        assertThatThrownBy(() -> ScanOptions.builder().maxWorkers(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxWorkers");
        assertThatThrownBy(() -> ScanOptions.builder().lineBatchSize(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("lineBatchSize");
    }
}
