package com.logsentinel.job;

import com.logsentinel.core.config.ScanOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Should fall back to defaults when no variables are set")
    void shouldUseDefaults() {
        JobConfig config = JobConfig.fromEnvironment(name -> null);

        assertThat(config.getLogRoot()).isEqualTo(".");
        assertThat(config.getPatternsConfigPath()).isEmpty();
        assertThat(config.getReportOutputDir()).isEqualTo("reports");
        assertThat(config.getMaxWorkers()).isEqualTo(16);
        assertThat(config.getWorkersPerProcessor()).isEqualTo(3);
        assertThat(config.getLineBatchSize()).isEqualTo(1024);
        assertThat(config.getFileExtensions()).containsExactly(".log", ".txt", ".out");
        assertThat(config.isFollowLinks()).isFalse();
    }

    @Test
    @DisplayName("Should read every variable and map them onto scan options")
    void shouldReadEnvironment() {
        Map<String, String> env = new HashMap<>();
        env.put("LOG_ROOT", "/var/log/devices");
        env.put("PATTERNS_CONFIG_PATH", "/etc/log-sentinel/patterns.yml");
        env.put("REPORT_OUTPUT_DIR", "/tmp/reports");
        env.put("SCAN_MAX_WORKERS", "4");
        env.put("SCAN_WORKERS_PER_CPU", "2");
        env.put("SCAN_LINE_BATCH_SIZE", "64");
        env.put("SCAN_FILE_EXTENSIONS", "log, csv ,");
        env.put("SCAN_FOLLOW_LINKS", "true");

        JobConfig config = JobConfig.fromEnvironment(env::get);
        ScanOptions options = config.toScanOptions();

        assertThat(config.getLogRoot()).isEqualTo("/var/log/devices");
        assertThat(config.getPatternsConfigPath()).isEqualTo("/etc/log-sentinel/patterns.yml");
        assertThat(config.getReportOutputDir()).isEqualTo("/tmp/reports");
        assertThat(options.getMaxWorkers()).isEqualTo(4);
        assertThat(options.getWorkersPerProcessor()).isEqualTo(2);
        assertThat(options.getLineBatchSize()).isEqualTo(64);
        assertThat(options.getFileExtensions()).containsExactly(".log", ".csv");
        assertThat(options.isFollowLinks()).isTrue();
    }

    @Test
    @DisplayName("A '*' extension list should scan every file")
    void starShouldDisableFilter() {
        JobConfig config = JobConfig.fromEnvironment(Map.of("SCAN_FILE_EXTENSIONS", "*")::get);

        assertThat(config.toScanOptions().getFileExtensions()).isEmpty();
    }

    @Test
    @DisplayName("Should report unparsable numbers as a configuration error")
    void shouldRejectBadNumbers() {
        assertThatThrownBy(() -> JobConfig.fromEnvironment(Map.of("SCAN_MAX_WORKERS", "many")::get))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("many");
    }

    @Test
    @DisplayName("Builder should reject out-of-range values")
    void builderShouldValidate() {
        assertThatThrownBy(() -> new JobConfig.Builder().maxWorkers(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxWorkers");
        assertThatThrownBy(() -> new JobConfig.Builder().lineBatchSize(-1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("lineBatchSize");
        assertThatThrownBy(() -> new JobConfig.Builder().logRoot(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("logRoot");
    }

    @Test
    @DisplayName("withLogRoot should only replace the root")
    void withLogRootShouldCopy() {
        JobConfig base = new JobConfig.Builder().maxWorkers(2).fileExtensions(List.of(".log")).build();

        JobConfig moved = base.withLogRoot("/data");

        assertThat(moved.getLogRoot()).isEqualTo("/data");
        assertThat(moved.getMaxWorkers()).isEqualTo(2);
        assertThat(moved.getFileExtensions()).containsExactly(".log");
        assertThat(base.getLogRoot()).isEqualTo(".");
    }
}
