package com.logsentinel.core.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logsentinel.core.model.AggregateReport;
import com.logsentinel.core.model.AnomalyMatch;
import com.logsentinel.core.model.FileAccessError;
import com.logsentinel.core.model.ScanResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ReportExporter}.
 */
class ReportExporterTest {

    private static final Path AP2 = Path.of("logs", "ap2.log");
    private static final Path AP1 = Path.of("logs", "ap1.log");
    private static final Path LOCKED = Path.of("logs", "locked.txt");

    private final ReportExporter exporter = new ReportExporter();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("Should write summary, anomaly rows and failure rows in report order")
    void shouldWriteDocument() throws IOException {
        JsonNode json = mapper.readTree(exporter.toJson(sampleReport()));

        JsonNode summary = json.get("summary");
        assertThat(summary.get("total_files").asInt()).isEqualTo(3);
        assertThat(summary.get("successful_files").asInt()).isEqualTo(2);
        assertThat(summary.get("failed_files").asInt()).isEqualTo(1);
        assertThat(summary.get("cancelled_files").asInt()).isZero();
        assertThat(summary.get("total_matches").asLong()).isEqualTo(3);
        assertThat(summary.get("cancelled").asBoolean()).isFalse();
        assertThat(summary.get("category_counts").get("TIMEOUT").asLong()).isEqualTo(2);

        JsonNode anomalies = json.get("anomalies");
        assertThat(anomalies).hasSize(3);
        JsonNode first = anomalies.get(0);
        assertThat(first.get("file_path").asText()).isEqualTo(AP1.toString());
        assertThat(first.get("device").asText()).isEqualTo("ap1");
        assertThat(first.get("line_number").asLong()).isEqualTo(4);
        assertThat(first.get("line_text").asText()).isEqualTo("connect Timeout");
        assertThat(first.get("category").asText()).isEqualTo("TIMEOUT");
        assertThat(first.get("matched_pattern").asText()).isEqualTo("Timeout");
        assertThat(anomalies.get(2).get("device").asText()).isEqualTo("ap2");

        JsonNode failures = json.get("failures");
        assertThat(failures).hasSize(1);
        assertThat(failures.get(0).get("file_path").asText()).isEqualTo(LOCKED.toString());
        assertThat(failures.get(0).get("error_type").asText()).isEqualTo("AccessDeniedException");
    }

    @Test
    @DisplayName("Should keep field order stable and contain no timestamps")
    void shouldBeDeterministic() {
        String json = exporter.toJson(sampleReport());

        assertThat(exporter.toJson(sampleReport())).isEqualTo(json);
        assertThat(json.indexOf("\"summary\"")).isLessThan(json.indexOf("\"anomalies\""));
        assertThat(json.indexOf("\"anomalies\"")).isLessThan(json.indexOf("\"failures\""));
        assertThat(json).doesNotContain("timestamp");
    }

    @Test
    @DisplayName("Should create missing parent directories when writing")
    void shouldWriteFile(@TempDir Path dir) throws IOException {
        Path target = dir.resolve("reports").resolve("out.json");

        exporter.write(AggregateReport.empty(), target);

        JsonNode json = mapper.readTree(Files.readString(target));
        assertThat(json.get("summary").get("total_files").asInt()).isZero();
        assertThat(json.get("anomalies")).isEmpty();
    }

    @Test
    @DisplayName("Device name should be the file name without its last extension")
    void deviceShouldStripExtension() {
        assertThat(ReportExporter.deviceOf(Path.of("x", "router-7.log"))).isEqualTo("router-7");
        assertThat(ReportExporter.deviceOf(Path.of("console.2024.out"))).isEqualTo("console.2024");
        assertThat(ReportExporter.deviceOf(Path.of(".hidden"))).isEqualTo(".hidden");
        assertThat(ReportExporter.deviceOf(Path.of("noext"))).isEqualTo("noext");
    }

    private static AggregateReport sampleReport() {
        ScanResult ap2 = ScanResult.completed(AP2, List.of(
                new AnomalyMatch(1, "FAIL: radio", "GENERIC_ERROR", "ERROR|FAIL", "FAIL")));
        ScanResult ap1 = ScanResult.completed(AP1, List.of(
                new AnomalyMatch(4, "connect Timeout", "TIMEOUT", "Timeout", "Timeout"),
                new AnomalyMatch(9, "read Timeout", "TIMEOUT", "Timeout", "Timeout")));
        ScanResult locked = ScanResult.failed(LOCKED,
                new FileAccessError(LOCKED, "AccessDeniedException", LOCKED.toString()));
        return AggregateReport.of(List.of(ap2, locked, ap1), false);
    }
}
