package com.raditha.typebench.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.typebench.model.MetricValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResultExporterTest {

    private static final List<String> COLUMNS = List.of("total_vars", "overall_score", "repo_b_consistency");

    @TempDir
    Path outputDir;

    private ResultExporter exporter;

    @BeforeEach
    void setUp() {
        exporter = new ResultExporter();
    }

    private static RepoResult row(String repo, long total, double overall, MetricValue consistency) {
        Map<String, MetricValue> values = new LinkedHashMap<>();
        values.put("total_vars", MetricValue.count(total));
        values.put("overall_score", MetricValue.of(overall));
        values.put("repo_b_consistency", consistency);
        return new RepoResult(repo, values, Map.of("repo_b_normalized_consistency", MetricValue.of(0.5)), null);
    }

    @Test
    void testWritesSortedCsv() throws IOException {
        Path csv = exporter.exportToCsv(List.of(
                row("zeta", 3, 0.5, MetricValue.count(1)),
                row("alpha", 10, 0.91234, MetricValue.unavailable())), COLUMNS, outputDir);

        assertEquals(outputDir.resolve(ResultExporter.CSV_FILE), csv);
        assertEquals(List.of(
                "repo_name,total_vars,overall_score,repo_b_consistency",
                "alpha,10,0.9123,unavailable",
                "zeta,3,0.5000,1"), Files.readAllLines(csv));
    }

    @Test
    void testMergesWithExistingRows() throws IOException {
        exporter.exportToCsv(List.of(
                row("alpha", 10, 0.9, MetricValue.count(0)),
                row("beta", 4, 0.1, MetricValue.count(2))), COLUMNS, outputDir);

        Path csv = exporter.exportToCsv(List.of(row("beta", 5, 0.2, MetricValue.count(3)),
                row("gamma", 1, 1.0, MetricValue.count(0))), COLUMNS, outputDir);

        assertEquals(List.of(
                "repo_name,total_vars,overall_score,repo_b_consistency",
                "alpha,10,0.9000,0",
                "beta,5,0.2000,3",
                "gamma,1,1.0000,0"), Files.readAllLines(csv));
    }

    @Test
    void testExportIsIdempotent() throws IOException {
        List<RepoResult> rows = List.of(row("alpha", 10, 0.9, MetricValue.count(0)));
        Path csv = exporter.exportToCsv(rows, COLUMNS, outputDir);
        String first = Files.readString(csv);

        exporter.exportToCsv(rows, COLUMNS, outputDir);

        assertEquals(first, Files.readString(csv));
    }

    @Test
    void testQuotedRepositoryNames() throws IOException {
        Path csv = exporter.exportToCsv(List.of(row("odd,name", 1, 1.0, MetricValue.count(0))), COLUMNS, outputDir);

        assertEquals("\"odd,name\",1,1.0000,0", Files.readAllLines(csv).get(1));
        assertEquals("1", ResultExporter.readExisting(csv).get("odd,name").get("total_vars"));
    }

    @Test
    void testNewColumnsAreNotApplicableForOldRows() throws IOException {
        exporter.exportToCsv(List.of(row("alpha", 10, 0.9, MetricValue.count(0))),
                List.of("total_vars"), outputDir);

        Path csv = exporter.exportToCsv(List.of(row("beta", 2, 0.5, MetricValue.count(1))), COLUMNS, outputDir);

        assertEquals("alpha,10,N/A,N/A", Files.readAllLines(csv).get(1));
    }

    @Test
    void testForeignCsvIsReplaced() throws IOException {
        Files.writeString(outputDir.resolve(ResultExporter.CSV_FILE), "name,score\nx,1\n");

        Path csv = exporter.exportToCsv(List.of(row("alpha", 1, 1.0, MetricValue.count(0))), COLUMNS, outputDir);

        assertEquals(2, Files.readAllLines(csv).size());
    }

    @Test
    void testJsonCarriesSentinelsFailuresAndSupplementaryFigures() throws IOException {
        RepoResult failed = new RepoResult("broken", Map.of("total_vars", MetricValue.notApplicable()), Map.of(),
                "truth tree missing");

        Path json = exporter.exportToJson(List.of(row("alpha", 10, 0.75, MetricValue.unavailable()), failed),
                outputDir);

        JsonNode root = new ObjectMapper().readTree(json.toFile());
        assertTrue(root.has("generated_at"));
        JsonNode alpha = root.get("repos").get(0);
        assertEquals("alpha", alpha.get("repo_name").asText());
        assertTrue(alpha.get("total_vars").isIntegralNumber());
        assertEquals(10, alpha.get("total_vars").asLong());
        assertEquals(0.75, alpha.get("overall_score").asDouble(), 1e-12);
        assertEquals("unavailable", alpha.get("repo_b_consistency").asText());
        assertEquals(0.5, alpha.get("repo_b_normalized_consistency").asDouble(), 1e-12);
        assertFalse(alpha.has("failure_reason"));

        JsonNode broken = root.get("repos").get(1);
        assertEquals("truth tree missing", broken.get("failure_reason").asText());
        assertEquals("N/A", broken.get("total_vars").asText());
    }
}
