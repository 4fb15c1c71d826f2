package com.raditha.typebench.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raditha.typebench.model.MetricValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Writes summary rows as CSV and JSON.
 * <p>
 * The CSV file is keyed by {@code repo_name}: rows already in the file are
 * kept, rows for repositories evaluated again are replaced, and the result is
 * sorted by repository name. Exporting the same rows twice leaves the file unchanged.
 */
public class ResultExporter {

    private static final Logger logger = LoggerFactory.getLogger(ResultExporter.class);

    public static final String CSV_FILE = "typebench-results.csv";
    public static final String JSON_FILE = "typebench-results.json";
    public static final String REPO_NAME = "repo_name";

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /**
     * Merge rows into the CSV summary in {@code outputDir}.
     *
     * @param results rows of this run
     * @param columns columns after {@code repo_name}, in order
     * @return the CSV file
     */
    public Path exportToCsv(List<RepoResult> results, List<String> columns, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);
        Path csvPath = outputDir.resolve(CSV_FILE);

        Map<String, Map<String, String>> rows = new TreeMap<>(readExisting(csvPath));
        for (RepoResult result : results) {
            Map<String, String> row = new LinkedHashMap<>();
            for (String column : columns) {
                row.put(column, result.get(column).format());
            }
            rows.put(result.repo(), row);
        }

        StringBuilder csv = new StringBuilder();
        csv.append(REPO_NAME);
        for (String column : columns) {
            csv.append(',').append(column);
        }
        csv.append('\n');
        for (Map.Entry<String, Map<String, String>> row : rows.entrySet()) {
            csv.append(escape(row.getKey()));
            for (String column : columns) {
                csv.append(',').append(escape(row.getValue().getOrDefault(column, MetricValue.NOT_APPLICABLE_TEXT)));
            }
            csv.append('\n');
        }

        writeAtomically(csvPath, csv.toString());
        logger.info("Wrote {} rows to {}", rows.size(), csvPath);
        return csvPath;
    }

    /**
     * Write the rows of this run, including the JSON-only figures and failure reasons.
     *
     * @return the JSON file
     */
    public Path exportToJson(List<RepoResult> results, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);
        Path jsonPath = outputDir.resolve(JSON_FILE);

        ObjectNode root = mapper.createObjectNode();
        root.putPOJO("generated_at", Instant.now());
        ArrayNode repos = root.putArray("repos");
        for (RepoResult result : results) {
            ObjectNode node = repos.addObject();
            node.put(REPO_NAME, result.repo());
            if (result.isFailure()) {
                node.put("failure_reason", result.failureReason());
            }
            result.values().forEach((column, value) -> putMetric(node, column, value));
            result.supplementary().forEach((column, value) -> putMetric(node, column, value));
        }

        writeAtomically(jsonPath, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root));
        logger.info("Wrote {} repositories to {}", results.size(), jsonPath);
        return jsonPath;
    }

    private static void putMetric(ObjectNode node, String column, MetricValue value) {
        if (!value.isPresent()) {
            node.put(column, value.format());
        } else if (value.isIntegral()) {
            node.put(column, (long) value.asDouble());
        } else {
            node.put(column, value.asDouble());
        }
    }

    /**
     * Rows of an existing summary, keyed by repository name.
     */
    static Map<String, Map<String, String>> readExisting(Path csvPath) throws IOException {
        Map<String, Map<String, String>> rows = new LinkedHashMap<>();
        if (!Files.exists(csvPath)) {
            return rows;
        }
        List<String> lines = Files.readAllLines(csvPath, StandardCharsets.UTF_8);
        if (lines.isEmpty()) {
            return rows;
        }
        List<String> header = splitLine(lines.get(0));
        if (header.isEmpty() || !REPO_NAME.equals(header.get(0))) {
            logger.warn("Ignoring {}: first column is not {}", csvPath, REPO_NAME);
            return rows;
        }
        for (String line : lines.subList(1, lines.size())) {
            if (line.isBlank()) {
                continue;
            }
            List<String> cells = splitLine(line);
            Map<String, String> row = new LinkedHashMap<>();
            for (int i = 1; i < header.size() && i < cells.size(); i++) {
                row.put(header.get(i), cells.get(i));
            }
            rows.put(cells.get(0), row);
        }
        return rows;
    }

    private static void writeAtomically(Path target, String content) throws IOException {
        Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private static String escape(String cell) {
        if (cell.indexOf(',') < 0 && cell.indexOf('"') < 0 && cell.indexOf('\n') < 0) {
            return cell;
        }
        return '"' + cell.replace("\"", "\"\"") + '"';
    }

    private static List<String> splitLine(String line) {
        List<String> cells = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"' && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    cell.append('"');
                    i++;
                } else if (c == '"') {
                    quoted = false;
                } else {
                    cell.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                cells.add(cell.toString());
                cell.setLength(0);
            } else {
                cell.append(c);
            }
        }
        cells.add(cell.toString());
        return cells;
    }
}
