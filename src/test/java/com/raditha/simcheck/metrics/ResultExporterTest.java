package com.raditha.simcheck.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.simcheck.analyzer.SimilarityAnalyzer;
import com.raditha.simcheck.model.ComparisonOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ResultExporter - CSV and JSON export functionality.
 */
class ResultExporterTest {

    @TempDir
    Path tempDir;

    private ResultExporter exporter;
    private SimilarityAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        exporter = new ResultExporter();
        analyzer = new SimilarityAnalyzer();
    }

    @Test
    void testBuildMetrics() {
        ComparisonOutcome outcome = analyzer.compare("a.c", "int a=1;", "b.c", "int b=2;");

        ResultExporter.ComparisonMetrics metrics = exporter.buildMetrics(outcome);

        assertEquals("a.c", metrics.inputA());
        assertEquals("b.c", metrics.inputB());
        assertEquals("OK", metrics.status());
        assertEquals(1.0, metrics.similarity(), 0.0001);
        assertEquals(0, metrics.distance());
        assertEquals(5, metrics.tokenCountA());
        assertEquals("HIGH", metrics.verdict());
        assertTrue(metrics.failures().isEmpty());
        assertNotNull(metrics.timestamp());
    }

    @Test
    void testBuildMetricsForFailure() {
        ComparisonOutcome outcome = analyzer.compare("a.c", "", "b.c", "int x;");

        ResultExporter.ComparisonMetrics metrics = exporter.buildMetrics(outcome);

        assertEquals("FAILED", metrics.status());
        assertNull(metrics.similarity());
        assertNull(metrics.verdict());
        assertEquals(List.of("a.c: no tokens produced"), metrics.failures());
    }

    @Test
    void testExportToCsv() throws IOException {
        ComparisonOutcome outcome = analyzer.compare("a.c", "int a=1;", "b,c.c", "int b=2;");
        Path csvFile = tempDir.resolve(ResultExporter.CSV_FILE);

        exporter.exportToCsv(exporter.buildMetrics(outcome), csvFile);

        List<String> lines = Files.readAllLines(csvFile);
        assertEquals(2, lines.size());
        assertEquals("timestamp,input_a,input_b,status,similarity,distance,length_a,length_b,tokens_a,tokens_b,verdict,failures",
                lines.get(0));
        assertTrue(lines.get(1).contains(",a.c,\"b,c.c\",OK,1.0000,0,"));
        assertTrue(lines.get(1).endsWith(",5,5,HIGH,"));
    }

    @Test
    void testExportFailureToCsv() throws IOException {
        ComparisonOutcome outcome = analyzer.compare("a.c", null, "b.c", "   ");
        Path csvFile = tempDir.resolve(ResultExporter.CSV_FILE);

        exporter.exportToCsv(exporter.buildMetrics(outcome), csvFile);

        String row = Files.readAllLines(csvFile).get(1);
        assertTrue(row.contains(",FAILED,,,,,,,,"));
        assertTrue(row.endsWith("a.c: empty or unreadable input; b.c: no tokens produced"));
    }

    @Test
    void testExportToJson() throws IOException {
        ComparisonOutcome outcome = analyzer.compare("a.c", "int x", "b.c", "int y = 0;");
        Path jsonFile = tempDir.resolve(ResultExporter.JSON_FILE);

        exporter.exportToJson(exporter.buildMetrics(outcome), jsonFile);

        JsonNode json = new ObjectMapper().readTree(jsonFile.toFile());
        assertEquals("OK", json.get("status").asText());
        assertEquals(outcome.result().distance(), json.get("distance").asInt());
        assertEquals(outcome.result().similarity(), json.get("similarity").asDouble(), 1e-9);
        assertTrue(json.get("timestamp").isTextual(), "Timestamp should be ISO-8601 text");
    }

    @Test
    void testFailureJsonOmitsScores() throws IOException {
        ComparisonOutcome outcome = analyzer.compare("a.c", "", "b.c", "int x;");

        JsonNode json = new ObjectMapper().readTree(exporter.toJson(exporter.buildMetrics(outcome)));

        assertEquals("FAILED", json.get("status").asText());
        assertFalse(json.has("similarity"));
        assertFalse(json.has("verdict"));
        assertEquals(1, json.get("failures").size());
    }
}
