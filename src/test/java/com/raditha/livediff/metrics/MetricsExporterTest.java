package com.raditha.livediff.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.livediff.analyzer.DumpComparator;
import com.raditha.livediff.model.ComparisonReport;
import com.raditha.livediff.parser.DumpParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MetricsExporter - CSV and JSON export functionality.
 */
class MetricsExporterTest {

    @TempDir
    Path tempDir;

    private MetricsExporter exporter;
    private ComparisonReport report;

    @BeforeEach
    void setUp() throws IOException {
        exporter = new MetricsExporter(Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC));
        DumpParser parser = new DumpParser();
        report = new DumpComparator().compare(
                parser.parse(Path.of("src/test/resources/dumps/debug_master.txt"), "master"),
                parser.parse(Path.of("src/test/resources/dumps/debug_iterative.txt"), "iterative"));
    }

    @Test
    void testBuildMetrics() {
        MetricsExporter.ComparisonMetrics metrics = exporter.buildMetrics(report);

        assertEquals("master", metrics.leftLabel());
        assertEquals("iterative", metrics.rightLabel());
        assertEquals(1, metrics.functionsOnlyInLeft());
        assertEquals(1, metrics.functionsOnlyInRight());
        assertEquals(1, metrics.functionsWithDifferences());
        assertEquals(0, metrics.totals().blocksOnlyInLeft());
        assertEquals(1, metrics.totals().blocksOnlyInRight());
        assertEquals(1, metrics.totals().blocksWithDifferences());
        assertEquals(1, metrics.totals().changedVars());
        assertEquals(0, metrics.totals().avoidChanges());
        assertEquals(List.of("foo"), metrics.functions().stream().map(MetricsExporter.FunctionMetrics::function).toList());
    }

    @Test
    void testCsvExport() throws IOException {
        Path csv = tempDir.resolve("metrics.csv");
        exporter.exportToCsv(exporter.buildMetrics(report), csv);

        List<String> lines = Files.readAllLines(csv);
        assertEquals("# Comparison Summary", lines.get(0));
        assertEquals("2026-03-01T10:15:30,master,iterative,1,1,1,0,1,1,0,0,1,0", lines.get(2));
        assertTrue(lines.contains("# Per-Function Metrics"));
        assertTrue(lines.contains("foo,0,1,1,0,0,1,0"));
    }

    @Test
    void testJsonExport() throws IOException {
        Path json = tempDir.resolve("metrics.json");
        exporter.exportToJson(exporter.buildMetrics(report), json);

        JsonNode root = new ObjectMapper().readTree(json.toFile());
        assertEquals("master", root.get("leftLabel").asText());
        assertEquals("2026-03-01T10:15:30", root.get("timestamp").asText());
        assertEquals(1, root.get("totals").get("changedVars").asInt());
        assertEquals("foo", root.get("functions").get(0).get("function").asText());
    }

    @Test
    void testCsvFieldQuoting() {
        assertEquals("plain", MetricsExporter.csvField("plain"));
        assertEquals("\"a,b\"", MetricsExporter.csvField("a,b"));
        assertEquals("\"say \"\"hi\"\"\"", MetricsExporter.csvField("say \"hi\""));
    }
}
