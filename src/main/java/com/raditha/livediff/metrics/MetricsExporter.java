package com.raditha.livediff.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raditha.livediff.model.BlockDiff;
import com.raditha.livediff.model.ComparisonReport;
import com.raditha.livediff.model.FunctionDiff;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Exports comparison metrics to CSV and JSON formats for dashboards and historical tracking.
 */
public class MetricsExporter {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Clock clock;

    public MetricsExporter() {
        this(Clock.systemDefaultZone());
    }

    public MetricsExporter(Clock clock) {
        this.clock = clock;
    }

    /**
     * Totals over one comparison.
     */
    public record ComparisonMetrics(
            LocalDateTime timestamp,
            String leftLabel,
            String rightLabel,
            int functionsOnlyInLeft,
            int functionsOnlyInRight,
            int functionsWithDifferences,
            Totals totals,
            List<FunctionMetrics> functions) {
    }

    /**
     * Counts below one function, or summed over all of them.
     */
    public record Totals(
            int blocksOnlyInLeft,
            int blocksOnlyInRight,
            int blocksWithDifferences,
            int varsOnlyInLeft,
            int varsOnlyInRight,
            int changedVars,
            int avoidChanges) {

        static final Totals ZERO = new Totals(0, 0, 0, 0, 0, 0, 0);

        Totals plus(Totals other) {
            return new Totals(
                    blocksOnlyInLeft + other.blocksOnlyInLeft,
                    blocksOnlyInRight + other.blocksOnlyInRight,
                    blocksWithDifferences + other.blocksWithDifferences,
                    varsOnlyInLeft + other.varsOnlyInLeft,
                    varsOnlyInRight + other.varsOnlyInRight,
                    changedVars + other.changedVars,
                    avoidChanges + other.avoidChanges);
        }
    }

    /**
     * Per-function metrics.
     */
    public record FunctionMetrics(String function, Totals totals) {
    }

    /**
     * Build aggregated metrics from a comparison report.
     */
    public ComparisonMetrics buildMetrics(ComparisonReport report) {
        List<FunctionMetrics> functions = report.functionDiffs().stream()
                .map(f -> new FunctionMetrics(f.name(), totalsFor(f)))
                .toList();

        Totals totals = functions.stream()
                .map(FunctionMetrics::totals)
                .reduce(Totals.ZERO, Totals::plus);

        return new ComparisonMetrics(
                LocalDateTime.now(clock),
                report.leftLabel(),
                report.rightLabel(),
                report.functionsOnlyInLeft().size(),
                report.functionsOnlyInRight().size(),
                report.functionDiffs().size(),
                totals,
                functions);
    }

    private static Totals totalsFor(FunctionDiff function) {
        int varsOnlyLeft = 0;
        int varsOnlyRight = 0;
        int changed = 0;
        int avoid = 0;
        for (BlockDiff block : function.blockDiffs()) {
            varsOnlyLeft += block.varsOnlyInLeft().size();
            varsOnlyRight += block.varsOnlyInRight().size();
            changed += block.totalChangedVars();
            avoid += block.avoidChange().isPresent() ? 1 : 0;
        }
        return new Totals(
                function.blocksOnlyInLeft().size(),
                function.blocksOnlyInRight().size(),
                function.blockDiffs().size(),
                varsOnlyLeft,
                varsOnlyRight,
                changed,
                avoid);
    }

    /**
     * Export metrics to CSV format.
     */
    public void exportToCsv(ComparisonMetrics metrics, Path outputPath) throws IOException {
        StringBuilder csv = new StringBuilder();
        Totals t = metrics.totals();

        csv.append("# Comparison Summary\n");
        csv.append("timestamp,left,right,functions_only_left,functions_only_right,functions_differing,"
                + "blocks_only_left,blocks_only_right,blocks_differing,vars_only_left,vars_only_right,"
                + "changed_vars,avoid_changes\n");
        csv.append(String.format("%s,%s,%s,%d,%d,%d,%d,%d,%d,%d,%d,%d,%d\n",
                metrics.timestamp().format(TIMESTAMP_FORMAT),
                metrics.leftLabel(),
                metrics.rightLabel(),
                metrics.functionsOnlyInLeft(),
                metrics.functionsOnlyInRight(),
                metrics.functionsWithDifferences(),
                t.blocksOnlyInLeft(),
                t.blocksOnlyInRight(),
                t.blocksWithDifferences(),
                t.varsOnlyInLeft(),
                t.varsOnlyInRight(),
                t.changedVars(),
                t.avoidChanges()));

        csv.append("\n");

        csv.append("# Per-Function Metrics\n");
        csv.append("function,blocks_only_left,blocks_only_right,blocks_differing,vars_only_left,vars_only_right,"
                + "changed_vars,avoid_changes\n");

        for (FunctionMetrics function : metrics.functions()) {
            Totals f = function.totals();
            csv.append(String.format("%s,%d,%d,%d,%d,%d,%d,%d\n",
                    csvField(function.function()),
                    f.blocksOnlyInLeft(),
                    f.blocksOnlyInRight(),
                    f.blocksWithDifferences(),
                    f.varsOnlyInLeft(),
                    f.varsOnlyInRight(),
                    f.changedVars(),
                    f.avoidChanges()));
        }

        Files.writeString(outputPath, csv.toString());
    }

    /**
     * Export metrics to JSON format.
     */
    public void exportToJson(ComparisonMetrics metrics, Path outputPath) throws IOException {
        mapper.writeValue(outputPath.toFile(), metrics);
    }

    /**
     * Function names may contain commas or quotes; quote those.
     */
    static String csvField(String value) {
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0) {
            return value;
        }
        return "\"" + value.replace("\"", "\"\"") + "\"";
    }
}
