package com.raditha.livediff.report;

import com.raditha.livediff.model.AvoidChange;
import com.raditha.livediff.model.BlockDiff;
import com.raditha.livediff.model.ChangedVar;
import com.raditha.livediff.model.ComparisonReport;
import com.raditha.livediff.model.FunctionDiff;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a {@link ComparisonReport} as plain text. Output depends only on the report, so two
 * runs over the same inputs print identical text.
 */
public class ReportRenderer {

    public static final String NO_DIFFERENCES = "No differences found.";

    private final int maxOnlyVarsShown;

    /**
     * @param maxOnlyVarsShown variables listed on a "vars only in" line before eliding the rest
     */
    public ReportRenderer(int maxOnlyVarsShown) {
        if (maxOnlyVarsShown < 0) {
            throw new IllegalArgumentException("maxOnlyVarsShown must be >= 0, got: " + maxOnlyVarsShown);
        }
        this.maxOnlyVarsShown = maxOnlyVarsShown;
    }

    /**
     * Render the report as lines (without terminators).
     */
    public List<String> render(ComparisonReport report) {
        List<String> lines = new ArrayList<>();
        String left = report.leftLabel();
        String right = report.rightLabel();

        renderOnlyFunctions(lines, left, report.functionsOnlyInLeft());
        renderOnlyFunctions(lines, right, report.functionsOnlyInRight());

        for (FunctionDiff function : report.functionDiffs()) {
            lines.add(String.format("=== %s (%s) ===", function.name(), function.headerLabel()));
            if (!function.blocksOnlyInLeft().isEmpty()) {
                lines.add("  blocks only in " + left + ": " + formatBlockIds(function.blocksOnlyInLeft()));
            }
            if (!function.blocksOnlyInRight().isEmpty()) {
                lines.add("  blocks only in " + right + ": " + formatBlockIds(function.blocksOnlyInRight()));
            }
            for (BlockDiff block : function.blockDiffs()) {
                renderBlock(lines, block, left, right);
            }
            lines.add("");
        }

        if (!report.hasDifferences()) {
            lines.add(NO_DIFFERENCES);
        }
        return lines;
    }

    /**
     * Print the rendered report, one line at a time.
     *
     * @return the report's exit status
     */
    public int print(ComparisonReport report, PrintStream out) {
        for (String line : render(report)) {
            out.println(line);
        }
        return report.exitStatus();
    }

    private static void renderOnlyFunctions(List<String> lines, String label, List<String> names) {
        if (names.isEmpty()) {
            return;
        }
        lines.add("Sections only in " + label + ":");
        for (String name : names) {
            lines.add("  - " + name);
        }
        lines.add("");
    }

    private void renderBlock(List<String> lines, BlockDiff block, String left, String right) {
        lines.add("");
        lines.add("  == b" + block.blockId() + " ==");

        if (!block.varsOnlyInLeft().isEmpty()) {
            lines.add("    vars only in " + left + ": " + formatCapped(block.varsOnlyInLeft()));
        }
        if (!block.varsOnlyInRight().isEmpty()) {
            lines.add("    vars only in " + right + ": " + formatCapped(block.varsOnlyInRight()));
        }

        for (ChangedVar changed : block.changedVars()) {
            lines.add(String.format("    %s: %s=%s %s=%s",
                    changed.var(), left, changed.left(), right, changed.right()));
        }
        if (block.elidedChangedVars() > 0) {
            lines.add("    ... " + block.elidedChangedVars() + " more changed vars");
        }

        if (block.avoidChange().isPresent()) {
            AvoidChange avoid = block.avoidChange().get();
            lines.add(String.format("    avoid: %s=%s %s=%s",
                    left, formatList(avoid.left()), right, formatList(avoid.right())));
        }
    }

    private String formatCapped(List<String> vars) {
        if (vars.size() <= maxOnlyVarsShown) {
            return String.join(", ", vars);
        }
        return String.join(", ", vars.subList(0, maxOnlyVarsShown))
                + " ... " + (vars.size() - maxOnlyVarsShown) + " more";
    }

    private static String formatBlockIds(List<Integer> ids) {
        return ids.stream().map(id -> "b" + id).collect(Collectors.joining(", "));
    }

    static String formatList(List<String> tokens) {
        return "[" + String.join(",", tokens) + "]";
    }
}
