package com.raditha.livediff.model;

import java.util.List;

/**
 * Result of comparing two dumps. Functions whose blocks are equivalent end to end do not
 * appear in {@code functionDiffs}.
 *
 * @param leftLabel            file label of the left dump
 * @param rightLabel           file label of the right dump
 * @param functionsOnlyInLeft  sorted
 * @param functionsOnlyInRight sorted
 * @param functionDiffs        sorted by function name
 */
public record ComparisonReport(
        String leftLabel,
        String rightLabel,
        List<String> functionsOnlyInLeft,
        List<String> functionsOnlyInRight,
        List<FunctionDiff> functionDiffs) {

    public static final int NO_DIFFERENCES = 0;
    public static final int DIFFERENCES_FOUND = 1;

    public ComparisonReport {
        functionsOnlyInLeft = List.copyOf(functionsOnlyInLeft);
        functionsOnlyInRight = List.copyOf(functionsOnlyInRight);
        functionDiffs = List.copyOf(functionDiffs);
    }

    public boolean hasDifferences() {
        return !functionsOnlyInLeft.isEmpty() || !functionsOnlyInRight.isEmpty() || !functionDiffs.isEmpty();
    }

    /**
     * Process exit status for this report: 0 when nothing differs, 1 otherwise.
     */
    public int exitStatus() {
        return hasDifferences() ? DIFFERENCES_FOUND : NO_DIFFERENCES;
    }
}
