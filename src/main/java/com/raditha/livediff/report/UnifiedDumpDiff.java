package com.raditha.livediff.report;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import com.raditha.livediff.model.DumpModel;

import java.util.List;

/**
 * Unified diff of the canonical text of two dumps.
 * Uses java-diff-utils library.
 */
public class UnifiedDumpDiff {

    public static final int DEFAULT_CONTEXT_LINES = 3;

    private final CanonicalDumpWriter writer;

    public UnifiedDumpDiff() {
        this(new CanonicalDumpWriter());
    }

    public UnifiedDumpDiff(CanonicalDumpWriter writer) {
        this.writer = writer;
    }

    /**
     * Generate a unified diff between the canonical forms of two dumps.
     *
     * @param left         left dump
     * @param right        right dump
     * @param contextLines unchanged lines shown around each change
     * @return diff lines; empty when the canonical forms are identical
     */
    public List<String> diff(DumpModel left, DumpModel right, int contextLines) {
        if (contextLines < 0) {
            throw new IllegalArgumentException("contextLines must be >= 0, got: " + contextLines);
        }
        List<String> original = writer.write(left);
        List<String> revised = writer.write(right);

        Patch<String> patch = DiffUtils.diff(original, revised);
        if (patch.getDeltas().isEmpty()) {
            return List.of();
        }

        return UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + left.label(),
                "b/" + right.label(),
                original,
                patch,
                contextLines);
    }
}
