package com.raditha.livediff.parser;

/**
 * A classified dump line. Every line maps to exactly one of the nested kinds.
 */
public interface DumpLine {

    DumpLine SECTION_END = new SectionEnd();
    DumpLine UNRECOGNIZED = new Unrecognized();

    /**
     * {@code final[ (annotation)]: live values at end of each block: <function>}
     *
     * @param description trimmed annotation, {@code null} when absent or empty
     * @param functionName trimmed function name, never empty
     * @param text         the full line
     */
    record SectionHeader(String description, String functionName, String text) implements DumpLine {
    }

    /**
     * {@code b<id>: <body>}
     *
     * @param blockId block id
     * @param body    trimmed text after the colon
     */
    record BlockSummary(int blockId, String body) implements DumpLine {
    }

    /**
     * A line starting with {@code Begin processing block}: the dump has moved on to another phase.
     */
    record SectionEnd() implements DumpLine {
    }

    /**
     * Anything else. Carries nothing.
     */
    record Unrecognized() implements DumpLine {
    }
}
