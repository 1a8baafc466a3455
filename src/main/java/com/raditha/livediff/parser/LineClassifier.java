package com.raditha.livediff.parser;

/**
 * Classifies single dump lines. Never throws on content: anything that does not fully match a
 * known shape is {@link DumpLine#UNRECOGNIZED}.
 */
public class LineClassifier {

    static final String HEADER_KEYWORD = "final";
    static final String HEADER_PHRASE = "live values at end of each block:";
    static final String SECTION_END_PREFIX = "Begin processing block";

    /**
     * Classify one line (line terminator already removed).
     */
    public DumpLine classify(String line) {
        if (line == null) {
            return DumpLine.UNRECOGNIZED;
        }

        DumpLine header = matchHeader(line);
        if (header != null) {
            return header;
        }

        if (line.startsWith(SECTION_END_PREFIX)) {
            return DumpLine.SECTION_END;
        }

        DumpLine block = matchBlock(line);
        if (block != null) {
            return block;
        }
        return DumpLine.UNRECOGNIZED;
    }

    private DumpLine.SectionHeader matchHeader(String line) {
        TextCursor cursor = new TextCursor(line);
        cursor.skipWhitespace();
        if (!cursor.consume(HEADER_KEYWORD)) {
            return null;
        }

        String description = null;
        int afterKeyword = cursor.position();
        cursor.skipWhitespace();
        if (cursor.consume('(')) {
            String inner = cursor.readUntil(')');
            if (inner == null) {
                return null;
            }
            cursor.consume(')');
            description = inner.strip();
            if (description.isEmpty()) {
                description = null;
            }
        } else {
            // without an annotation the colon must follow the keyword directly
            cursor.reset(afterKeyword);
        }

        if (!cursor.consume(':')) {
            return null;
        }
        cursor.skipWhitespace();
        if (!cursor.consume(HEADER_PHRASE)) {
            return null;
        }

        String functionName = cursor.rest().strip();
        if (functionName.isEmpty()) {
            return null;
        }
        return new DumpLine.SectionHeader(description, functionName, line);
    }

    private DumpLine.BlockSummary matchBlock(String line) {
        TextCursor cursor = new TextCursor(line);
        cursor.skipWhitespace();
        if (!cursor.consume('b')) {
            return null;
        }
        String digits = cursor.readDigits();
        if (digits == null || !cursor.consume(':')) {
            return null;
        }
        long blockId = TextCursor.parseBounded(digits, Integer.MAX_VALUE);
        if (blockId < 0) {
            return null;
        }
        return new DumpLine.BlockSummary((int) blockId, cursor.rest().strip());
    }
}
