package com.raditha.livediff.parser;

/**
 * State of the dump parser: either idle or inside the section of one function.
 *
 * @param currentFunction function whose blocks are being collected, {@code null} when idle
 */
public record ParserState(String currentFunction) {

    public static final ParserState IDLE = new ParserState(null);

    public static ParserState inSection(String functionName) {
        if (functionName == null) {
            throw new IllegalArgumentException("functionName cannot be null");
        }
        return new ParserState(functionName);
    }

    public boolean isIdle() {
        return currentFunction == null;
    }

    /**
     * Transition on a classified line. Headers enter a section, section-end markers return to
     * idle, everything else leaves the state alone.
     */
    public ParserState next(DumpLine line) {
        if (line instanceof DumpLine.SectionHeader header) {
            return inSection(header.functionName());
        }
        if (line instanceof DumpLine.SectionEnd) {
            return IDLE;
        }
        return this;
    }
}
