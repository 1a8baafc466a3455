package com.raditha.livediff.parser;

/**
 * Forward-only cursor over a single line. All matching in the parser goes through here,
 * so every anchoring rule is an explicit call rather than a pattern.
 */
final class TextCursor {

    private final String text;
    private int pos;

    TextCursor(String text) {
        this(text, 0);
    }

    TextCursor(String text, int pos) {
        this.text = text;
        this.pos = pos;
    }

    int position() {
        return pos;
    }

    void reset(int position) {
        this.pos = position;
    }

    boolean atEnd() {
        return pos >= text.length();
    }

    char peek() {
        return text.charAt(pos);
    }

    boolean peekIs(char c) {
        return !atEnd() && text.charAt(pos) == c;
    }

    void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    /**
     * Consumes {@code literal} if the text continues with it.
     */
    boolean consume(String literal) {
        if (text.startsWith(literal, pos)) {
            pos += literal.length();
            return true;
        }
        return false;
    }

    boolean consume(char c) {
        if (peekIs(c)) {
            pos++;
            return true;
        }
        return false;
    }

    /**
     * Reads one or more ASCII digits.
     *
     * @return the digits, or {@code null} (cursor unmoved) when none follow
     */
    String readDigits() {
        int start = pos;
        while (!atEnd() && isAsciiDigit(text.charAt(pos))) {
            pos++;
        }
        return pos == start ? null : text.substring(start, pos);
    }

    /**
     * Reads everything up to (not including) {@code terminator}.
     *
     * @return the text read, or {@code null} (cursor unmoved) when the terminator never occurs
     */
    String readUntil(char terminator) {
        int end = text.indexOf(terminator, pos);
        if (end < 0) {
            return null;
        }
        String read = text.substring(pos, end);
        pos = end;
        return read;
    }

    String rest() {
        return text.substring(pos);
    }

    static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    /**
     * Parses a digit string, rejecting values above {@code max}.
     *
     * @return the value, or -1 when it does not fit
     */
    static long parseBounded(String digits, long max) {
        long value = 0;
        for (int i = 0; i < digits.length(); i++) {
            int d = digits.charAt(i) - '0';
            if (value > (max - d) / 10) {
                return -1;
            }
            value = value * 10 + d;
        }
        return value;
    }
}
