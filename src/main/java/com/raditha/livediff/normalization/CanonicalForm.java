package com.raditha.livediff.normalization;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Turns unordered token collections from a dump into comparable forms.
 * <p>
 * Register lists are multisets: they are sorted but duplicates survive.
 * Avoid sets are true sets: duplicates collapse before sorting.
 * Keep the two rules apart, the comparison depends on the difference.
 */
public final class CanonicalForm {

    private CanonicalForm() {
    }

    /**
     * Canonical register list: sorted, duplicates preserved.
     */
    public static List<String> registers(Collection<String> registers) {
        List<String> sorted = new ArrayList<>(registers);
        sorted.sort(null);
        return List.copyOf(sorted);
    }

    /**
     * Canonical avoid set: de-duplicated, then sorted.
     */
    public static List<String> avoidSet(Collection<String> tokens) {
        return List.copyOf(new TreeSet<>(tokens));
    }

    /**
     * Splits the inside of a register bracket. Commas and whitespace are both separators
     * and may be mixed; empty pieces are dropped, so {@code ""} yields an empty list.
     */
    public static List<String> splitRegisterList(String text) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == ',' || Character.isWhitespace(c)) {
                flush(current, tokens);
            } else {
                current.append(c);
            }
        }
        flush(current, tokens);
        return tokens;
    }

    /**
     * Splits on runs of whitespace, dropping empty pieces.
     */
    public static List<String> splitWhitespace(String text) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                flush(current, tokens);
            } else {
                current.append(c);
            }
        }
        flush(current, tokens);
        return tokens;
    }

    private static void flush(StringBuilder current, List<String> tokens) {
        if (!current.isEmpty()) {
            tokens.add(current.toString());
            current.setLength(0);
        }
    }
}
