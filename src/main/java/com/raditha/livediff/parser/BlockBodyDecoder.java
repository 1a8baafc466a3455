package com.raditha.livediff.parser;

import com.raditha.livediff.model.BlockState;
import com.raditha.livediff.model.VarValue;
import com.raditha.livediff.normalization.CanonicalForm;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes the text after {@code bN:} into variables and an avoid set.
 * <p>
 * Body shape: {@code v8(459)[R0,R1] v9(12) ... avoid=R0 R1}. The avoid clause, when present, runs
 * to the end of the line. Tokens that are not variables are dropped.
 */
public class BlockBodyDecoder {

    static final String AVOID_MARKER = "avoid=";

    /**
     * Decode a block body.
     *
     * @param body trimmed body text
     * @return the decoded variables and canonical avoid set
     */
    public DecodedBody decode(String body) {
        String remaining = body == null ? "" : body.strip();
        List<String> avoid = List.of();

        int avoidStart = findAvoidClause(remaining);
        if (avoidStart >= 0) {
            String clause = remaining.substring(avoidStart + AVOID_MARKER.length());
            avoid = CanonicalForm.avoidSet(CanonicalForm.splitWhitespace(clause));
            remaining = remaining.substring(0, avoidStart).strip();
        }

        Map<String, VarValue> vars = new LinkedHashMap<>();
        for (String token : splitTokens(remaining)) {
            decodeVar(token, vars);
        }
        return new DecodedBody(vars, avoid);
    }

    /**
     * Decode straight to a block state.
     */
    public BlockState decodeBlock(String body) {
        return decode(body).toBlockState();
    }

    /**
     * Locates {@code avoid=} starting a word and followed by at least one character; the clause
     * extends from there to the end of the body.
     *
     * @return start index of the marker, or -1
     */
    static int findAvoidClause(String body) {
        int from = 0;
        while (true) {
            int at = body.indexOf(AVOID_MARKER, from);
            if (at < 0 || at + AVOID_MARKER.length() >= body.length()) {
                return -1;
            }
            if (at == 0 || !TextCursor.isWordChar(body.charAt(at - 1))) {
                return at;
            }
            from = at + 1;
        }
    }

    /**
     * Splits on whitespace, except inside a register bracket that directly follows a
     * {@code v<id>(<weight>)} prefix, so {@code v8(4)[R1 R0]} stays one token. Any other
     * {@code [}, or one that is never closed, groups nothing.
     */
    static List<String> splitTokens(String body) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c == '[' && isVarPrefix(current)) {
                int close = body.indexOf(']', i);
                if (close >= 0) {
                    current.append(body, i, close + 1);
                    i = close + 1;
                    continue;
                }
            }
            if (Character.isWhitespace(c)) {
                if (!current.isEmpty()) {
                    tokens.add(current.toString());
                    current.setLength(0);
                }
            } else {
                current.append(c);
            }
            i++;
        }
        if (!current.isEmpty()) {
            tokens.add(current.toString());
        }
        return tokens;
    }

    private static boolean isVarPrefix(CharSequence text) {
        TextCursor cursor = new TextCursor(text.toString());
        return cursor.consume('v')
                && cursor.readDigits() != null
                && cursor.consume('(')
                && cursor.readDigits() != null
                && cursor.consume(')')
                && cursor.atEnd();
    }

    /**
     * Matches {@code v<digits>(<digits>)} with an optional trailing {@code [regs]}. A later
     * occurrence of the same id replaces the earlier one.
     */
    private static void decodeVar(String token, Map<String, VarValue> vars) {
        TextCursor cursor = new TextCursor(token);
        if (!cursor.consume('v')) {
            return;
        }
        String idDigits = cursor.readDigits();
        if (idDigits == null || !cursor.consume('(')) {
            return;
        }
        String weightDigits = cursor.readDigits();
        if (weightDigits == null || !cursor.consume(')')) {
            return;
        }
        long weight = TextCursor.parseBounded(weightDigits, Long.MAX_VALUE);
        if (weight < 0) {
            return;
        }

        List<String> registers = List.of();
        if (!cursor.atEnd()) {
            if (!cursor.consume('[')) {
                return;
            }
            String inner = cursor.readUntil(']');
            if (inner == null) {
                return;
            }
            cursor.consume(']');
            if (!cursor.atEnd()) {
                return;
            }
            registers = CanonicalForm.splitRegisterList(inner);
        }

        vars.put("v" + idDigits, new VarValue(weight, registers));
    }
}
