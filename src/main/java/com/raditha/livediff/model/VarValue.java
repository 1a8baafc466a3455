package com.raditha.livediff.model;

import com.raditha.livediff.normalization.CanonicalForm;

import java.util.List;

/**
 * The value recorded for one live variable at a block exit.
 *
 * @param weight    the parenthesized number after the variable id
 * @param registers canonical register list (sorted, duplicates kept); empty when the
 *                  dump carried no bracket
 */
public record VarValue(long weight, List<String> registers) {

    public VarValue {
        if (registers == null) {
            registers = List.of();
        }
        registers = CanonicalForm.registers(registers);
    }

    /**
     * Renders as {@code (4,[R0,R1])}.
     */
    @Override
    public String toString() {
        return "(" + weight + ",[" + String.join(",", registers) + "])";
    }
}
