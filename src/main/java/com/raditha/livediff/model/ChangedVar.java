package com.raditha.livediff.model;

/**
 * A variable present in both blocks whose canonical value differs.
 */
public record ChangedVar(String var, VarValue left, VarValue right) {
}
