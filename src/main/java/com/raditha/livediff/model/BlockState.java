package com.raditha.livediff.model;

import com.raditha.livediff.normalization.CanonicalForm;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Live values at the exit of one basic block.
 *
 * @param vars  variable id to value, sorted by id
 * @param avoid canonical avoid set (sorted, unique)
 */
public record BlockState(Map<String, VarValue> vars, List<String> avoid) {

    public BlockState {
        vars = vars == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(vars));
        avoid = avoid == null ? List.of() : CanonicalForm.avoidSet(avoid);
    }

    public static BlockState empty() {
        return new BlockState(Map.of(), List.of());
    }
}
