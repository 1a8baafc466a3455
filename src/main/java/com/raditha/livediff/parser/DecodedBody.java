package com.raditha.livediff.parser;

import com.raditha.livediff.model.BlockState;
import com.raditha.livediff.model.VarValue;

import java.util.List;
import java.util.Map;

/**
 * Output of {@link BlockBodyDecoder}: variables in the order they were seen, and the canonical
 * avoid set.
 */
public record DecodedBody(Map<String, VarValue> vars, List<String> avoid) {

    public BlockState toBlockState() {
        return new BlockState(vars, avoid);
    }
}
