package com.raditha.livediff.model;

import java.util.List;

/**
 * Differences beneath one function present in both dumps.
 *
 * @param name              function name
 * @param headerLabel       {@code "<left section label> - <right section label>"}
 * @param blocksOnlyInLeft  block ids only the left section has, ascending
 * @param blocksOnlyInRight block ids only the right section has, ascending
 * @param blockDiffs        differing common blocks, ascending by id
 */
public record FunctionDiff(
        String name,
        String headerLabel,
        List<Integer> blocksOnlyInLeft,
        List<Integer> blocksOnlyInRight,
        List<BlockDiff> blockDiffs) {

    public FunctionDiff {
        blocksOnlyInLeft = List.copyOf(blocksOnlyInLeft);
        blocksOnlyInRight = List.copyOf(blocksOnlyInRight);
        blockDiffs = List.copyOf(blockDiffs);
    }

    public boolean hasDifferences() {
        return !blocksOnlyInLeft.isEmpty() || !blocksOnlyInRight.isEmpty() || !blockDiffs.isEmpty();
    }
}
