package com.raditha.livediff.model;

import java.util.List;
import java.util.Optional;

/**
 * Differences found in one block that exists on both sides.
 *
 * @param blockId           the block id
 * @param varsOnlyInLeft    variable ids only the left block has, sorted
 * @param varsOnlyInRight   variable ids only the right block has, sorted
 * @param changedVars       changed variables, sorted by id and truncated to the per-block cap
 * @param elidedChangedVars how many changed variables were cut off by the cap
 * @param avoidChange       both avoid sets when they differ
 */
public record BlockDiff(
        int blockId,
        List<String> varsOnlyInLeft,
        List<String> varsOnlyInRight,
        List<ChangedVar> changedVars,
        int elidedChangedVars,
        Optional<AvoidChange> avoidChange) {

    public BlockDiff {
        varsOnlyInLeft = List.copyOf(varsOnlyInLeft);
        varsOnlyInRight = List.copyOf(varsOnlyInRight);
        changedVars = List.copyOf(changedVars);
        if (elidedChangedVars < 0) {
            throw new IllegalArgumentException("elidedChangedVars must be >= 0");
        }
        avoidChange = avoidChange == null ? Optional.empty() : avoidChange;
    }

    /**
     * Number of changed variables, including the elided ones.
     */
    public int totalChangedVars() {
        return changedVars.size() + elidedChangedVars;
    }

    public boolean hasDifferences() {
        return !varsOnlyInLeft.isEmpty()
                || !varsOnlyInRight.isEmpty()
                || totalChangedVars() > 0
                || avoidChange.isPresent();
    }
}
