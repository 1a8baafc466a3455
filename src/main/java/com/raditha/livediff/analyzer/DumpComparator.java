package com.raditha.livediff.analyzer;

import com.raditha.livediff.config.DiffConfig;
import com.raditha.livediff.model.AvoidChange;
import com.raditha.livediff.model.BlockDiff;
import com.raditha.livediff.model.BlockState;
import com.raditha.livediff.model.ChangedVar;
import com.raditha.livediff.model.ComparisonReport;
import com.raditha.livediff.model.DumpModel;
import com.raditha.livediff.model.FunctionDiff;
import com.raditha.livediff.model.Section;
import com.raditha.livediff.model.VarValue;
import com.raditha.livediff.report.FileLabels;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Compares two parsed dumps level by level: functions, then blocks, then variables.
 * <p>
 * At each level the keys only one side has are reported and the common keys are compared one
 * level down. A function only shows up in {@link ComparisonReport#functionDiffs()} when something
 * beneath it differs. All key lists come out in ascending order.
 */
public class DumpComparator {

    private final int maxChangedVarsPerBlock;

    public DumpComparator() {
        this(DiffConfig.DEFAULT_MAX_CHANGED_VARS_PER_BLOCK);
    }

    /**
     * @param maxChangedVarsPerBlock changed variables kept per block; the rest are only counted
     */
    public DumpComparator(int maxChangedVarsPerBlock) {
        if (maxChangedVarsPerBlock < 0) {
            throw new IllegalArgumentException("maxChangedVarsPerBlock must be >= 0, got: " + maxChangedVarsPerBlock);
        }
        this.maxChangedVarsPerBlock = maxChangedVarsPerBlock;
    }

    public int maxChangedVarsPerBlock() {
        return maxChangedVarsPerBlock;
    }

    /**
     * Compare {@code left} against {@code right}.
     */
    public ComparisonReport compare(DumpModel left, DumpModel right) {
        KeySplit<String> functions = KeySplit.of(left.functionNames(), right.functionNames());

        List<FunctionDiff> functionDiffs = new ArrayList<>();
        for (String name : functions.common()) {
            FunctionDiff diff = compareFunction(name, left.section(name), left.label(),
                    right.section(name), right.label());
            if (diff.hasDifferences()) {
                functionDiffs.add(diff);
            }
        }

        return new ComparisonReport(
                left.label(),
                right.label(),
                functions.onlyLeft(),
                functions.onlyRight(),
                functionDiffs);
    }

    FunctionDiff compareFunction(String name, Section left, String leftLabel, Section right, String rightLabel) {
        Map<Integer, BlockState> leftBlocks = left.blocks();
        Map<Integer, BlockState> rightBlocks = right.blocks();
        KeySplit<Integer> blocks = KeySplit.of(leftBlocks.keySet(), rightBlocks.keySet());

        List<BlockDiff> blockDiffs = new ArrayList<>();
        for (Integer blockId : blocks.common()) {
            BlockDiff diff = compareBlock(blockId, leftBlocks.get(blockId), rightBlocks.get(blockId));
            if (diff.hasDifferences()) {
                blockDiffs.add(diff);
            }
        }

        String headerLabel = FileLabels.comparisonHeader(left.description(), leftLabel,
                right.description(), rightLabel);
        return new FunctionDiff(name, headerLabel, blocks.onlyLeft(), blocks.onlyRight(), blockDiffs);
    }

    BlockDiff compareBlock(int blockId, BlockState left, BlockState right) {
        KeySplit<String> vars = KeySplit.of(left.vars().keySet(), right.vars().keySet());

        List<ChangedVar> changed = new ArrayList<>();
        int elided = 0;
        for (String var : vars.common()) {
            VarValue leftValue = left.vars().get(var);
            VarValue rightValue = right.vars().get(var);
            if (leftValue.equals(rightValue)) {
                continue;
            }
            if (changed.size() < maxChangedVarsPerBlock) {
                changed.add(new ChangedVar(var, leftValue, rightValue));
            } else {
                elided++;
            }
        }

        Optional<AvoidChange> avoidChange = left.avoid().equals(right.avoid())
                ? Optional.empty()
                : Optional.of(new AvoidChange(left.avoid(), right.avoid()));

        return new BlockDiff(blockId, vars.onlyLeft(), vars.onlyRight(), changed, elided, avoidChange);
    }

    /**
     * Symmetric difference of two key sets, each part sorted by natural order.
     */
    record KeySplit<K extends Comparable<K>>(List<K> onlyLeft, List<K> onlyRight, List<K> common) {

        static <K extends Comparable<K>> KeySplit<K> of(Set<K> left, Set<K> right) {
            List<K> onlyLeft = new ArrayList<>();
            List<K> onlyRight = new ArrayList<>();
            List<K> common = new ArrayList<>();
            for (K key : new TreeSet<>(left)) {
                if (right.contains(key)) {
                    common.add(key);
                } else {
                    onlyLeft.add(key);
                }
            }
            for (K key : new TreeSet<>(right)) {
                if (!left.contains(key)) {
                    onlyRight.add(key);
                }
            }
            return new KeySplit<>(onlyLeft, onlyRight, common);
        }
    }
}
