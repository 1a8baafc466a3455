package com.raditha.livediff.report;

import com.raditha.livediff.model.BlockState;
import com.raditha.livediff.model.DumpModel;
import com.raditha.livediff.model.Section;
import com.raditha.livediff.model.VarValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes a {@link DumpModel} back out in dump syntax, with functions, blocks and variables in
 * sorted order and every register list and avoid set in canonical form. Two dumps that compare
 * equal produce identical text, which makes the output usable with ordinary line-based diff tools.
 * The output parses back to the same model.
 */
public class CanonicalDumpWriter {

    public List<String> write(DumpModel model) {
        List<String> lines = new ArrayList<>();
        for (Map.Entry<String, Section> entry : model.sections().entrySet()) {
            Section section = entry.getValue();
            lines.add(headerLine(entry.getKey(), section));
            for (Map.Entry<Integer, BlockState> block : section.blocks().entrySet()) {
                lines.add(blockLine(block.getKey(), block.getValue()));
            }
        }
        return lines;
    }

    static String headerLine(String functionName, Section section) {
        StringBuilder sb = new StringBuilder("final");
        if (section.hasDescription()) {
            sb.append(" (").append(section.description()).append(')');
        }
        return sb.append(": live values at end of each block: ").append(functionName).toString();
    }

    static String blockLine(int blockId, BlockState block) {
        StringBuilder sb = new StringBuilder();
        sb.append('b').append(blockId).append(':');
        for (Map.Entry<String, VarValue> var : block.vars().entrySet()) {
            VarValue value = var.getValue();
            sb.append(' ').append(var.getKey()).append('(').append(value.weight()).append(')');
            if (!value.registers().isEmpty()) {
                sb.append(ReportRenderer.formatList(value.registers()));
            }
        }
        if (!block.avoid().isEmpty()) {
            sb.append(" avoid=").append(String.join(" ", block.avoid()));
        }
        return sb.toString();
    }
}
