package com.raditha.livediff.model;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Everything recovered from one dump file: function name to section.
 * Built once by the parser, never modified afterwards.
 *
 * @param label    file label used when rendering (file name stem without the conventional prefix)
 * @param sections function name to section, sorted by name
 */
public record DumpModel(String label, Map<String, Section> sections) {

    public DumpModel {
        label = label == null ? "" : label;
        sections = sections == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(sections));
    }

    public Set<String> functionNames() {
        return sections.keySet();
    }

    public Section section(String functionName) {
        return sections.get(functionName);
    }

    public int blockCount() {
        return sections.values().stream().mapToInt(s -> s.blocks().size()).sum();
    }
}
