package com.raditha.livediff.model;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * One function's part of a dump.
 *
 * @param description the parenthesized header annotation, or {@code null} when the header had none
 * @param headerText  the header line that opened the section first
 * @param blocks      block id to block state, sorted by id
 */
public record Section(String description, String headerText, Map<Integer, BlockState> blocks) {

    public Section {
        if (headerText == null) {
            throw new IllegalArgumentException("headerText cannot be null");
        }
        blocks = blocks == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(blocks));
    }

    public boolean hasDescription() {
        return description != null && !description.isBlank();
    }
}
