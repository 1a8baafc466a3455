package com.raditha.livediff.model;

import java.util.List;

/**
 * Both sides of an avoid set that differs between the dumps.
 */
public record AvoidChange(List<String> left, List<String> right) {

    public AvoidChange {
        left = List.copyOf(left);
        right = List.copyOf(right);
    }
}
