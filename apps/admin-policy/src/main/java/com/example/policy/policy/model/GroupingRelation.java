package com.example.policy.policy.model;

import java.util.List;

/**
 * Edge of a grouping namespace: subject to role in {@code g}, parent resource to child resource in {@code g2}.
 */
public record GroupingRelation(
        String parent,
        String child
) {
    public static GroupingRelation fromRow(List<String> row) {
        if (row == null || row.size() < 2) {
            throw new IllegalArgumentException("Grouping row too short: " + row);
        }
        return new GroupingRelation(row.get(0), row.get(1));
    }

    public List<String> toRow() {
        return List.of(parent, child);
    }
}
