package com.example.policy.policy.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Minimal change set turning a current rule set into a desired one.
 * {@code current - toRemove + toAdd == desired} and the two sets are disjoint.
 */
public record PolicyDiff<T>(
        Set<T> toRemove,
        Set<T> toAdd
) {
    public PolicyDiff {
        toRemove = Collections.unmodifiableSet(new LinkedHashSet<>(toRemove));
        toAdd = Collections.unmodifiableSet(new LinkedHashSet<>(toAdd));
    }

    public static <T> PolicyDiff<T> compute(Set<T> current, Set<T> desired) {
        Set<T> remove = new LinkedHashSet<>(current);
        remove.removeAll(desired);
        Set<T> add = new LinkedHashSet<>(desired);
        add.removeAll(current);
        return new PolicyDiff<>(remove, add);
    }

    public boolean isEmpty() {
        return toRemove.isEmpty() && toAdd.isEmpty();
    }

    public List<List<String>> removeRows(Function<T, List<String>> toRow) {
        return toRemove.stream().map(toRow).toList();
    }

    public List<List<String>> addRows(Function<T, List<String>> toRow) {
        return toAdd.stream().map(toRow).toList();
    }
}
