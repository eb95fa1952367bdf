package com.example.policy.field.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Three parallel columns of field rows: not configured, allowed, denied.
 * Serialized as {@code [default, allow, deny]}.
 */
public record FieldPolicyMatrix(
        List<FieldPolicyRow> defaults,
        List<FieldPolicyRow> allow,
        List<FieldPolicyRow> deny
) {
    public static final String DEFAULT_COLUMN = "default";
    public static final String ALLOW_COLUMN = "allow";
    public static final String DENY_COLUMN = "deny";

    public FieldPolicyMatrix {
        defaults = defaults == null ? List.of() : List.copyOf(defaults);
        allow = allow == null ? List.of() : List.copyOf(allow);
        deny = deny == null ? List.of() : List.copyOf(deny);
    }

    public static FieldPolicyMatrix empty() {
        return new FieldPolicyMatrix(List.of(), List.of(), List.of());
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static FieldPolicyMatrix fromColumns(@Nullable List<List<FieldPolicyRow>> columns) {
        if (columns == null || columns.isEmpty()) {
            return empty();
        }
        if (columns.size() != 3) {
            throw new IllegalArgumentException("Field policy matrix needs 3 columns, got " + columns.size());
        }
        return new FieldPolicyMatrix(columns.get(0), columns.get(1), columns.get(2));
    }

    @JsonValue
    public List<List<FieldPolicyRow>> columns() {
        return List.of(defaults, allow, deny);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return defaults.isEmpty() && allow.isEmpty() && deny.isEmpty();
    }
}
