package com.example.policy.field.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Evaluated effect of each field row for a subject. Serialized as {@code [allow, deny]}.
 */
public record FieldEffectMatrix(
        List<FieldPolicyRow> allow,
        List<FieldPolicyRow> deny
) {
    public FieldEffectMatrix {
        allow = List.copyOf(allow);
        deny = List.copyOf(deny);
    }

    @JsonValue
    public List<List<FieldPolicyRow>> columns() {
        return List.of(allow, deny);
    }
}
