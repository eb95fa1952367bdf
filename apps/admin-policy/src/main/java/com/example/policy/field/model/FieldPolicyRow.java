package com.example.policy.field.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One row of a field policy matrix column.
 *
 * @param label   field display label
 * @param rol     encoded field permission key {@code adminId#page:action#field}
 * @param col     column the row belongs to ({@code default}, {@code allow} or {@code deny})
 * @param checked whether the row is selected in this column
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FieldPolicyRow(
        String label,
        String rol,
        String col,
        boolean checked
) {
    public static FieldPolicyRow of(String label, String rol) {
        return new FieldPolicyRow(label, rol, null, false);
    }

    public FieldPolicyRow in(String column, boolean isChecked) {
        return new FieldPolicyRow(label, rol, column, isChecked);
    }
}
