package com.example.policy.policy.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A stored permission rule: subject, one to three domain fields and an effect.
 *
 * @param subject subject the rule applies to ({@code u:} or {@code r:} prefixed)
 * @param fields  domain fields v1..vn
 * @param effect  allow or deny
 */
public record PolicyRule(
        String subject,
        List<String> fields,
        PolicyEffect effect
) {
    public PolicyRule {
        if (fields == null || fields.isEmpty() || fields.size() > 3) {
            throw new IllegalArgumentException("A policy rule needs 1 to 3 fields, got " + fields);
        }
        fields = List.copyOf(fields);
    }

    public static PolicyRule allow(String subject, List<String> fields) {
        return new PolicyRule(subject, fields, PolicyEffect.ALLOW);
    }

    public static PolicyRule deny(String subject, List<String> fields) {
        return new PolicyRule(subject, fields, PolicyEffect.DENY);
    }

    /**
     * Parse a store row {@code [subject, v1.., eft]}.
     */
    public static PolicyRule fromRow(List<String> row) {
        if (row == null || row.size() < 3) {
            throw new IllegalArgumentException("Policy row too short: " + row);
        }
        return new PolicyRule(
                row.get(0),
                row.subList(1, row.size() - 1),
                PolicyEffect.fromValue(row.get(row.size() - 1)));
    }

    /**
     * Store row {@code [subject, v1.., eft]}.
     */
    public List<String> toRow() {
        List<String> row = new ArrayList<>(fields.size() + 2);
        row.add(subject);
        row.addAll(fields);
        row.add(effect.getValue());
        return row;
    }

    /**
     * Last domain field: {@code page} for page rules, the field name for field rules.
     */
    public String domain() {
        return fields.get(fields.size() - 1);
    }
}
