package com.example.policy.policy.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Effect column of a stored rule.
 */
public enum PolicyEffect {
    ALLOW("allow"),
    DENY("deny");

    private final String value;

    PolicyEffect(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Anything other than {@code allow} is treated as deny, matching the store's effect expression.
     */
    public static PolicyEffect fromValue(String value) {
        return ALLOW.value.equals(value) ? ALLOW : DENY;
    }
}
