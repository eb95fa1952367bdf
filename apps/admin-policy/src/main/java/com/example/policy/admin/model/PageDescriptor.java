package com.example.policy.admin.model;

/**
 * Displayable page metadata of an admin node.
 *
 * @param label menu label
 * @param sort  sort weight, higher first; may be null
 */
public record PageDescriptor(
        String label,
        Integer sort
) {}
