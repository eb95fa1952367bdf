package com.example.policy.capability.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * One page or action node of the permission option tree rendered by the admin UI.
 *
 * @param label    display label
 * @param value    encoded permission key
 * @param sort     sort weight of the page, null for actions
 * @param children child options in display order, null for leaves
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CapabilityOption(
        String label,
        String value,
        Integer sort,
        List<CapabilityOption> children
) {
    public CapabilityOption {
        children = children == null || children.isEmpty() ? null : List.copyOf(children);
    }

    public static CapabilityOption leaf(String label, String value) {
        return new CapabilityOption(label, value, null, null);
    }

    @JsonIgnore
    public boolean hasChildren() {
        return children != null;
    }

    public CapabilityOption withChildren(List<CapabilityOption> newChildren) {
        return new CapabilityOption(label, value, sort, newChildren);
    }
}
