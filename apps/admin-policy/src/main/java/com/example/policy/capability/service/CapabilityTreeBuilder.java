package com.example.policy.capability.service;

import com.example.policy.admin.model.AdminNode;
import com.example.policy.admin.model.PageDescriptor;
import com.example.policy.capability.model.CapabilityOption;
import com.example.policy.common.PolicyConstants;
import com.example.policy.permission.model.PermissionKey;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Walks an admin group depth-first and produces the page/action permission options for the UI.
 * Siblings are ordered by sort weight, highest first; equal weights keep declaration order.
 */
@Component
public class CapabilityTreeBuilder {

    static final String LIST_LABEL = "View list";
    static final String FILTER_LABEL = "Filter list";
    static final String SUBMIT_LABEL = "Submit";

    private static final Comparator<CapabilityOption> BY_SORT_DESC =
            Comparator.comparingInt((CapabilityOption option) -> option.sort() == null ? 0 : option.sort())
                    .reversed();

    /**
     * Build the option tree for the children of the given group.
     */
    @NonNull
    public List<CapabilityOption> build(@NonNull AdminNode group) {
        List<CapabilityOption> options = new ArrayList<>();
        for (AdminNode node : group.children()) {
            Optional<PageDescriptor> page = node.pageDescriptor();
            if (page.isEmpty()) {
                continue;
            }
            List<CapabilityOption> children = null;
            if (node.isActionContainer()) {
                children = actionOptions(node);
            } else if (node.isGroup()) {
                children = build(node);
            }
            options.add(new CapabilityOption(
                    page.get().label(),
                    pageKey(node.uniqueId(), PolicyConstants.PAGE_ACTION),
                    page.get().sort(),
                    children));
        }
        options.sort(BY_SORT_DESC);
        return List.copyOf(options);
    }

    private List<CapabilityOption> actionOptions(AdminNode node) {
        String id = node.uniqueId();
        Map<String, String> actions = node.registeredActions();
        List<CapabilityOption> children = new ArrayList<>();
        if (node.isModelList()) {
            children.add(CapabilityOption.leaf(LIST_LABEL, pageKey(id, PolicyConstants.LIST_ACTION)));
            children.add(CapabilityOption.leaf(FILTER_LABEL, pageKey(id, PolicyConstants.FILTER_ACTION)));
        } else if (node.isSingleForm() && !actions.containsKey("submit")) {
            children.add(CapabilityOption.leaf(SUBMIT_LABEL, pageKey(id, PolicyConstants.SUBMIT_ACTION)));
        }
        actions.forEach((name, label) -> children.add(
                CapabilityOption.leaf(label, pageKey(id, PolicyConstants.ADMIN_ACTION_PREFIX + name))));
        return children;
    }

    private static String pageKey(String uniqueId, String action) {
        return PermissionKey.page(uniqueId, action).encode();
    }
}
