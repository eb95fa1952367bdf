package com.example.policy.admin.model;

import org.springframework.lang.NonNull;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A node of the admin hierarchy: a page, an action container or a sub-group.
 * Capabilities are exposed as predicates so callers never branch on concrete types.
 */
public interface AdminNode {

    /**
     * Stable identifier, used as the resource field of every permission for this node.
     */
    @NonNull
    String uniqueId();

    /**
     * Page metadata; empty for nodes that are not shown in the menu.
     */
    @NonNull
    Optional<PageDescriptor> pageDescriptor();

    /**
     * Whether the node registers actions that can be granted individually.
     */
    boolean isActionContainer();

    /**
     * Whether the node is a model list view (implies list and filter actions).
     */
    boolean isModelList();

    /**
     * Whether the node is a single-submit form.
     */
    boolean isSingleForm();

    /**
     * Registered actions in registration order, name to display label.
     */
    @NonNull
    Map<String, String> registeredActions();

    /**
     * Whether the node groups further admin nodes.
     */
    boolean isGroup();

    /**
     * Child nodes in declaration order; empty unless {@link #isGroup()}.
     */
    @NonNull
    List<AdminNode> children();

    /**
     * The owning application. The root of the hierarchy returns itself.
     */
    @NonNull
    AdminNode app();

    default boolean isRoot() {
        return app() == this;
    }
}
