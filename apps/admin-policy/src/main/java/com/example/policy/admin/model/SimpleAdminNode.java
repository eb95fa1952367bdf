package com.example.policy.admin.model;

import org.springframework.lang.NonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable {@link AdminNode} assembled from configuration or test fixtures.
 * Adding a child to a group makes the group the child's owning application.
 */
public final class SimpleAdminNode implements AdminNode {

    private final String uniqueId;
    private final AdminNodeKind kind;
    private final PageDescriptor pageDescriptor;
    private final Map<String, String> actions = new LinkedHashMap<>();
    private final List<AdminNode> children = new ArrayList<>();
    private AdminNode app;

    private SimpleAdminNode(String uniqueId, AdminNodeKind kind, PageDescriptor pageDescriptor) {
        this.uniqueId = Objects.requireNonNull(uniqueId, "uniqueId");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.pageDescriptor = pageDescriptor;
        this.app = this;
    }

    /**
     * Root site: a group that owns itself and has no page of its own.
     */
    public static SimpleAdminNode site(String uniqueId) {
        return new SimpleAdminNode(uniqueId, AdminNodeKind.GROUP, null);
    }

    public static SimpleAdminNode of(String uniqueId, AdminNodeKind kind, String label, Integer sort) {
        PageDescriptor descriptor = label != null ? new PageDescriptor(label, sort) : null;
        return new SimpleAdminNode(uniqueId, kind, descriptor);
    }

    public static SimpleAdminNode group(String uniqueId, String label, Integer sort) {
        return of(uniqueId, AdminNodeKind.GROUP, label, sort);
    }

    public static SimpleAdminNode model(String uniqueId, String label, Integer sort) {
        return of(uniqueId, AdminNodeKind.MODEL, label, sort);
    }

    public static SimpleAdminNode form(String uniqueId, String label, Integer sort) {
        return of(uniqueId, AdminNodeKind.FORM, label, sort);
    }

    public static SimpleAdminNode page(String uniqueId, String label, Integer sort) {
        return of(uniqueId, AdminNodeKind.PAGE, label, sort);
    }

    public SimpleAdminNode withAction(String name, String label) {
        if (!kind.isActionContainer()) {
            throw new IllegalStateException("Admin node " + uniqueId + " of kind " + kind + " cannot register actions");
        }
        actions.put(name, label);
        return this;
    }

    public SimpleAdminNode addChild(SimpleAdminNode child) {
        if (!kind.isGroup()) {
            throw new IllegalStateException("Admin node " + uniqueId + " of kind " + kind + " cannot have children");
        }
        child.app = this;
        children.add(child);
        return this;
    }

    @Override
    @NonNull
    public String uniqueId() {
        return uniqueId;
    }

    @Override
    @NonNull
    public Optional<PageDescriptor> pageDescriptor() {
        return Optional.ofNullable(pageDescriptor);
    }

    @Override
    public boolean isActionContainer() {
        return kind.isActionContainer();
    }

    @Override
    public boolean isModelList() {
        return kind.isModelList();
    }

    @Override
    public boolean isSingleForm() {
        return kind.isSingleForm();
    }

    @Override
    @NonNull
    public Map<String, String> registeredActions() {
        return Collections.unmodifiableMap(actions);
    }

    @Override
    public boolean isGroup() {
        return kind.isGroup();
    }

    @Override
    @NonNull
    public List<AdminNode> children() {
        return Collections.unmodifiableList(children);
    }

    @Override
    @NonNull
    public AdminNode app() {
        return app;
    }

    @Override
    public String toString() {
        return "SimpleAdminNode{" +
                "uniqueId='" + uniqueId + '\'' +
                ", kind=" + kind +
                ", children=" + children.size() +
                '}';
    }
}
