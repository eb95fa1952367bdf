package com.example.policy.admin.model;

/**
 * Kinds of admin nodes and the capabilities each one carries.
 */
public enum AdminNodeKind {
    /** Plain page without actions. */
    PAGE(false, false, false, false),
    /** Page with registered actions only. */
    ACTION(true, false, false, false),
    /** Model list page with list/filter views. */
    MODEL(true, true, false, false),
    /** Single-submit form page. */
    FORM(true, false, true, false),
    /** Nested group of admin nodes. */
    GROUP(false, false, false, true);

    private final boolean actionContainer;
    private final boolean modelList;
    private final boolean singleForm;
    private final boolean group;

    AdminNodeKind(boolean actionContainer, boolean modelList, boolean singleForm, boolean group) {
        this.actionContainer = actionContainer;
        this.modelList = modelList;
        this.singleForm = singleForm;
        this.group = group;
    }

    public boolean isActionContainer() {
        return actionContainer;
    }

    public boolean isModelList() {
        return modelList;
    }

    public boolean isSingleForm() {
        return singleForm;
    }

    public boolean isGroup() {
        return group;
    }
}
