package com.example.policy.common;

/**
 * Shared constants for the permission namespace.
 */
public final class PolicyConstants {

    private PolicyConstants() {}

    // Domain tag for page/action level rules
    public static final String PAGE_DOMAIN = "page";

    // Action namespace used in capability option keys
    public static final String ADMIN_ACTION_PREFIX = "admin:";
    public static final String PAGE_ACTION = ADMIN_ACTION_PREFIX + "page";
    public static final String LIST_ACTION = ADMIN_ACTION_PREFIX + "list";
    public static final String FILTER_ACTION = ADMIN_ACTION_PREFIX + "filter";
    public static final String SUBMIT_ACTION = ADMIN_ACTION_PREFIX + "submit";

    // Action namespace used by stored field-level rules
    public static final String FIELD_ACTION_PREFIX = "page:";

    // Subject prefixes
    public static final String USER_PREFIX = "u:";
    public static final String ROLE_PREFIX = "r:";

    // Grouping namespaces
    public static final String ROLE_GROUPING = "g";
    public static final String RESOURCE_GROUPING = "g2";
}
