package com.example.policy.field.util;

import com.example.policy.common.PolicyConstants;
import org.springframework.lang.NonNull;

/**
 * Translation from the page action namespace ({@code admin:list}) to the namespace stored
 * on field rules ({@code page:list}). Older field rules were written under the page
 * namespace; once they are migrated this class and its call sites can go.
 */
public final class FieldActionNamespace {

    private FieldActionNamespace() {}

    @NonNull
    public static String toStoredAction(@NonNull String action) {
        if (action.startsWith(PolicyConstants.ADMIN_ACTION_PREFIX)) {
            return PolicyConstants.FIELD_ACTION_PREFIX + action.substring(PolicyConstants.ADMIN_ACTION_PREFIX.length());
        }
        return action;
    }
}
