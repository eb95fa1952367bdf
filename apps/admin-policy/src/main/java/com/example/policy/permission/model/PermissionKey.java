package com.example.policy.permission.model;

import com.example.policy.common.PolicyConstants;
import com.example.policy.permission.codec.PermissionCodec;

import java.util.List;

/**
 * Structured form of a page or field permission: resource, action and domain.
 *
 * @param resource admin node unique id
 * @param action   action identifier, e.g. {@code admin:list}
 * @param domain   {@code page} for page/action rules, a field name for field rules
 */
public record PermissionKey(
        String resource,
        String action,
        String domain
) {
    public static PermissionKey page(String resource, String action) {
        return new PermissionKey(resource, action, PolicyConstants.PAGE_DOMAIN);
    }

    /**
     * Decode a three-field key.
     *
     * @throws com.example.policy.common.exception.MalformedPermissionKeyException if the arity is not 3
     */
    public static PermissionKey parse(String permission) {
        List<String> fields = PermissionCodec.decode(permission, 3);
        return new PermissionKey(fields.get(0), fields.get(1), fields.get(2));
    }

    public String encode() {
        return PermissionCodec.encode(resource, action, domain);
    }

    public List<String> fields() {
        return List.of(resource, action, domain);
    }
}
