package com.example.policy.common.exception;

/**
 * Thrown when an encoded permission key does not decode to the expected number of fields.
 * This is a caller contract violation and is never recovered from locally.
 */
public class MalformedPermissionKeyException extends IllegalArgumentException {

    private final String permission;
    private final int actualArity;

    public MalformedPermissionKeyException(String permission, int actualArity, String expected) {
        super(String.format("Permission key '%s' has %d fields, expected %s", permission, actualArity, expected));
        this.permission = permission;
        this.actualArity = actualArity;
    }

    public MalformedPermissionKeyException(String permission, String message) {
        super(message);
        this.permission = permission;
        this.actualArity = -1;
    }

    public String getPermission() {
        return permission;
    }

    public int getActualArity() {
        return actualArity;
    }
}
