package com.example.policy.common.exception;

/**
 * Exception thrown when the backing rule store fails an operation.
 * Never retried by this layer; it reaches the caller unchanged.
 */
public class RuleStoreException extends RuntimeException {

    private final String operation;

    public RuleStoreException(String operation, String message) {
        super(String.format("Rule store %s failed: %s", operation, message));
        this.operation = operation;
    }

    public RuleStoreException(String operation, Throwable cause) {
        super(String.format("Rule store %s failed: %s", operation, cause.getMessage()), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
