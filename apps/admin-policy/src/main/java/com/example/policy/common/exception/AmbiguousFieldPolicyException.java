package com.example.policy.common.exception;

import java.util.Set;

/**
 * Thrown when a field policy matrix checks the same row in both the allow and the deny column.
 */
public class AmbiguousFieldPolicyException extends IllegalArgumentException {

    private final String subject;
    private final Set<String> conflictingRows;

    public AmbiguousFieldPolicyException(String subject, Set<String> conflictingRows) {
        super(String.format("Rows checked as both allow and deny for subject %s: %s", subject, conflictingRows));
        this.subject = subject;
        this.conflictingRows = Set.copyOf(conflictingRows);
    }

    public String getSubject() {
        return subject;
    }

    public Set<String> getConflictingRows() {
        return conflictingRows;
    }
}
