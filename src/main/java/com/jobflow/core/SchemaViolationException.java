package com.jobflow.core;

import java.util.List;

/**
 * Thrown by a {@link JobSchema} when a payload does not match it.
 */
public class SchemaViolationException extends RuntimeException {

    private final List<String> violations;

    public SchemaViolationException(List<String> violations) {
        super(String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public SchemaViolationException(String violation, Throwable cause) {
        super(violation, cause);
        this.violations = List.of(violation);
    }

    /**
     * One entry per violated constraint, in the form {@code path: message}.
     */
    public List<String> getViolations() {
        return violations;
    }
}
