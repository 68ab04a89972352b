package dev.parsero.error;

import dev.parsero.state.ValidationIssue;

import java.util.List;

/**
 * Raised when the run input or the final output does not match its schema.
 */
public class StateValidationException extends ParseroException {

    private final List<ValidationIssue> issues;

    public StateValidationException(String message, List<ValidationIssue> issues) {
        super(issues.isEmpty() ? message : message + " " + issues);
        this.issues = List.copyOf(issues);
    }

    /** Field-path/message pairs reported by the validator; may be empty. */
    public List<ValidationIssue> issues() {
        return issues;
    }
}
