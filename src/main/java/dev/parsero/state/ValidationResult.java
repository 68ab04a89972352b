package dev.parsero.state;

import java.util.List;
import java.util.Map;

/**
 * Result of checking a raw value against a schema.
 */
public sealed interface ValidationResult {

    /** The value matched; {@code value} holds only the declared fields. */
    record Valid(Map<String, Object> value) implements ValidationResult {}

    record Invalid(List<ValidationIssue> issues) implements ValidationResult {

        public Invalid {
            issues = List.copyOf(issues);
        }
    }

    default boolean isValid() {
        return this instanceof Valid;
    }
}
