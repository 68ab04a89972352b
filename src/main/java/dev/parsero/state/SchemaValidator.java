package dev.parsero.state;

/**
 * Checks a raw value against the shape agreed for one state section.
 * Implementations report failures through the result and never throw.
 */
@FunctionalInterface
public interface SchemaValidator {

    ValidationResult validate(Object raw);
}
