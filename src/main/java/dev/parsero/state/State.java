package dev.parsero.state;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Current input and output of an agent, owned by one run at a time.
 * <p>
 * Every declared field starts out {@code null}. Setters replace a whole section
 * without checking it; shape checks go through {@link #validateInput(Object)} and
 * {@link #validateOutput(Object)}, which report rather than throw. Not thread-safe.
 */
public final class State {

    private final StateSchema inputSchema;
    private final StateSchema outputSchema;
    private final SchemaValidator inputValidator;
    private final SchemaValidator outputValidator;
    private StateValues values;

    public State(StateSchema inputSchema, StateSchema outputSchema) {
        this(inputSchema, outputSchema, inputSchema, outputSchema);
    }

    /**
     * @param inputValidator  validator used instead of the input schema's own checks
     * @param outputValidator validator used instead of the output schema's own checks
     */
    public State(StateSchema inputSchema, StateSchema outputSchema,
                 SchemaValidator inputValidator, SchemaValidator outputValidator) {
        this.inputSchema = inputSchema;
        this.outputSchema = outputSchema;
        this.inputValidator = inputValidator;
        this.outputValidator = outputValidator;
        this.values = initialValues();
    }

    public StateValues values() {
        return values;
    }

    public void setInput(Map<String, ?> input) {
        values = new StateValues(new LinkedHashMap<>(input), values.output());
    }

    public void setOutput(Map<String, ?> output) {
        values = new StateValues(values.input(), new LinkedHashMap<>(output));
    }

    public ValidationResult validateInput(Object raw) {
        return inputValidator.validate(raw);
    }

    public ValidationResult validateOutput(Object raw) {
        return outputValidator.validate(raw);
    }

    /** Back to every declared field set to null. */
    public void reset() {
        values = initialValues();
    }

    /** Values with every declared field of both sections set to null. */
    public StateValues initialValues() {
        return new StateValues(nulls(inputSchema.fieldNames()), nulls(outputSchema.fieldNames()));
    }

    public StateSchema inputSchema() {
        return inputSchema;
    }

    public StateSchema outputSchema() {
        return outputSchema;
    }

    private static Map<String, Object> nulls(List<String> names) {
        var map = new LinkedHashMap<String, Object>();
        names.forEach(name -> map.put(name, null));
        return map;
    }
}
