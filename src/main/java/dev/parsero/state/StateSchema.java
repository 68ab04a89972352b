package dev.parsero.state;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered field declarations for one state section, and the built-in validator for them.
 * Keys not declared here are dropped from the validated value.
 */
public final class StateSchema implements SchemaValidator {

    private final List<FieldSpec> fields;

    public StateSchema(List<FieldSpec> fields) {
        var seen = new LinkedHashMap<String, FieldSpec>();
        for (FieldSpec field : fields) {
            if (seen.put(field.name(), field) != null) {
                throw new IllegalArgumentException("Duplicate field in schema: " + field.name());
            }
        }
        this.fields = List.copyOf(fields);
    }

    public static StateSchema of(FieldSpec... fields) {
        return new StateSchema(Arrays.asList(fields));
    }

    public List<FieldSpec> fields() {
        return fields;
    }

    public List<String> fieldNames() {
        return fields.stream().map(FieldSpec::name).toList();
    }

    @Override
    public ValidationResult validate(Object raw) {
        var issues = new ArrayList<ValidationIssue>();
        Map<String, Object> value = validateObject(raw, "", issues);
        if (!issues.isEmpty()) {
            return new ValidationResult.Invalid(issues);
        }
        return new ValidationResult.Valid(value);
    }

    private Map<String, Object> validateObject(Object raw, String path, List<ValidationIssue> issues) {
        if (!(raw instanceof Map<?, ?> map)) {
            issues.add(new ValidationIssue(path, "Expected object, received " + describe(raw)));
            return null;
        }

        var result = new LinkedHashMap<String, Object>();
        for (FieldSpec field : fields) {
            String fieldPath = path.isEmpty() ? field.name() : path + "." + field.name();

            if (!map.containsKey(field.name())) {
                if (!field.optional()) {
                    issues.add(new ValidationIssue(fieldPath, "Required"));
                }
                continue;
            }

            Object value = map.get(field.name());
            if (value == null) {
                if (field.nullable()) {
                    result.put(field.name(), null);
                } else {
                    issues.add(new ValidationIssue(fieldPath,
                        "Expected %s, received null".formatted(field.type().label())));
                }
                continue;
            }

            if (!field.type().accepts(value)) {
                issues.add(new ValidationIssue(fieldPath,
                    "Expected %s, received %s".formatted(field.type().label(), describe(value))));
                continue;
            }

            if (!field.choices().isEmpty() && !field.choices().contains(value.toString())) {
                issues.add(new ValidationIssue(fieldPath,
                    "Invalid value '%s'. Expected one of %s".formatted(value, field.choices())));
                continue;
            }

            if (field.fields() != null) {
                result.put(field.name(), field.fields().validateObject(value, fieldPath, issues));
            } else {
                result.put(field.name(), value);
            }
        }
        return result;
    }

    private static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof CharSequence) {
            return "string";
        }
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (value instanceof List<?>) {
            return "array";
        }
        if (value instanceof Map<?, ?>) {
            return "object";
        }
        return value.getClass().getSimpleName();
    }
}
