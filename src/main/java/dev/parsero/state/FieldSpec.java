package dev.parsero.state;

import java.util.List;

/**
 * Declaration of a single state field.
 *
 * @param name     field name; must not contain the flat-state separator {@code _}
 *                 if the field is to survive a round trip through the external graph
 * @param type     value type
 * @param nullable whether an explicit {@code null} is accepted
 * @param optional whether the field may be absent
 * @param choices  allowed string values, empty when unrestricted
 * @param fields   nested schema for {@link FieldType#OBJECT} fields, or null
 */
public record FieldSpec(
    String name,
    FieldType type,
    boolean nullable,
    boolean optional,
    List<String> choices,
    StateSchema fields // nullable
) {
    public FieldSpec {
        choices = List.copyOf(choices);
    }

    public static FieldSpec of(String name, FieldType type) {
        return new FieldSpec(name, type, false, false, List.of(), null);
    }

    public static FieldSpec string(String name) {
        return of(name, FieldType.STRING);
    }

    public static FieldSpec number(String name) {
        return of(name, FieldType.NUMBER);
    }

    public static FieldSpec bool(String name) {
        return of(name, FieldType.BOOLEAN);
    }

    public static FieldSpec array(String name) {
        return of(name, FieldType.ARRAY);
    }

    /** String field restricted to the given values. */
    public static FieldSpec oneOf(String name, String... choices) {
        return new FieldSpec(name, FieldType.STRING, false, false, List.of(choices), null);
    }

    public static FieldSpec object(String name, StateSchema fields) {
        return new FieldSpec(name, FieldType.OBJECT, false, false, List.of(), fields);
    }

    public FieldSpec asNullable() {
        return new FieldSpec(name, type, true, optional, choices, fields);
    }

    public FieldSpec asOptional() {
        return new FieldSpec(name, type, nullable, true, choices, fields);
    }
}
