package dev.parsero.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The two-section state handed to procedures.
 * <p>
 * Both sections are frozen on construction, nested maps and lists included, so a
 * Check cannot alter what it reads and an Action has to return a new value.
 * {@code null} values are kept: a declared field that has not been written yet is null.
 */
public record StateValues(Map<String, Object> input, Map<String, Object> output) {

    public StateValues {
        input = freezeMap(input == null ? Map.of() : input);
        output = freezeMap(output == null ? Map.of() : output);
    }

    public static StateValues empty() {
        return new StateValues(Map.of(), Map.of());
    }

    public Object input(String field) {
        return input.get(field);
    }

    public Object output(String field) {
        return output.get(field);
    }

    public StateValues withInput(String field, Object value) {
        var copy = new LinkedHashMap<>(input);
        copy.put(field, value);
        return new StateValues(copy, output);
    }

    public StateValues withOutput(String field, Object value) {
        var copy = new LinkedHashMap<>(output);
        copy.put(field, value);
        return new StateValues(input, copy);
    }

    /** Copy of this state with the given output fields written over the current ones. */
    public StateValues withOutputs(Map<String, ?> fields) {
        var copy = new LinkedHashMap<>(output);
        copy.putAll(fields);
        return new StateValues(input, copy);
    }

    /**
     * Copy of {@code template} overlaid with the fields of this state. Used to restore
     * declared-but-unset fields that an external engine dropped.
     */
    public StateValues overlaying(StateValues template) {
        var in = new LinkedHashMap<>(template.input);
        in.putAll(input);
        var out = new LinkedHashMap<>(template.output);
        out.putAll(output);
        return new StateValues(in, out);
    }

    private static Map<String, Object> freezeMap(Map<?, ?> map) {
        var copy = new LinkedHashMap<String, Object>();
        for (var entry : map.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), freeze(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            return freezeMap(map);
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(freeze(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
