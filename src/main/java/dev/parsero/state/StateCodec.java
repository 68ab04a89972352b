package dev.parsero.state;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts {@link StateValues} to and from the flat, path-keyed form the external
 * graph engine stores.
 * <p>
 * Keys are the section name followed by the field path, joined with {@code _}:
 * {@code input.user.name} becomes {@code input_user_name}. Lists and nulls are
 * leaves and are stored as-is. {@code unflatten(flatten(s))} equals {@code s} as
 * long as no field name contains {@code _}.
 */
public final class StateCodec {

    public static final String SEPARATOR = "_";
    public static final String INPUT_SECTION = "input";
    public static final String OUTPUT_SECTION = "output";

    private static final String INPUT_PREFIX = INPUT_SECTION + SEPARATOR;
    private static final String OUTPUT_PREFIX = OUTPUT_SECTION + SEPARATOR;

    private StateCodec() {}

    public static Map<String, Object> flatten(StateValues values) {
        var flat = new LinkedHashMap<String, Object>();
        walk(INPUT_PREFIX, values.input(), flat);
        walk(OUTPUT_PREFIX, values.output(), flat);
        return flat;
    }

    /**
     * Rebuild the two sections from flat keys. Keys without a section prefix are ignored.
     * When paths collide the later key wins: a scalar is replaced by a map if a deeper
     * path arrives after it, and a map is replaced by a scalar arriving after it.
     */
    public static StateValues unflatten(Map<String, ?> flat) {
        var input = new LinkedHashMap<String, Object>();
        var output = new LinkedHashMap<String, Object>();

        for (var entry : flat.entrySet()) {
            String key = entry.getKey();
            if (key.startsWith(INPUT_PREFIX)) {
                place(input, key.substring(INPUT_PREFIX.length()), entry.getValue());
            } else if (key.startsWith(OUTPUT_PREFIX)) {
                place(output, key.substring(OUTPUT_PREFIX.length()), entry.getValue());
            }
        }
        return new StateValues(input, output);
    }

    /** Flat key of a top-level field of the given section. */
    public static String key(String section, String field) {
        return section + SEPARATOR + field;
    }

    private static void walk(String prefix, Map<?, ?> section, Map<String, Object> flat) {
        for (var entry : section.entrySet()) {
            String key = prefix + entry.getKey();
            Object value = entry.getValue();
            if (value instanceof Map<?, ?> nested && !nested.isEmpty()) {
                walk(key + SEPARATOR, nested, flat);
            } else {
                flat.put(key, value);
            }
        }
    }

    private static void place(Map<String, Object> root, String path, Object value) {
        List<String> segments = List.of(path.split(SEPARATOR, -1));
        Map<String, Object> current = root;

        for (String segment : segments.subList(0, segments.size() - 1)) {
            Map<String, Object> next = copyOf(current.get(segment));
            current.put(segment, next);
            current = next;
        }
        current.put(segments.get(segments.size() - 1), value);
    }

    /** A writable copy of {@code existing} when it is a map, otherwise an empty map. */
    private static Map<String, Object> copyOf(Object existing) {
        var copy = new LinkedHashMap<String, Object>();
        if (existing instanceof Map<?, ?> map) {
            for (var entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), entry.getValue());
            }
        }
        return copy;
    }
}
