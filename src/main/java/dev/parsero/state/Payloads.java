package dev.parsero.state;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

/**
 * Jackson conversions between caller objects and the map form state sections use.
 */
public final class Payloads {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private Payloads() {}

    /**
     * Maps pass through; records and beans become maps. Anything Jackson cannot turn
     * into an object is returned unchanged so the schema validator can report it.
     */
    public static Object toRaw(Object value) {
        if (value == null || value instanceof Map<?, ?>) {
            return value;
        }
        if (value instanceof CharSequence || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        try {
            return MAPPER.convertValue(value, MAP_TYPE);
        } catch (IllegalArgumentException e) {
            return value;
        }
    }

    public static <T> T convert(Map<String, Object> value, Class<T> type) {
        return MAPPER.convertValue(value, type);
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
