package dev.parsero.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.parsero.model.AgentDefinition;
import dev.parsero.model.AgentOptions;
import dev.parsero.state.FieldSpec;
import dev.parsero.state.FieldType;
import dev.parsero.state.StateSchema;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Loads agent definitions (state schemas and options) from JSON.
 * <pre>
 * {
 *   "name": "parity", "version": "1.0.0",
 *   "input":  { "number": { "type": "number" } },
 *   "output": { "class": { "type": "string", "enum": ["odd", "even"] } },
 *   "options": { "maxIterations": 10, "verbose": true }
 * }
 * </pre>
 * {@code maxIterations} also accepts {@code "unbounded"}.
 */
public final class AgentDefinitionLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private AgentDefinitionLoader() {}

    public static AgentDefinition loadFromFile(Path path) throws IOException {
        return parseDefinition(MAPPER.readTree(path.toFile()));
    }

    public static AgentDefinition loadFromString(String json) throws IOException {
        return parseDefinition(MAPPER.readTree(json));
    }

    /**
     * Load a definition bundled on the classpath, e.g. {@code agents/parity.json}.
     */
    public static AgentDefinition loadFromResource(String resource) throws IOException {
        try (InputStream in = AgentDefinitionLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("Agent definition not found on classpath: " + resource);
            }
            return parseDefinition(MAPPER.readTree(in));
        }
    }

    private static AgentDefinition parseDefinition(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Agent definition must be a JSON object");
        }
        StateSchema input = parseSchema(required(root, "input"));
        StateSchema output = parseSchema(required(root, "output"));
        return new AgentDefinition(input, output, parseOptions(root));
    }

    private static AgentOptions parseOptions(JsonNode root) {
        String name = root.has("name") ? root.get("name").asText() : AgentOptions.DEFAULT_NAME;
        String version = root.has("version") ? root.get("version").asText() : AgentOptions.DEFAULT_VERSION;

        JsonNode node = root.get("options");
        if (node == null) {
            return AgentOptions.defaults().withIdentity(name, version);
        }

        int maxIterations = AgentOptions.DEFAULT_MAX_ITERATIONS;
        JsonNode max = node.get("maxIterations");
        if (max != null) {
            if (max.isTextual() && "unbounded".equalsIgnoreCase(max.asText())) {
                maxIterations = AgentOptions.UNBOUNDED;
            } else if (max.canConvertToInt()) {
                maxIterations = max.asInt();
            } else {
                throw new IllegalArgumentException("Invalid maxIterations: " + max);
            }
        }
        boolean verbose = node.has("verbose")
            ? node.get("verbose").asBoolean() : AgentOptions.DEFAULT_VERBOSE;
        boolean strict = node.has("strictTransitions")
            ? node.get("strictTransitions").asBoolean() : AgentOptions.DEFAULT_STRICT_TRANSITIONS;

        return new AgentOptions(name, version, maxIterations, verbose, strict);
    }

    private static StateSchema parseSchema(JsonNode node) {
        if (!node.isObject()) {
            throw new IllegalArgumentException("Schema must be a JSON object of fields: " + node);
        }
        var fields = new ArrayList<FieldSpec>();
        for (var entry : node.properties()) {
            fields.add(parseField(entry.getKey(), entry.getValue()));
        }
        return new StateSchema(fields);
    }

    private static FieldSpec parseField(String name, JsonNode node) {
        FieldType type = parseType(name, required(node, "type").asText());

        List<String> choices = new ArrayList<>();
        if (node.has("enum")) {
            node.get("enum").forEach(choice -> choices.add(choice.asText()));
        }
        StateSchema nested = node.has("fields") ? parseSchema(node.get("fields")) : null;
        boolean nullable = node.path("nullable").asBoolean(false);
        boolean optional = node.path("optional").asBoolean(false);

        return new FieldSpec(name, type, nullable, optional, choices, nested);
    }

    private static FieldType parseType(String field, String type) {
        try {
            return FieldType.valueOf(type.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown type '%s' for field '%s'".formatted(type, field), e);
        }
    }

    private static JsonNode required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null) {
            throw new IllegalArgumentException("Missing required field '%s' in %s".formatted(field, node));
        }
        return value;
    }
}
