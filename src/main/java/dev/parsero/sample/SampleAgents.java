package dev.parsero.sample;

import dev.parsero.engine.Agent;
import dev.parsero.engine.AgentDefinitionLoader;
import dev.parsero.model.AgentDefinition;
import dev.parsero.model.ModelSource;
import dev.parsero.model.Procedure;
import dev.parsero.state.StateValues;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Agents bundled with the library, built from the definitions under {@code agents/}.
 */
public final class SampleAgents {

    public static final List<String> NAMES = List.of("parity", "uppercase");

    private SampleAgents() {}

    public static Agent<TextModel> create(String name, TextModel model) {
        return switch (name) {
            case "parity" -> parity(model);
            case "uppercase" -> uppercase(model);
            default -> throw new IllegalArgumentException(
                "Unknown sample agent '%s'. Available: %s".formatted(name, NAMES));
        };
    }

    /**
     * {@code classify -> router -> isOdd | isEven}. The parity is computed locally; the
     * explanation is asked of the model.
     */
    public static Agent<TextModel> parity(TextModel model) {
        AgentDefinition definition = load("agents/parity.json");
        return Agent.<TextModel>builder()
            .model(model)
            .state(definition.newState())
            .options(definition.options())
            .procedure(Procedure.action("classify", "router", SampleAgents::classify))
            .procedure(Procedure.check("router",
                (state, models) -> "odd".equals(state.output("class")) ? "isOdd" : "isEven"))
            .procedure(Procedure.action("isOdd", Procedure.END, (state, models) -> explain(state, models, "odd")))
            .procedure(Procedure.action("isEven", Procedure.END, (state, models) -> explain(state, models, "even")))
            .build();
    }

    /** One action, no model call. */
    public static Agent<TextModel> uppercase(TextModel model) {
        AgentDefinition definition = load("agents/uppercase.json");
        return Agent.<TextModel>builder()
            .model(model)
            .state(definition.newState())
            .options(definition.options())
            .procedure(Procedure.action("uppercase", (state, models) ->
                state.withOutput("uppercase", ((String) state.input("text")).toUpperCase(Locale.ROOT))))
            .build();
    }

    private static StateValues classify(StateValues state, ModelSource<TextModel> models) {
        double number = ((Number) state.input("number")).doubleValue();
        return state.withOutput("class", number % 2 == 0 ? "even" : "odd");
    }

    private static StateValues explain(StateValues state, ModelSource<TextModel> models, String parity) {
        String prompt = "Explain why '%s' is %s.".formatted(state.input("number"), parity);
        return state.withOutputs(Map.of("explanation", models.primary().complete(prompt)));
    }

    private static AgentDefinition load(String resource) {
        try {
            return AgentDefinitionLoader.loadFromResource(resource);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load sample agent from " + resource, e);
        }
    }
}
