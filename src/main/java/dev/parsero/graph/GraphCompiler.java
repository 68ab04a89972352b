package dev.parsero.graph;

import dev.parsero.engine.ProcedureValidator;
import dev.parsero.error.GraphCompilationException;
import dev.parsero.error.IterationLimitException;
import dev.parsero.error.ProcedureChainException;
import dev.parsero.model.AgentOptions;
import dev.parsero.model.ModelSource;
import dev.parsero.model.Procedure;
import dev.parsero.model.Transition;
import dev.parsero.state.FieldSpec;
import dev.parsero.state.FieldType;
import dev.parsero.state.State;
import dev.parsero.state.StateCodec;
import dev.parsero.state.StateSchema;
import dev.parsero.state.StateValues;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Translates a procedure list into a {@link GraphBlueprint} whose routing matches the
 * interpreter in {@code Agent}: same validation, same end marker, same handling of
 * names that resolve to nothing. Building the blueprint runs no procedure.
 */
public final class GraphCompiler<M> {

    private static final Logger logger = LogManager.getLogger(GraphCompiler.class);

    private final List<Procedure<M>> procedures;
    private final Map<String, Procedure<M>> byName;
    private final ModelSource<M> models;
    private final AgentOptions options;
    private final StateValues template;
    private final Map<String, ChannelStrategy> channels;

    private GraphCompiler(List<Procedure<M>> procedures, State state, ModelSource<M> models, AgentOptions options) {
        this.procedures = List.copyOf(procedures);
        this.byName = new LinkedHashMap<>();
        for (Procedure<M> procedure : this.procedures) {
            byName.put(procedure.name(), procedure);
        }
        this.models = models;
        this.options = options;
        this.template = state.initialValues();
        this.channels = new LinkedHashMap<>();
        addChannels(StateCodec.INPUT_SECTION, state.inputSchema());
        addChannels(StateCodec.OUTPUT_SECTION, state.outputSchema());
    }

    /**
     * @param models the source procedures receive inside the external engine
     * @throws GraphCompilationException if the list is empty
     */
    public static <M> GraphBlueprint compile(List<Procedure<M>> procedures, State state,
                                             ModelSource<M> models, AgentOptions options) {
        ProcedureValidator.validate(procedures);
        if (procedures.isEmpty()) {
            throw new GraphCompilationException("Cannot build a graph without procedures.");
        }
        return new GraphCompiler<>(procedures, state, models, options).build();
    }

    private GraphBlueprint build() {
        var nodes = new LinkedHashMap<String, GraphBlueprint.NodeBody>();
        for (Procedure<M> procedure : procedures) {
            if (procedure instanceof Procedure.Action<M> action) {
                nodes.put(action.name(), nodeBody(action));
            }
        }
        return new GraphBlueprint(channels, nodes, describeEdges());
    }

    private void addChannels(String section, StateSchema schema) {
        for (FieldSpec field : schema.fields()) {
            channels.put(StateCodec.key(section, field.name()),
                field.type() == FieldType.ARRAY ? ChannelStrategy.APPEND : ChannelStrategy.OVERWRITE);
        }
    }

    private List<GraphEdge> describeEdges() {
        var edges = new ArrayList<GraphEdge>();
        edges.add(edgeTo(GraphBlueprint.START, procedures.get(0)));

        for (int i = 0; i < procedures.size(); i++) {
            if (!(procedures.get(i) instanceof Procedure.Action<M> action)) {
                continue;
            }

            Transition transition = action.transition();
            if (transition instanceof Transition.Exit) {
                edges.add(new GraphEdge.Direct(action.name(), GraphBlueprint.END));
            } else if (transition instanceof Transition.NextStep next) {
                Procedure<M> target = byName.get(next.nextStep());
                if (target == null) {
                    unresolved(action.name(), next.nextStep());
                    edges.add(new GraphEdge.Direct(action.name(), GraphBlueprint.END));
                } else {
                    edges.add(edgeTo(action.name(), target));
                }
            } else {
                // Continue: only possible in lists without checks
                String to = i + 1 < procedures.size() ? procedures.get(i + 1).name() : GraphBlueprint.END;
                edges.add(new GraphEdge.Direct(action.name(), to));
            }
        }
        return edges;
    }

    private GraphEdge edgeTo(String from, Procedure<M> target) {
        if (target instanceof Procedure.Check<M> check) {
            return new GraphEdge.Conditional(from, resolver(check), routeTargets());
        }
        return new GraphEdge.Direct(from, target.name());
    }

    private Set<String> routeTargets() {
        var targets = new LinkedHashSet<String>();
        for (Procedure<M> procedure : procedures) {
            if (procedure instanceof Procedure.Action<M>) {
                targets.add(procedure.name());
            }
        }
        targets.add(GraphBlueprint.END);
        return targets;
    }

    /**
     * Checks are not nodes, so a Check that routes to another Check is followed here
     * until an Action or the end is reached. Each hop counts against the iteration
     * ceiling the way a dispatch does in the interpreter.
     */
    private GraphEdge.Resolver resolver(Procedure.Check<M> first) {
        return flatState -> {
            StateValues values = decode(flatState);
            Procedure.Check<M> check = first;
            int hops = 0;
            while (true) {
                if (options.bounded() && hops >= options.maxIterations()) {
                    throw new IterationLimitException(options.maxIterations());
                }
                hops++;

                String route = check.route(values, models);
                if (route == null || Procedure.END.equals(route)) {
                    return GraphBlueprint.END;
                }
                Procedure<M> target = byName.get(route);
                if (target == null) {
                    unresolved(check.name(), route);
                    return GraphBlueprint.END;
                }
                if (target instanceof Procedure.Check<M> next) {
                    check = next;
                } else {
                    return route;
                }
            }
        };
    }

    private GraphBlueprint.NodeBody nodeBody(Procedure.Action<M> action) {
        return flatState -> {
            StateValues result = Objects.requireNonNull(action.run(decode(flatState), models),
                () -> "Action '%s' returned no state".formatted(action.name()));
            return changes(flatState, StateCodec.flatten(result));
        };
    }

    private StateValues decode(Map<String, Object> flatState) {
        return StateCodec.unflatten(flatState).overlaying(template);
    }

    /**
     * Keys whose value differs from what the engine holds. Keys the Action set to null
     * or dropped are {@link GraphBlueprint#REMOVED}: the engine stores no nulls, and
     * decoding restores declared fields as null. Append channels get only the new tail
     * of the list when the old list is a prefix of the new one, and a
     * {@link GraphBlueprint.Replacement} otherwise.
     */
    private Map<String, Object> changes(Map<String, Object> before, Map<String, Object> after) {
        var update = new LinkedHashMap<String, Object>();
        for (var entry : after.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            Object previous = before.get(key);
            if (Objects.equals(previous, value)) {
                continue;
            }
            if (value == null) {
                update.put(key, GraphBlueprint.REMOVED);
            } else if (channels.get(key) == ChannelStrategy.APPEND) {
                update.put(key, appendUpdate(key, previous, value));
            } else {
                update.put(key, value);
            }
        }
        for (var entry : before.entrySet()) {
            String key = entry.getKey();
            if (isStateKey(key) && entry.getValue() != null && !after.containsKey(key)) {
                update.put(key, GraphBlueprint.REMOVED);
            }
        }
        return update;
    }

    private Object appendUpdate(String key, Object previous, Object value) {
        if (value instanceof List<?> list) {
            List<?> old = previous instanceof List<?> p ? p : List.of();
            if (list.size() >= old.size() && list.subList(0, old.size()).equals(old)) {
                return new ArrayList<>(list.subList(old.size(), list.size()));
            }
        }
        logger.debug("List '{}' was rewritten rather than extended; replacing it", key);
        return new GraphBlueprint.Replacement(value);
    }

    private static boolean isStateKey(String key) {
        return key.startsWith(StateCodec.INPUT_SECTION + StateCodec.SEPARATOR)
            || key.startsWith(StateCodec.OUTPUT_SECTION + StateCodec.SEPARATOR);
    }

    private void unresolved(String from, String target) {
        if (options.strictTransitions()) {
            throw new ProcedureChainException(
                "Procedure '%s' points to unknown procedure '%s'.".formatted(from, target));
        }
        logger.warn("Procedure '{}' points to unknown procedure '{}'; the run ends there", from, target);
    }
}
