package dev.parsero.graph;

import dev.parsero.error.IterationLimitException;
import dev.parsero.error.ParseroException;
import dev.parsero.error.StateValidationException;
import dev.parsero.model.AgentOptions;
import dev.parsero.state.Payloads;
import dev.parsero.state.State;
import dev.parsero.state.StateCodec;
import dev.parsero.state.StateValues;
import dev.parsero.state.ValidationResult;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.state.AgentState;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * An agent compiled for LangGraph4j, together with the blueprint it came from and the
 * model chosen for it. Holds no run state: every {@link #invoke(Object)} starts from the
 * schema's all-null template.
 */
public final class CompiledAgentGraph<M> {

    /** Start of the message LangGraph4j raises when a run exceeds its step ceiling. */
    private static final String ENGINE_STEP_LIMIT = "Maximum number of iterations";

    private final GraphBlueprint blueprint;
    private final CompiledGraph<AgentState> graph;
    private final ModelSelection<M> modelSelection;
    private final State state;
    private final AgentOptions options;

    public CompiledAgentGraph(GraphBlueprint blueprint, CompiledGraph<AgentState> graph,
                              ModelSelection<M> modelSelection, State state, AgentOptions options) {
        this.blueprint = blueprint;
        this.graph = graph;
        this.modelSelection = modelSelection;
        this.state = state;
        this.options = options;
    }

    public GraphBlueprint blueprint() {
        return blueprint;
    }

    /** The LangGraph4j graph, for callers that drive the engine themselves. */
    public CompiledGraph<AgentState> graph() {
        return graph;
    }

    public ModelSelection<M> modelSelection() {
        return modelSelection;
    }

    public List<String> diagnostics() {
        return modelSelection.diagnostic().stream().toList();
    }

    /**
     * Run the graph with the same entry and exit checks as {@code Agent.run}.
     * Exceptions thrown by procedure bodies are unwrapped from the engine's async wrappers,
     * and the engine's own step-limit error is reported as an {@link IterationLimitException}.
     */
    public Map<String, Object> invoke(Object rawInput) {
        ValidationResult inputResult = state.validateInput(Payloads.toRaw(rawInput));
        if (inputResult instanceof ValidationResult.Invalid invalid) {
            throw new StateValidationException("The received input does not follow the schema.", invalid.issues());
        }

        StateValues initial = new StateValues(((ValidationResult.Valid) inputResult).value(),
            state.initialValues().output());
        Map<String, Object> flat = withoutNulls(StateCodec.flatten(initial));

        Map<String, Object> finalState;
        try {
            finalState = graph.invoke(flat).map(AgentState::data).orElse(flat);
        } catch (Exception e) {
            throw unwrap(e);
        }

        StateValues values = StateCodec.unflatten(finalState).overlaying(state.initialValues());
        ValidationResult outputResult = state.validateOutput(values.output());
        if (outputResult instanceof ValidationResult.Invalid invalid) {
            throw new StateValidationException("The generated output does not follow the schema.", invalid.issues());
        }
        return ((ValidationResult.Valid) outputResult).value();
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> flat) {
        var copy = new LinkedHashMap<String, Object>();
        flat.forEach((key, value) -> {
            if (value != null) {
                copy.put(key, value);
            }
        });
        return copy;
    }

    private RuntimeException unwrap(Exception e) {
        Throwable current = e;
        while (isWrapper(current)) {
            current = current.getCause();
        }
        if (isEngineStepLimit(current)) {
            return new IterationLimitException(options.maxIterations(), current);
        }
        if (current instanceof RuntimeException runtime) {
            return runtime;
        }
        return new ParseroException("Graph execution failed: " + current.getMessage(), current);
    }

    private static boolean isEngineStepLimit(Throwable t) {
        for (Throwable cause = t; cause != null; cause = cause.getCause()) {
            if (cause instanceof IllegalStateException
                && cause.getMessage() != null
                && cause.getMessage().startsWith(ENGINE_STEP_LIMIT)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isWrapper(Throwable t) {
        Throwable cause = t.getCause();
        if (cause == null) {
            return false;
        }
        return t instanceof CompletionException
            || t instanceof ExecutionException
            || (t.getClass() == RuntimeException.class
                && (cause instanceof CompletionException || cause instanceof ExecutionException));
    }
}
