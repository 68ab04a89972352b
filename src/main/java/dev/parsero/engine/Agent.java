package dev.parsero.engine;

import dev.parsero.error.IterationLimitException;
import dev.parsero.error.ProcedureChainException;
import dev.parsero.error.StateValidationException;
import dev.parsero.graph.CompiledAgentGraph;
import dev.parsero.graph.GraphBlueprint;
import dev.parsero.graph.GraphCompiler;
import dev.parsero.graph.LangGraphAdapter;
import dev.parsero.graph.ModelSelection;
import dev.parsero.model.AgentOptions;
import dev.parsero.model.ModelSource;
import dev.parsero.model.Procedure;
import dev.parsero.model.Transition;
import dev.parsero.state.Payloads;
import dev.parsero.state.State;
import dev.parsero.state.StateValues;
import dev.parsero.state.ValidationResult;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Runs a list of {@link Procedure procedures} over a {@link State}.
 * <p>
 * Procedures run in list order unless an Action names its successor or a Check routes
 * elsewhere. A run ends when a transition reaches {@link Procedure#END}, when the list
 * runs out, when a Check returns nothing, or when a name resolves to no procedure.
 * The same list can be compiled for LangGraph4j through {@link #graph()}; both paths
 * share validation and routing rules.
 * <p>
 * An agent owns its state, so it must not run concurrently with itself.
 *
 * @param <M> model client type handed to procedure bodies
 */
public final class Agent<M> {

    private static final Logger logger = LogManager.getLogger(Agent.class);

    private final ModelSource<M> models;
    private final List<Procedure<M>> procedures;
    private final State state;
    private final AgentOptions options;

    public Agent(ModelSource<M> models, List<Procedure<M>> procedures, State state, AgentOptions options) {
        this.models = Objects.requireNonNull(models, "models");
        this.procedures = List.copyOf(procedures);
        this.state = Objects.requireNonNull(state, "state");
        this.options = Objects.requireNonNull(options, "options");
    }

    public static <M> Builder<M> builder() {
        return new Builder<>();
    }

    public List<Procedure<M>> procedures() {
        return procedures;
    }

    public State state() {
        return state;
    }

    public AgentOptions options() {
        return options;
    }

    /**
     * Execute the procedures until the run ends.
     * <ol>
     *   <li>Check names are distinct and, if any Check exists, that every Action names its successor.</li>
     *   <li>Validate the input and install it as the state's input section.</li>
     *   <li>Dispatch procedures until a terminal transition.</li>
     *   <li>Validate and return the output section.</li>
     * </ol>
     * Exceptions thrown by procedure bodies propagate unchanged.
     *
     * @param rawInput a map, or an object Jackson can convert to one
     * @return the validated output
     * @throws dev.parsero.error.ProcedureNameException if names collide
     * @throws ProcedureChainException if an Action lacks a successor while Checks are present
     * @throws IterationLimitException if the run exceeds {@link AgentOptions#maxIterations()}
     * @throws StateValidationException if the input or output does not follow its schema
     */
    public Map<String, Object> run(Object rawInput) {
        try (var ignored = CloseableThreadContext.put("agent", options.name())
                 .put("agentVersion", options.version())) {
            ProcedureValidator.validate(procedures);

            ValidationResult inputResult = state.validateInput(Payloads.toRaw(rawInput));
            if (inputResult instanceof ValidationResult.Invalid invalid) {
                throw new StateValidationException("The received input does not follow the schema.",
                    invalid.issues());
            }
            state.setInput(((ValidationResult.Valid) inputResult).value());

            interpret();

            ValidationResult outputResult = state.validateOutput(state.values().output());
            if (outputResult instanceof ValidationResult.Invalid invalid) {
                throw new StateValidationException("The generated output does not follow the schema.",
                    invalid.issues());
            }
            return ((ValidationResult.Valid) outputResult).value();
        }
    }

    /** Run and convert the validated output to {@code outputType} with Jackson. */
    public <T> T run(Object rawInput, Class<T> outputType) {
        return Payloads.convert(run(rawInput), outputType);
    }

    /**
     * Compile the procedures for LangGraph4j. Each call builds a new graph.
     * When several named models are configured only one is used; the reason is
     * logged and returned in {@link CompiledAgentGraph#diagnostics()}.
     */
    public CompiledAgentGraph<M> graph() {
        ModelSelection<M> selection = ModelSelection.select(models);
        selection.diagnostic().ifPresent(warning -> logger.warn(warning));

        GraphBlueprint blueprint = GraphCompiler.compile(procedures, state, selection.asSource(), options);
        return new CompiledAgentGraph<>(blueprint, LangGraphAdapter.compile(blueprint, options), selection, state,
            options);
    }

    private void interpret() {
        var context = new RunContext<>(procedures);
        Level iterationLevel = options.verbose() ? Level.INFO : Level.DEBUG;

        while (context.running()) {
            if (options.bounded() && context.iterations() >= options.maxIterations()) {
                throw new IterationLimitException(options.maxIterations());
            }

            Procedure<M> procedure = context.current();
            int iteration = context.dispatch();
            logger.log(iterationLevel, "Iteration {}: {}", iteration, procedure.name());

            if (procedure instanceof Procedure.Action<M> action) {
                StateValues next = Objects.requireNonNull(action.run(state.values(), models),
                    () -> "Action '%s' returned no state".formatted(action.name()));
                state.setInput(next.input());
                state.setOutput(next.output());
                followAction(action, context);
            } else if (procedure instanceof Procedure.Check<M> check) {
                String route = check.route(state.values(), models);
                if (route == null || Procedure.END.equals(route)) {
                    context.complete();
                } else {
                    jump(check.name(), route, context);
                }
            }
        }

        logger.debug("Run completed after {} iterations", context.iterations());
    }

    private void followAction(Procedure.Action<M> action, RunContext<M> context) {
        Transition transition = action.transition();
        if (transition instanceof Transition.Exit) {
            context.complete();
        } else if (transition instanceof Transition.NextStep next) {
            jump(action.name(), next.nextStep(), context);
        } else {
            context.advance();
        }
    }

    private void jump(String from, String target, RunContext<M> context) {
        OptionalInt index = context.indexOf(target);
        if (index.isPresent()) {
            context.moveTo(index.getAsInt());
            return;
        }
        if (options.strictTransitions()) {
            throw new ProcedureChainException(
                "Procedure '%s' points to unknown procedure '%s'.".formatted(from, target));
        }
        logger.warn("Procedure '{}' points to unknown procedure '{}'; the run ends there", from, target);
        context.complete();
    }

    public static final class Builder<M> {

        private ModelSource<M> models;
        private final List<Procedure<M>> procedures = new ArrayList<>();
        private State state;
        private AgentOptions options = AgentOptions.defaults();

        private Builder() {}

        public Builder<M> model(M model) {
            this.models = ModelSource.single(model);
            return this;
        }

        public Builder<M> models(Map<String, M> models) {
            this.models = ModelSource.named(models);
            return this;
        }

        public Builder<M> procedure(Procedure<M> procedure) {
            this.procedures.add(procedure);
            return this;
        }

        public Builder<M> procedures(List<? extends Procedure<M>> procedures) {
            this.procedures.addAll(procedures);
            return this;
        }

        public Builder<M> state(State state) {
            this.state = state;
            return this;
        }

        public Builder<M> options(AgentOptions options) {
            this.options = options;
            return this;
        }

        public Builder<M> maxIterations(int maxIterations) {
            this.options = options.withMaxIterations(maxIterations);
            return this;
        }

        public Builder<M> verbose(boolean verbose) {
            this.options = options.withVerbose(verbose);
            return this;
        }

        public Agent<M> build() {
            if (models == null) {
                throw new IllegalStateException("A model or named models must be configured");
            }
            if (state == null) {
                throw new IllegalStateException("A state must be configured");
            }
            return new Agent<>(models, procedures, state, options);
        }
    }
}
