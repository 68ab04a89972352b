package dev.parsero.engine;

import dev.parsero.error.IterationLimitException;
import dev.parsero.error.ProcedureChainException;
import dev.parsero.error.ProcedureNameException;
import dev.parsero.error.StateValidationException;
import dev.parsero.model.AgentOptions;
import dev.parsero.model.ModelSource;
import dev.parsero.model.Procedure;
import dev.parsero.state.FieldSpec;
import dev.parsero.state.State;
import dev.parsero.state.StateSchema;
import dev.parsero.state.StateValues;
import dev.parsero.state.ValidationIssue;
import dev.parsero.testsupport.LogCapture;
import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentTest {

    private static final StateSchema INPUT = StateSchema.of(FieldSpec.number("number"));
    private static final StateSchema OUTPUT = StateSchema.of(
        FieldSpec.string("description"),
        FieldSpec.bool("isEven"));

    record Input(int number) {}

    record Output(String description, boolean isEven) {}

    private final List<String> calls = new ArrayList<>();
    private State state;

    @BeforeEach
    void setUp() {
        calls.clear();
        state = new State(INPUT, OUTPUT);
    }

    private Procedure.Action<String> recording(String name, String next, Procedure.ActionBody<String> body) {
        Procedure.ActionBody<String> recorded = (values, models) -> {
            calls.add(name);
            return body.run(values, models);
        };
        return next == null ? Procedure.action(name, recorded) : Procedure.action(name, next, recorded);
    }

    private Procedure.Check<String> recordingCheck(String name, Procedure.CheckBody<String> body) {
        return Procedure.check(name, (values, models) -> {
            calls.add(name);
            return body.route(values, models);
        });
    }

    private List<Procedure<String>> parityProcedures() {
        return List.of(
            recording("checkNumber", "router", (s, m) ->
                s.withOutput("isEven", ((Number) s.input("number")).intValue() % 2 == 0)),
            recordingCheck("router", (s, m) ->
                Boolean.TRUE.equals(s.output("isEven")) ? "processEven" : "processOdd"),
            recording("processEven", Procedure.END, (s, m) ->
                s.withOutput("description", "%s is even.".formatted(s.input("number")))),
            recording("processOdd", Procedure.END, (s, m) ->
                s.withOutput("description", "%s is odd.".formatted(s.input("number")))));
    }

    private Agent<String> agent(List<Procedure<String>> procedures) {
        return Agent.<String>builder().model("mock-llm").state(state).procedures(procedures).build();
    }

    @Test
    void runsActionsAndRoutesThroughCheck() {
        Agent<String> agent = agent(parityProcedures());

        Map<String, Object> even = agent.run(Map.of("number", 42));

        assertThat(even).containsEntry("isEven", true).containsEntry("description", "42 is even.");
        assertThat(calls).containsExactly("checkNumber", "router", "processEven");

        calls.clear();
        Map<String, Object> odd = agent.run(Map.of("number", 43));

        assertThat(odd).containsEntry("isEven", false).containsEntry("description", "43 is odd.");
        assertThat(calls).containsExactly("checkNumber", "router", "processOdd");
    }

    @Test
    void sequentialActionsRunOnceEachInDeclarationOrder() {
        Agent<String> agent = agent(List.of(
            recording("first", null, (s, m) -> s.withOutput("isEven", true)),
            recording("second", null, (s, m) -> s.withOutput("description", "second")),
            recording("third", null, (s, m) -> s.withOutput("description", "third"))));

        Map<String, Object> output = agent.run(Map.of("number", 1));

        assertThat(calls).containsExactly("first", "second", "third");
        assertThat(output).containsEntry("description", "third");
    }

    @Test
    void duplicateNamesFailBeforeAnyProcedureRuns() {
        Agent<String> agent = agent(List.of(
            recording("sameName", "sameName", (s, m) -> s),
            recordingCheck("sameName", (s, m) -> "next")));

        assertThatThrownBy(() -> agent.run(Map.of("number", 1)))
            .isInstanceOfSatisfying(ProcedureNameException.class,
                e -> assertThat(e.names()).containsExactly("sameName"));
        assertThat(calls).isEmpty();
    }

    @Test
    void actionWithoutSuccessorNextToCheckIsRejected() {
        Agent<String> agent = agent(List.of(
            recording("actionWithoutNext", null, (s, m) -> s),
            recordingCheck("router", (s, m) -> Procedure.END)));

        assertThatThrownBy(() -> agent.run(Map.of("number", 1)))
            .isInstanceOf(ProcedureChainException.class)
            .hasMessageContaining("actionWithoutNext");
        assertThat(calls).isEmpty();
    }

    @Test
    void invalidInputFailsBeforeAnyProcedureRuns() {
        Agent<String> agent = agent(parityProcedures());

        assertThatThrownBy(() -> agent.run(Map.of("number", "not-a-number")))
            .isInstanceOfSatisfying(StateValidationException.class, e -> {
                assertThat(e).hasMessageContaining("input does not follow the schema");
                assertThat(e.issues()).extracting(ValidationIssue::path).containsExactly("number");
            });
        assertThat(calls).isEmpty();
    }

    @Test
    void invalidOutputIsRejected() {
        Agent<String> agent = agent(List.of(
            recording("invalidOutput", null, (s, m) -> s.withOutputs(Map.of("isEven", "yes", "description", 123)))));

        assertThatThrownBy(() -> agent.run(Map.of("number", 1)))
            .isInstanceOf(StateValidationException.class)
            .hasMessageContaining("The generated output does not follow the schema.");
    }

    @Test
    void cyclicActionsHitIterationLimit() {
        state.setOutput(Map.of("description", "test", "isEven", true));
        Agent<String> agent = Agent.<String>builder()
            .model("mock-llm")
            .state(state)
            .maxIterations(5)
            .procedure(recording("loop1", "loop2", (s, m) -> s))
            .procedure(recording("loop2", "loop1", (s, m) -> s))
            .build();

        assertThatThrownBy(() -> agent.run(Map.of("number", 1)))
            .isInstanceOfSatisfying(IterationLimitException.class, e -> {
                assertThat(e.maxIterations()).isEqualTo(5);
                assertThat(e).hasMessageContaining("maximum of 5 iterations");
            });
        assertThat(calls).hasSize(5);
        assertThat(calls.stream().filter("loop1"::equals)).hasSize(3);
        assertThat(calls.stream().filter("loop2"::equals)).hasSize(2);
    }

    @Test
    void unboundedRunIgnoresIterationCeiling() {
        var counter = new int[1];
        Agent<String> agent = Agent.<String>builder()
            .model("mock-llm")
            .state(state)
            .options(AgentOptions.defaults().withMaxIterations(AgentOptions.UNBOUNDED))
            .procedure(Procedure.action("count", "stop", (s, m) -> {
                counter[0]++;
                return s.withOutputs(Map.of("description", "n", "isEven", counter[0] > 150));
            }))
            .procedure(Procedure.check("stop",
                (s, m) -> Boolean.TRUE.equals(s.output("isEven")) ? Procedure.END : "count"))
            .build();

        agent.run(Map.of("number", 1));

        assertThat(counter[0]).isEqualTo(151);
    }

    @Test
    void checkReturningEndKeepsPreviouslySetOutput() {
        state.setOutput(Map.of("description", "set beforehand", "isEven", true));
        var procedures = new ArrayList<>(parityProcedures());
        procedures.set(1, recordingCheck("router", (s, m) -> Procedure.END));

        Map<String, Object> output = agent(procedures).run(Map.of("number", 42));

        assertThat(calls).containsExactly("checkNumber", "router");
        assertThat(output).containsEntry("description", "set beforehand");
    }

    @Test
    void checkReturningNullStopsTheRun() {
        state.setOutput(Map.of("description", "initial", "isEven", true));
        var procedures = new ArrayList<>(parityProcedures());
        procedures.set(1, recordingCheck("router", (s, m) -> null));

        Map<String, Object> output = agent(procedures).run(Map.of("number", 42));

        assertThat(calls).containsExactly("checkNumber", "router");
        assertThat(output).containsEntry("description", "initial");
    }

    @Test
    void unknownNameFromCheckCompletesSilentlyWithWarning() {
        state.setOutput(Map.of("description", "kept", "isEven", false));
        var procedures = new ArrayList<>(parityProcedures());
        procedures.set(1, recordingCheck("router", (s, m) -> "procesEven"));

        try (LogCapture logs = LogCapture.of(Agent.class)) {
            Map<String, Object> output = agent(procedures).run(Map.of("number", 42));

            assertThat(output).containsEntry("description", "kept").containsEntry("isEven", true);
            assertThat(logs.messages(Level.WARN))
                .containsExactly("Procedure 'router' points to unknown procedure 'procesEven'; the run ends there");
        }
        assertThat(calls).containsExactly("checkNumber", "router");
    }

    @Test
    void unknownNameFromActionCompletesSilently() {
        Agent<String> agent = agent(List.of(
            recording("only", "missing", (s, m) -> s.withOutputs(Map.of("description", "d", "isEven", true))),
            recording("never", Procedure.END, (s, m) -> s)));

        agent.run(Map.of("number", 2));

        assertThat(calls).containsExactly("only");
    }

    @Test
    void strictTransitionsTurnUnknownNamesIntoErrors() {
        Agent<String> agent = Agent.<String>builder()
            .model("mock-llm")
            .state(state)
            .options(AgentOptions.defaults().withStrictTransitions(true))
            .procedure(Procedure.action("only", "missing", (s, m) -> s))
            .build();

        assertThatThrownBy(() -> agent.run(Map.of("number", 2)))
            .isInstanceOf(ProcedureChainException.class)
            .hasMessage("Procedure 'only' points to unknown procedure 'missing'.");
    }

    @Test
    void emptyListCompletesImmediatelyAndValidatesOutput() {
        state.setOutput(Map.of("description", "untouched", "isEven", false));

        Map<String, Object> output = agent(List.of()).run(Map.of("number", 2));

        assertThat(output).containsEntry("description", "untouched");
    }

    @Test
    void checkBodiesSeeAnImmutableView() {
        Agent<String> agent = agent(List.of(
            recording("start", "router", (s, m) -> s),
            recordingCheck("router", (s, m) -> {
                s.output().put("description", "sneaky");
                return Procedure.END;
            })));

        assertThatThrownBy(() -> agent.run(Map.of("number", 2)))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void procedureExceptionsPropagateUnwrapped() {
        var failure = new IllegalStateException("model unavailable");
        Agent<String> agent = agent(List.of(
            recording("broken", null, (s, m) -> {
                throw failure;
            })));

        assertThatThrownBy(() -> agent.run(Map.of("number", 2))).isSameAs(failure);
    }

    @Test
    void actionReturningNullIsAProgrammingError() {
        Agent<String> agent = agent(List.of(recording("nothing", null, (s, m) -> null)));

        assertThatThrownBy(() -> agent.run(Map.of("number", 2)))
            .isInstanceOf(NullPointerException.class)
            .hasMessage("Action 'nothing' returned no state");
    }

    @Test
    void everyProcedureReceivesTheWholeModelMap() {
        var seen = new AtomicReference<ModelSource<String>>();
        var models = new LinkedHashMap<String, String>();
        models.put("fast", "small-model");
        models.put("smart", "large-model");
        Agent<String> agent = Agent.<String>builder()
            .models(models)
            .state(state)
            .procedure(Procedure.action("describe", (s, m) -> {
                seen.set(m);
                return s.withOutputs(Map.of("description", m.get("smart"), "isEven", true));
            }))
            .build();

        Map<String, Object> output = agent.run(Map.of("number", 2));

        assertThat(output).containsEntry("description", "large-model");
        assertThat(seen.get()).isInstanceOf(ModelSource.Named.class);
        assertThat(((ModelSource.Named<String>) seen.get()).models()).containsOnlyKeys("fast", "smart");
    }

    @Test
    void convertsRecordInputAndTypedOutput() {
        Output output = agent(parityProcedures()).run(new Input(7), Output.class);

        assertThat(output).isEqualTo(new Output("7 is odd.", false));
    }

    @Test
    void verboseLogsEachIterationAtInfo() {
        Agent<String> agent = Agent.<String>builder()
            .model("mock-llm")
            .state(state)
            .verbose(true)
            .procedures(parityProcedures())
            .build();

        try (LogCapture logs = LogCapture.of(Agent.class)) {
            agent.run(Map.of("number", 42));

            assertThat(logs.messages(Level.INFO))
                .containsExactly("Iteration 1: checkNumber", "Iteration 2: router", "Iteration 3: processEven");
        }
    }

    @Test
    void quietRunLogsIterationsAtDebug() {
        try (LogCapture logs = LogCapture.of(Agent.class)) {
            agent(parityProcedures()).run(Map.of("number", 1));

            assertThat(logs.messages(Level.INFO)).isEmpty();
            assertThat(logs.messages(Level.DEBUG)).contains("Iteration 1: checkNumber");
        }
    }

    @Test
    void inputIsInstalledIntoTheState() {
        agent(parityProcedures()).run(Map.of("number", 8));

        StateValues values = state.values();
        assertThat(values.input()).isEqualTo(Map.of("number", 8));
        assertThat(values.output()).containsEntry("description", "8 is even.");
    }
}
