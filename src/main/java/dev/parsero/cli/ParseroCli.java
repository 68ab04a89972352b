package dev.parsero.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import dev.parsero.engine.Agent;
import dev.parsero.error.ParseroException;
import dev.parsero.graph.CompiledAgentGraph;
import dev.parsero.model.AgentOptions;
import dev.parsero.model.ModelSource;
import dev.parsero.sample.EchoTextModel;
import dev.parsero.sample.SampleAgents;
import dev.parsero.sample.TextModel;
import dev.parsero.state.Payloads;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintStream;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI entry point: runs one of the bundled sample agents against a JSON input.
 */
@Command(
    name = "parsero",
    mixinStandardHelpOptions = true,
    description = "Run a bundled procedure agent, interpreted or through the compiled state graph."
)
public class ParseroCli implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "Sample agent to run: parity, uppercase")
    private String agentName;

    @Option(names = "--list", description = "List the bundled agents")
    private boolean list;

    @Option(names = "--input", description = "Input as a JSON object, e.g. '{\"number\": 11}'")
    private String input;

    @Option(names = "--graph", description = "Execute through the compiled LangGraph4j graph")
    private boolean graph;

    @Option(names = "--describe", description = "Print the compiled graph edges without running")
    private boolean describe;

    @Option(names = "--max-iterations", description = "Override the iteration ceiling (0 for unbounded)")
    private Integer maxIterations;

    @Option(names = "--verbose", description = "Log each iteration")
    private boolean verbose;

    private final TextModel model;
    private final PrintStream out;
    private final PrintStream err;

    public ParseroCli() {
        this(new EchoTextModel(), System.out, System.err);
    }

    ParseroCli(TextModel model, PrintStream out, PrintStream err) {
        this.model = model;
        this.out = out;
        this.err = err;
    }

    @Override
    public Integer call() {
        if (list) {
            out.println("Available agents:");
            SampleAgents.NAMES.forEach(name -> out.println("  " + name));
            return 0;
        }

        if (agentName == null) {
            err.println("Error: agent name required. Use --list to see available agents.");
            return 1;
        }

        Agent<TextModel> agent;
        try {
            agent = configure(SampleAgents.create(agentName, model));
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        if (describe) {
            CompiledAgentGraph<TextModel> compiled = agent.graph();
            out.println(compiled.blueprint().describe());
            return 0;
        }

        try {
            Map<String, Object> rawInput = parseInput();
            Map<String, Object> output = graph ? agent.graph().invoke(rawInput) : agent.run(rawInput);
            out.println(Payloads.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(output));
            return 0;
        } catch (JsonProcessingException e) {
            err.println("Error: invalid JSON input: " + e.getOriginalMessage());
            return 1;
        } catch (ParseroException e) {
            err.println("Error: " + e.getMessage());
            return 2;
        }
    }

    private Agent<TextModel> configure(Agent<TextModel> agent) {
        AgentOptions options = agent.options().withVerbose(verbose || agent.options().verbose());
        if (maxIterations != null) {
            options = options.withMaxIterations(maxIterations == 0 ? AgentOptions.UNBOUNDED : maxIterations);
        }
        return new Agent<>(ModelSource.single(model), agent.procedures(), agent.state(), options);
    }

    private Map<String, Object> parseInput() throws JsonProcessingException {
        if (input == null || input.isBlank()) {
            return Map.of();
        }
        return Payloads.mapper().readValue(input, new TypeReference<>() {});
    }
}
