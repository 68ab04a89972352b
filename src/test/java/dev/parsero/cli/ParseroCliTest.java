package dev.parsero.cli;

import dev.parsero.sample.EchoTextModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class ParseroCliTest {

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        commandLine = new CommandLine(new ParseroCli(new EchoTextModel(),
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8)));
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void listsBundledAgents() {
        int exit = commandLine.execute("--list");

        assertThat(exit).isZero();
        assertThat(out()).contains("parity", "uppercase");
    }

    @Test
    void runsUppercaseAgent() {
        int exit = commandLine.execute("uppercase", "--input", "{\"text\": \"parsero\"}");

        assertThat(exit).isZero();
        assertThat(out()).contains("\"uppercase\" : \"PARSERO\"");
    }

    @Test
    void runsParityThroughTheGraph() {
        int exit = commandLine.execute("parity", "--graph", "--input", "{\"number\": 11}");

        assertThat(exit).isZero();
        assertThat(out()).contains("\"class\" : \"odd\"", "(echo) Explain why '11' is odd.");
    }

    @Test
    void describesCompiledGraph() {
        int exit = commandLine.execute("parity", "--describe");

        assertThat(exit).isZero();
        assertThat(out()).contains("__START__ -> classify", "classify -> ?[__END__, isEven, isOdd]");
    }

    @Test
    void missingAgentNameIsAUsageError() {
        int exit = commandLine.execute();

        assertThat(exit).isEqualTo(1);
        assertThat(err()).contains("agent name required");
    }

    @Test
    void unknownAgentIsAUsageError() {
        int exit = commandLine.execute("reverse");

        assertThat(exit).isEqualTo(1);
        assertThat(err()).contains("Unknown sample agent 'reverse'");
    }

    @Test
    void malformedJsonIsAUsageError() {
        int exit = commandLine.execute("uppercase", "--input", "{text");

        assertThat(exit).isEqualTo(1);
        assertThat(err()).contains("invalid JSON input");
    }

    @Test
    void schemaViolationsExitWithTwo() {
        int exit = commandLine.execute("parity", "--input", "{\"number\": \"eleven\"}");

        assertThat(exit).isEqualTo(2);
        assertThat(err()).contains("The received input does not follow the schema.");
    }

    @Test
    void rejectsNegativeIterationCeiling() {
        int exit = commandLine.execute("parity", "--max-iterations=-3", "--input", "{\"number\": 1}");

        assertThat(exit).isEqualTo(1);
        assertThat(err()).contains("maxIterations must be positive");
    }
}
