package dev.parsero;

import dev.parsero.cli.ParseroCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new ParseroCli()).execute(args);
        System.exit(exitCode);
    }
}
