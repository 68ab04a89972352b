package dev.parsero.model;

import dev.parsero.state.State;
import dev.parsero.state.StateSchema;

/**
 * Declarative part of an agent: the two state schemas and its options.
 * Procedures are code and are supplied separately.
 */
public record AgentDefinition(
    StateSchema input,
    StateSchema output,
    AgentOptions options
) {
    /** A fresh state container for these schemas. */
    public State newState() {
        return new State(input, output);
    }
}
