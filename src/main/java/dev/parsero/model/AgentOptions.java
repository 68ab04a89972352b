package dev.parsero.model;

/**
 * Run limits and metadata for an agent.
 *
 * @param name              agent name, attached to log context during a run
 * @param version           agent version, attached to log context during a run
 * @param maxIterations     dispatch ceiling per run, or {@link #UNBOUNDED}
 * @param verbose           log each iteration at INFO instead of DEBUG
 * @param strictTransitions fail instead of completing when a transition names an unknown procedure
 */
public record AgentOptions(
    String name,
    String version,
    int maxIterations,
    boolean verbose,
    boolean strictTransitions
) {
    public static final int UNBOUNDED = -1;

    public static final String DEFAULT_NAME = "agent";
    public static final String DEFAULT_VERSION = "0.0.0";
    public static final int DEFAULT_MAX_ITERATIONS = 100;
    public static final boolean DEFAULT_VERBOSE = false;
    public static final boolean DEFAULT_STRICT_TRANSITIONS = false;

    public AgentOptions {
        if (maxIterations != UNBOUNDED && maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive or UNBOUNDED: " + maxIterations);
        }
    }

    public static AgentOptions defaults() {
        return new AgentOptions(DEFAULT_NAME, DEFAULT_VERSION, DEFAULT_MAX_ITERATIONS,
            DEFAULT_VERBOSE, DEFAULT_STRICT_TRANSITIONS);
    }

    public boolean bounded() {
        return maxIterations != UNBOUNDED;
    }

    public AgentOptions withMaxIterations(int maxIterations) {
        return new AgentOptions(name, version, maxIterations, verbose, strictTransitions);
    }

    public AgentOptions withVerbose(boolean verbose) {
        return new AgentOptions(name, version, maxIterations, verbose, strictTransitions);
    }

    public AgentOptions withStrictTransitions(boolean strictTransitions) {
        return new AgentOptions(name, version, maxIterations, verbose, strictTransitions);
    }

    public AgentOptions withIdentity(String name, String version) {
        return new AgentOptions(name, version, maxIterations, verbose, strictTransitions);
    }
}
