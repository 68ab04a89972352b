package dev.parsero.error;

/**
 * Raised mid-run when the dispatch count reaches the configured ceiling.
 * This is the only cycle detection the engine performs.
 */
public class IterationLimitException extends ProcedureChainException {

    private final int maxIterations;

    public IterationLimitException(int maxIterations) {
        this(maxIterations, null);
    }

    /** @param cause the external engine's own limit error, when it detected the loop */
    public IterationLimitException(int maxIterations, Throwable cause) {
        super("Agent reached the maximum of %d iterations. Possible loop in the procedure graph."
            .formatted(maxIterations), cause);
        this.maxIterations = maxIterations;
    }

    public int maxIterations() {
        return maxIterations;
    }
}
