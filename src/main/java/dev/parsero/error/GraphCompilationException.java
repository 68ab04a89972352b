package dev.parsero.error;

/**
 * Raised when a procedure list cannot be turned into an external graph.
 */
public class GraphCompilationException extends ParseroException {

    public GraphCompilationException(String message) {
        super(message);
    }

    public GraphCompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
