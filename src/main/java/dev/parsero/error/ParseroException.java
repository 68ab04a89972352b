package dev.parsero.error;

/**
 * Root of the exceptions raised by the orchestration engine and the graph compiler.
 */
public class ParseroException extends RuntimeException {

    public ParseroException(String message) {
        super(message);
    }

    public ParseroException(String message, Throwable cause) {
        super(message, cause);
    }
}
