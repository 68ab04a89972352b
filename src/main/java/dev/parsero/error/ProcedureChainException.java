package dev.parsero.error;

/**
 * Raised when the procedure chain cannot be walked: an action without a declared
 * successor in a branching list, or (in strict mode) a transition to an unknown name.
 */
public class ProcedureChainException extends ParseroException {

    public ProcedureChainException(String message) {
        super(message);
    }

    public ProcedureChainException(String message, Throwable cause) {
        super(message, cause);
    }
}
