package dev.parsero.error;

import java.util.List;

/**
 * Raised before execution when procedure names collide or use a reserved marker.
 */
public class ProcedureNameException extends ParseroException {

    private final List<String> names;

    public ProcedureNameException(String message, List<String> names) {
        super(message + " " + names);
        this.names = List.copyOf(names);
    }

    /** The offending names, each listed once. */
    public List<String> names() {
        return names;
    }
}
