package dev.parsero.engine;

import dev.parsero.error.ProcedureChainException;
import dev.parsero.error.ProcedureNameException;
import dev.parsero.model.Procedure;
import dev.parsero.model.Transition;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Validates a procedure list before anything runs. Shared by the interpreter and the
 * graph compiler so both reject the same lists.
 */
public final class ProcedureValidator {

    private static final Set<String> RESERVED_NAMES = Set.of(Procedure.END, Procedure.START);

    private ProcedureValidator() {}

    public static void validate(List<? extends Procedure<?>> procedures) {
        validateNames(procedures);
        validateChain(procedures);
    }

    /**
     * @throws ProcedureNameException listing every duplicated name once, or every reserved name used
     */
    public static void validateNames(List<? extends Procedure<?>> procedures) {
        var seen = new HashSet<String>();
        var duplicates = new LinkedHashSet<String>();
        var reserved = new LinkedHashSet<String>();

        for (Procedure<?> procedure : procedures) {
            String name = procedure.name();
            if (name == null || name.isBlank()) {
                throw new ProcedureNameException("Procedure names must not be empty.", List.of(String.valueOf(name)));
            }
            if (RESERVED_NAMES.contains(name)) {
                reserved.add(name);
            }
            if (!seen.add(name)) {
                duplicates.add(name);
            }
        }

        if (!reserved.isEmpty()) {
            throw new ProcedureNameException("Procedure names must not use a reserved marker.",
                new ArrayList<>(reserved));
        }
        if (!duplicates.isEmpty()) {
            throw new ProcedureNameException("Procedure names must be distinct.", new ArrayList<>(duplicates));
        }
    }

    /**
     * Once a Check can jump anywhere, list order no longer says what follows an Action,
     * so every Action has to name its successor.
     *
     * @throws ProcedureChainException naming the Actions without a declared successor
     */
    public static void validateChain(List<? extends Procedure<?>> procedures) {
        boolean hasCheck = procedures.stream().anyMatch(p -> p instanceof Procedure.Check<?>);
        if (!hasCheck) {
            return;
        }

        List<String> undeclared = procedures.stream()
            .filter(p -> p instanceof Procedure.Action<?> action
                && action.transition() instanceof Transition.Continue)
            .map(Procedure::name)
            .toList();

        if (!undeclared.isEmpty()) {
            throw new ProcedureChainException(
                "When a 'check' procedure is present, every 'action' procedure must declare its next procedure. "
                    + "Missing on: " + undeclared);
        }
    }
}
