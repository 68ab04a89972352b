package dev.parsero.engine;

import dev.parsero.model.Procedure;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Per-run bookkeeping for the interpreter: where it is, how many dispatches it has
 * made, and the name-to-index table built once at the start of the run.
 */
final class RunContext<M> {

    private final List<Procedure<M>> procedures;
    private final Map<String, Integer> indexByName;
    private int current;
    private int iterations;

    RunContext(List<Procedure<M>> procedures) {
        this.procedures = procedures;
        this.indexByName = new HashMap<>();
        for (int i = 0; i < procedures.size(); i++) {
            indexByName.put(procedures.get(i).name(), i);
        }
        this.current = procedures.isEmpty() ? -1 : 0;
    }

    boolean running() {
        return current >= 0;
    }

    Procedure<M> current() {
        return procedures.get(current);
    }

    int iterations() {
        return iterations;
    }

    /** Record a dispatch of the current procedure and return the new iteration number. */
    int dispatch() {
        return ++iterations;
    }

    OptionalInt indexOf(String name) {
        Integer index = indexByName.get(name);
        return index == null ? OptionalInt.empty() : OptionalInt.of(index);
    }

    void moveTo(int index) {
        this.current = index;
    }

    /** Move to the procedure after the current one, or complete after the last. */
    void advance() {
        current = current + 1 < procedures.size() ? current + 1 : -1;
    }

    void complete() {
        this.current = -1;
    }
}
