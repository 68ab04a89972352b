package dev.parsero.model;

/**
 * What an Action declares about the procedure that runs after it.
 * Exactly one of three forms: next-step, exit, or continue in list order.
 */
public sealed interface Transition {

    /** Jump to the named procedure. */
    record NextStep(String nextStep) implements Transition {}

    /** Terminate the run. */
    record Exit() implements Transition {}

    /** Fall through to the procedure that follows in the list, or terminate after the last one. */
    record Continue() implements Transition {}

    static Transition to(String nextStep) {
        return Procedure.END.equals(nextStep) ? new Exit() : new NextStep(nextStep);
    }

    static Transition exit() {
        return new Exit();
    }

    static Transition sequential() {
        return new Continue();
    }
}
