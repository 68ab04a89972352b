package dev.parsero.model;

import dev.parsero.state.StateValues;

/**
 * A named step of an agent. Either an {@link Action}, which produces a new state and
 * may declare where to go next, or a {@link Check}, which only reads the state and
 * names the next procedure.
 *
 * @param <M> model client type handed to the bodies
 */
public sealed interface Procedure<M> {

    /** Terminal marker. Shared with the external graph engine's end node. */
    String END = "__END__";

    /** Entry marker of the external graph engine; reserved as a procedure name. */
    String START = "__START__";

    String name();

    @FunctionalInterface
    interface ActionBody<M> {
        /** Must return the complete state, both sections, never null. */
        StateValues run(StateValues state, ModelSource<M> models);
    }

    @FunctionalInterface
    interface CheckBody<M> {
        /** Name of the next procedure; {@code null} or {@link Procedure#END} stops the run. */
        String route(StateValues state, ModelSource<M> models);
    }

    record Action<M>(String name, Transition transition, ActionBody<M> body) implements Procedure<M> {

        public Action {
            if (transition == null) {
                transition = Transition.sequential();
            }
        }

        public StateValues run(StateValues state, ModelSource<M> models) {
            return body.run(state, models);
        }
    }

    record Check<M>(String name, CheckBody<M> body) implements Procedure<M> {

        public String route(StateValues state, ModelSource<M> models) {
            return body.route(state, models);
        }
    }

    /** Action that continues with the next procedure in list order. */
    static <M> Action<M> action(String name, ActionBody<M> body) {
        return new Action<>(name, Transition.sequential(), body);
    }

    /** Action with an explicit successor; pass {@link #END} to terminate after it. */
    static <M> Action<M> action(String name, String next, ActionBody<M> body) {
        return new Action<>(name, Transition.to(next), body);
    }

    static <M> Check<M> check(String name, CheckBody<M> body) {
        return new Check<>(name, body);
    }
}
