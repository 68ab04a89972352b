package dev.parsero.graph;

import java.util.Map;
import java.util.Set;

/**
 * An edge of the compiled graph, either fixed or chosen at run time from the flat state.
 */
public sealed interface GraphEdge {

    String from();

    @FunctionalInterface
    interface Resolver {
        /** Target node name, or {@link GraphBlueprint#END}. */
        String resolve(Map<String, Object> flatState);
    }

    record Direct(String from, String to) implements GraphEdge {}

    /**
     * @param targets every value the resolver may return
     */
    record Conditional(String from, Resolver resolver, Set<String> targets) implements GraphEdge {

        public Conditional {
            targets = Set.copyOf(targets);
        }
    }
}
