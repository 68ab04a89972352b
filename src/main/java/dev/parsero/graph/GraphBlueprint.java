package dev.parsero.graph;

import dev.parsero.model.Procedure;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Engine-neutral description of a compiled agent: flat-state channels, one node per
 * Action, and the edges between them. Built fresh per compilation and never mutated.
 *
 * @param channels flat key of every declared field and how updates to it merge
 * @param nodes    node bodies by Action name, in declaration order
 * @param edges    edges in emission order, starting with the one leaving {@link #START}
 */
public record GraphBlueprint(
    Map<String, ChannelStrategy> channels,
    Map<String, NodeBody> nodes,
    List<GraphEdge> edges
) {
    public static final String START = Procedure.START;
    public static final String END = Procedure.END;

    /** Update value that deletes its key from the engine's state. */
    public static final Object REMOVED = new Object() {
        @Override
        public String toString() {
            return "<removed>";
        }
    };

    /**
     * Update value for an {@link ChannelStrategy#APPEND} key whose list was rewritten
     * rather than extended: the stored list is replaced by {@code value}.
     */
    public record Replacement(Object value) {}

    @FunctionalInterface
    public interface NodeBody {
        /**
         * Runs one Action against the flat state and returns the keys it changed.
         * Keys the Action cleared map to {@link #REMOVED}.
         */
        Map<String, Object> apply(Map<String, Object> flatState);
    }

    public GraphBlueprint {
        channels = Collections.unmodifiableMap(new LinkedHashMap<>(channels));
        nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        edges = List.copyOf(edges);
    }

    /** Edges leaving the given node. */
    public List<GraphEdge> edgesFrom(String node) {
        return edges.stream().filter(e -> e.from().equals(node)).toList();
    }

    /** One line per edge, e.g. {@code classify -> router?[isEven, isOdd, __END__]}. */
    public String describe() {
        return edges.stream()
            .map(GraphBlueprint::describe)
            .collect(Collectors.joining("\n"));
    }

    private static String describe(GraphEdge edge) {
        if (edge instanceof GraphEdge.Direct direct) {
            return direct.from() + " -> " + direct.to();
        }
        var conditional = (GraphEdge.Conditional) edge;
        return conditional.from() + " -> ?" + conditional.targets().stream().sorted().toList();
    }
}
