package dev.parsero.graph;

import dev.parsero.error.GraphCompilationException;
import dev.parsero.model.AgentOptions;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Hands a {@link GraphBlueprint} to LangGraph4j. Append fields get a list-merging
 * channel; every other key is left to the engine's default, which overwrites.
 * Keys a node removes are passed as {@link AgentState#MARK_FOR_REMOVAL}.
 */
public final class LangGraphAdapter {

    private LangGraphAdapter() {}

    /**
     * @param options the engine's step ceiling is set to {@link AgentOptions#maxIterations()}
     */
    public static CompiledGraph<AgentState> compile(GraphBlueprint blueprint, AgentOptions options) {
        Map<String, Channel<?>> channels = new LinkedHashMap<>();
        blueprint.channels().forEach((key, strategy) -> {
            if (strategy == ChannelStrategy.APPEND) {
                channels.put(key, appendChannel());
            }
        });

        try {
            StateGraph<AgentState> graph = new StateGraph<>(channels, AgentState::new);

            for (var node : blueprint.nodes().entrySet()) {
                GraphBlueprint.NodeBody body = node.getValue();
                AsyncNodeAction<AgentState> action = node_async(state -> toEngine(body.apply(state.data())));
                graph.addNode(node.getKey(), action);
            }

            for (GraphEdge edge : blueprint.edges()) {
                if (edge instanceof GraphEdge.Direct direct) {
                    graph.addEdge(engineId(direct.from()), engineId(direct.to()));
                } else {
                    var conditional = (GraphEdge.Conditional) edge;
                    AsyncEdgeAction<AgentState> route =
                        edge_async(state -> conditional.resolver().resolve(state.data()));
                    graph.addConditionalEdges(engineId(conditional.from()), route, mappings(conditional.targets()));
                }
            }

            CompiledGraph<AgentState> compiled = graph.compile();
            compiled.setMaxIterations(options.bounded() ? options.maxIterations() : Integer.MAX_VALUE);
            return compiled;
        } catch (GraphStateException e) {
            throw new GraphCompilationException("LangGraph4j rejected the compiled procedures: " + e.getMessage(), e);
        }
    }

    private static Channel<Object> appendChannel() {
        Reducer<Object> reducer = (stored, update) -> {
            if (update instanceof GraphBlueprint.Replacement replacement) {
                return replacement.value();
            }
            if (update == AgentState.MARK_FOR_REMOVAL) {
                return update;
            }
            var merged = new ArrayList<Object>();
            if (stored instanceof List<?> old) {
                merged.addAll(old);
            }
            if (update instanceof List<?> items) {
                merged.addAll(items);
            } else {
                merged.add(update);
            }
            return merged;
        };
        return Channels.base(reducer, ArrayList::new);
    }

    private static Map<String, Object> toEngine(Map<String, Object> update) {
        var engineUpdate = new HashMap<String, Object>();
        update.forEach((key, value) ->
            engineUpdate.put(key, value == GraphBlueprint.REMOVED ? AgentState.MARK_FOR_REMOVAL : value));
        return engineUpdate;
    }

    private static Map<String, String> mappings(Set<String> targets) {
        var mappings = new LinkedHashMap<String, String>();
        for (String target : targets) {
            mappings.put(target, engineId(target));
        }
        return mappings;
    }

    private static String engineId(String name) {
        if (GraphBlueprint.START.equals(name)) {
            return StateGraph.START;
        }
        if (GraphBlueprint.END.equals(name)) {
            return StateGraph.END;
        }
        return name;
    }
}
