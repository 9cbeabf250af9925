package com.purchasingpower.codegraph.knowledge;

import com.google.common.graph.GraphBuilder;
import com.google.common.graph.Graphs;
import com.google.common.graph.MutableGraph;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Cycle detection and dependency depth over CALLS, IMPORTS and INHERITS_FROM edges.
 *
 * <p>Edges are loaded by entity name, so same-named entities of different modules
 * collapse into one vertex.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DependencyAnalyzer {

    static final String EDGE_QUERY = """
            MATCH (a)-[r:CALLS|IMPORTS|INHERITS_FROM]->(b)
            WHERE a.name IS NOT NULL AND b.name IS NOT NULL
            RETURN a.name AS source, b.name AS target, type(r) AS type
            """;

    private final GraphStore graphStore;

    public record DependencyEdge(String source, String target, String type) {
    }

    public List<DependencyEdge> loadEdges() {
        List<DependencyEdge> edges = new ArrayList<>();
        for (Map<String, Object> row : graphStore.execute(EDGE_QUERY, Map.of())) {
            edges.add(new DependencyEdge(
                    String.valueOf(row.get("source")),
                    String.valueOf(row.get("target")),
                    String.valueOf(row.get("type"))));
        }
        log.debug("Loaded {} dependency edges", edges.size());
        return edges;
    }

    public List<List<String>> findCycles() {
        return findCycles(loadEdges());
    }

    public int dependencyDepth(String entityName) {
        return dependencyDepth(loadEdges(), entityName);
    }

    /**
     * Every strongly connected component with more than one member, plus self-loops.
     * Members of each cycle are sorted by name.
     */
    public List<List<String>> findCycles(Collection<DependencyEdge> edges) {
        MutableGraph<String> graph = toGraph(edges);
        if (!Graphs.hasCycle(graph)) {
            return List.of();
        }
        return new Tarjan(graph).components().stream()
                .filter(scc -> scc.size() > 1 || graph.hasEdgeConnecting(scc.get(0), scc.get(0)))
                .map(scc -> scc.stream().sorted().toList())
                .toList();
    }

    /**
     * Length of the longest outgoing chain from the entity that never revisits a node.
     * An unknown entity, or one with no outgoing edges, has depth 0.
     */
    public int dependencyDepth(Collection<DependencyEdge> edges, String entityName) {
        MutableGraph<String> graph = toGraph(edges);
        if (!graph.nodes().contains(entityName)) {
            return 0;
        }
        return longestPath(graph, entityName, new HashSet<>());
    }

    private int longestPath(MutableGraph<String> graph, String node, Set<String> onPath) {
        onPath.add(node);
        int best = 0;
        for (String next : graph.successors(node)) {
            if (!onPath.contains(next)) {
                best = Math.max(best, 1 + longestPath(graph, next, onPath));
            }
        }
        onPath.remove(node);
        return best;
    }

    private static MutableGraph<String> toGraph(Collection<DependencyEdge> edges) {
        MutableGraph<String> graph = GraphBuilder.directed().allowsSelfLoops(true).build();
        for (DependencyEdge edge : edges) {
            graph.putEdge(edge.source(), edge.target());
        }
        return graph;
    }

    private static final class Tarjan {
        private final MutableGraph<String> graph;
        private final Map<String, Integer> index = new HashMap<>();
        private final Map<String, Integer> lowLink = new HashMap<>();
        private final Deque<String> stack = new ArrayDeque<>();
        private final Set<String> onStack = new HashSet<>();
        private final List<List<String>> components = new ArrayList<>();
        private int counter;

        Tarjan(MutableGraph<String> graph) {
            this.graph = graph;
        }

        List<List<String>> components() {
            for (String node : graph.nodes()) {
                if (!index.containsKey(node)) {
                    visit(node);
                }
            }
            return components;
        }

        private void visit(String node) {
            index.put(node, counter);
            lowLink.put(node, counter);
            counter++;
            stack.push(node);
            onStack.add(node);

            for (String next : graph.successors(node)) {
                if (!index.containsKey(next)) {
                    visit(next);
                    lowLink.put(node, Math.min(lowLink.get(node), lowLink.get(next)));
                } else if (onStack.contains(next)) {
                    lowLink.put(node, Math.min(lowLink.get(node), index.get(next)));
                }
            }

            if (lowLink.get(node).equals(index.get(node))) {
                List<String> component = new ArrayList<>();
                String member;
                do {
                    member = stack.pop();
                    onStack.remove(member);
                    component.add(member);
                } while (!member.equals(node));
                components.add(component);
            }
        }
    }
}
