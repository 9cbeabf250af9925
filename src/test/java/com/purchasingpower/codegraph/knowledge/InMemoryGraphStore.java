package com.purchasingpower.codegraph.knowledge;

import com.purchasingpower.codegraph.core.RelationshipKind;
import com.purchasingpower.codegraph.exception.CodeGraphException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * GraphStore fake with the same merge semantics as the Neo4j adapter: nodes are
 * unique per (label, key), edges per (source, type, target), and an edge to a
 * missing endpoint fails.
 */
public class InMemoryGraphStore implements GraphStore {

    public record Node(String label, String key, Map<String, Object> properties) {
    }

    public record Edge(String sourceKey, String sourceLabel, RelationshipKind kind, String targetKey, String targetLabel) {
    }

    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final Set<Edge> edges = new LinkedHashSet<>();
    private final Set<String> failingKeys = new HashSet<>();
    private final List<String> executed = new ArrayList<>();

    /**
     * Any node or edge write touching this key throws.
     */
    public void failOn(String key) {
        failingKeys.add(key);
    }

    @Override
    public List<Map<String, Object>> execute(String cypher, Map<String, Object> parameters) {
        executed.add(cypher);
        return List.of();
    }

    @Override
    public void upsertNode(String label, String key, Map<String, Object> properties) {
        if (failingKeys.contains(key)) {
            throw new CodeGraphException("Simulated write failure for " + key);
        }
        Node existing = nodes.get(id(label, key));
        Map<String, Object> merged = new HashMap<>(existing == null ? Map.of() : existing.properties());
        merged.putAll(properties);
        nodes.put(id(label, key), new Node(label, key, merged));
    }

    @Override
    public void upsertEdge(String sourceKey, String sourceLabel, String targetKey, String targetLabel, RelationshipKind kind) {
        if (failingKeys.contains(sourceKey) || failingKeys.contains(targetKey)) {
            throw new CodeGraphException("Simulated write failure for " + sourceKey + " -> " + targetKey);
        }
        if (!nodes.containsKey(id(sourceLabel, sourceKey)) || !nodes.containsKey(id(targetLabel, targetKey))) {
            throw new CodeGraphException("Missing endpoint for " + kind + " edge " + sourceKey + " -> " + targetKey);
        }
        edges.add(new Edge(sourceKey, sourceLabel, kind, targetKey, targetLabel));
    }

    @Override
    public void clearAll() {
        nodes.clear();
        edges.clear();
    }

    @Override
    public GraphStatistics getStatistics() {
        Map<String, Long> byLabel = new HashMap<>();
        nodes.values().forEach(n -> byLabel.merge(n.label(), 1L, Long::sum));
        Map<String, Long> byType = new HashMap<>();
        edges.forEach(e -> byType.merge(e.kind().name(), 1L, Long::sum));
        return GraphStatistics.builder().nodesByLabel(byLabel).relationshipsByType(byType).build();
    }

    public List<Node> nodesWithLabel(String label) {
        return nodes.values().stream().filter(n -> n.label().equals(label)).toList();
    }

    public boolean hasNode(String label, String key) {
        return nodes.containsKey(id(label, key));
    }

    public List<Edge> edgesOfKind(RelationshipKind kind) {
        return edges.stream().filter(e -> e.kind() == kind).toList();
    }

    public boolean hasEdge(String sourceKey, RelationshipKind kind, String targetKey) {
        return edges.stream().anyMatch(e -> e.sourceKey().equals(sourceKey) && e.kind() == kind && e.targetKey().equals(targetKey));
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public List<String> executedQueries() {
        return executed;
    }

    private static String id(String label, String key) {
        return label + "|" + key;
    }
}
