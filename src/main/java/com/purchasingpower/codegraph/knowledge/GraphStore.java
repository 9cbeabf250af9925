package com.purchasingpower.codegraph.knowledge;

import com.purchasingpower.codegraph.core.RelationshipKind;

import java.util.List;
import java.util.Map;

/**
 * Interface for graph database operations.
 *
 * <p>Nodes are addressed by label plus a unique {@code key} property. Both node and edge
 * writes are create-or-match, so replaying the same write leaves the graph unchanged.
 *
 * @since 1.0.0
 */
public interface GraphStore {

    /**
     * Execute a Cypher query and return raw rows.
     *
     * @param cypher Cypher query
     * @param parameters Query parameters
     * @return one map per result row
     */
    List<Map<String, Object>> execute(String cypher, Map<String, Object> parameters);

    /**
     * Create or match a node and set its properties.
     *
     * @param label Node label, e.g. {@code Class} or {@code Package}
     * @param key Unique key within the label
     * @param properties Properties to set; every node carries at least {@code name}
     */
    void upsertNode(String label, String key, Map<String, Object> properties);

    /**
     * Create or match a typed edge between two existing nodes.
     *
     * @throws com.purchasingpower.codegraph.exception.CodeGraphException when either endpoint is missing
     */
    void upsertEdge(String sourceKey, String sourceLabel, String targetKey, String targetLabel, RelationshipKind kind);

    /**
     * Delete every node and relationship.
     */
    void clearAll();

    GraphStatistics getStatistics();
}
