package com.purchasingpower.codegraph.knowledge;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Node counts by label and relationship counts by type.
 */
@Value
@Builder
public class GraphStatistics {
    @Singular("nodeCount")
    Map<String, Long> nodesByLabel;
    @Singular("relationshipCount")
    Map<String, Long> relationshipsByType;

    public long getTotalNodes() {
        return nodesByLabel.values().stream().mapToLong(Long::longValue).sum();
    }

    public long getTotalRelationships() {
        return relationshipsByType.values().stream().mapToLong(Long::longValue).sum();
    }

    public static GraphStatistics empty() {
        return GraphStatistics.builder().build();
    }
}
