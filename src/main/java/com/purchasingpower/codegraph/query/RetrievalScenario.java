package com.purchasingpower.codegraph.query;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which retrieval branch supplied the context, in priority order.
 */
public enum RetrievalScenario {
    MULTI_ENTITY_ANALYSIS("multi_entity_analysis"),
    DIRECT_ENTITY("direct_entity"),
    PINECONE_ONLY("pinecone_only"),
    MEMORY_FALLBACK("memory_fallback");

    private final String tag;

    RetrievalScenario(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }
}
