package com.purchasingpower.codegraph.knowledge;

import java.util.List;

/**
 * Semantic index of code chunks, partitioned by namespace (one namespace per repository).
 *
 * @since 1.0.0
 */
public interface VectorStore {

    /**
     * Embed the query text and return the closest chunks, best first.
     */
    List<ChunkMatch> search(String queryText, String namespace, int topK);

    void upsert(List<ChunkVector> vectors, String namespace);

    /**
     * Remove every vector in the namespace.
     */
    void delete(String namespace);
}
