package com.purchasingpower.codegraph.knowledge;

import com.purchasingpower.codegraph.core.CodeChunk;

import java.util.List;

/**
 * Embeds chunks and writes them to the vector store.
 *
 * @since 1.0.0
 */
public interface EmbeddingIndexer {

    /**
     * Embed and upsert the chunks into the namespace in bounded batches. Each batch is
     * written before the next one is embedded.
     *
     * @return vectors written and the number of batches that failed
     */
    EmbeddingRun index(List<CodeChunk> chunks, String namespace);
}
