package com.purchasingpower.codegraph.knowledge;

import java.util.List;

/**
 * Service for turning text into embedding vectors.
 *
 * @since 1.0.0
 */
public interface EmbeddingService {

    /**
     * Generate the embedding for one text, e.g. a search query.
     *
     * @param text the text to embed
     * @return embedding vector (1024 dimensions for mxbai-embed-large)
     */
    List<Float> embed(String text);

    /**
     * Generate embeddings in one call.
     *
     * @param texts texts to embed
     * @return embedding vectors, same order as input
     */
    List<List<Float>> embedAll(List<String> texts);
}
