package com.purchasingpower.codegraph.knowledge;

import java.util.concurrent.CompletableFuture;

/**
 * Service for indexing repositories into the code graph and the vector store.
 *
 * <p>Handles the complete indexing pipeline:
 * <ol>
 *   <li>Clone the repository (or use a local directory)</li>
 *   <li>Parse source files into entities</li>
 *   <li>Infer relationships and upsert the graph</li>
 *   <li>Chunk files and index embeddings</li>
 * </ol>
 *
 * @since 1.0.0
 */
public interface IndexingService {

    /**
     * Record a run as PENDING before it is handed to the indexing executor.
     */
    IndexingStatus accept(String repoUrl, String repoId);

    /**
     * Index a repository on the calling thread.
     */
    IndexingResult indexRepository(String repoUrl, String repoId);

    /**
     * Index a repository on the indexing executor.
     */
    CompletableFuture<IndexingResult> indexRepositoryAsync(String repoUrl, String repoId);

    IndexingStatus getStatus(String repoId);

    /**
     * Wipe the graph and the repository's vector namespace.
     */
    void clearIndex(String repoId);

    GraphStatistics getStatistics();
}
