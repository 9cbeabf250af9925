package com.purchasingpower.codegraph.knowledge;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Result of an indexing run.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class IndexingResult {
    String repositoryId;
    boolean success;
    int filesProcessed;
    int filesSkipped;
    int parsingErrors;
    int packagesCreated;
    int entitiesCreated;
    int relationshipsCreated;
    int entityErrors;
    int relationshipErrors;
    int chunksIndexed;
    int embeddingBatchErrors;
    GraphStatistics graphStatistics;
    long durationMs;
    @Singular
    List<String> errors;

    public static IndexingResult failure(String repositoryId, String error, long durationMs) {
        return IndexingResult.builder()
                .repositoryId(repositoryId)
                .success(false)
                .graphStatistics(GraphStatistics.empty())
                .durationMs(durationMs)
                .error(error)
                .build();
    }
}
