package com.purchasingpower.codegraph.knowledge;

import lombok.Value;

/**
 * Outcome of one {@link EmbeddingIndexer#index} call.
 */
@Value
public class EmbeddingRun {
    int vectorsWritten;
    int failedBatches;

    public static EmbeddingRun empty() {
        return new EmbeddingRun(0, 0);
    }
}
