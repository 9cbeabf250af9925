package com.purchasingpower.codegraph.knowledge;

import lombok.Builder;
import lombok.Value;

/**
 * Status of an indexing run. {@code result} is set once the run has finished.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class IndexingStatus {
    String repositoryId;
    IndexingState state;
    String currentStep;
    long startedAt;
    long finishedAt;
    IndexingResult result;

    public static IndexingStatus notStarted(String repositoryId) {
        return IndexingStatus.builder()
                .repositoryId(repositoryId)
                .state(IndexingState.NOT_STARTED)
                .currentStep("Not started")
                .build();
    }
}
