package com.purchasingpower.codegraph.api;

import com.purchasingpower.codegraph.knowledge.IndexingState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexResponse {

    private boolean success;
    private String repoId;
    private IndexingState state;
    private String message;
    private String error;

    public static IndexResponse accepted(String repoId, IndexingState state) {
        return IndexResponse.builder()
            .success(true)
            .repoId(repoId)
            .state(state)
            .message("Indexing started, poll /api/v1/knowledge/index/" + repoId + "/status")
            .build();
    }

    public static IndexResponse error(String error) {
        return IndexResponse.builder()
            .success(false)
            .error(error)
            .build();
    }
}
