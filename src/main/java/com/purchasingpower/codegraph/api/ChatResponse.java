package com.purchasingpower.codegraph.api;

import com.purchasingpower.codegraph.knowledge.ChunkMatch;
import com.purchasingpower.codegraph.query.RetrievalScenario;
import com.purchasingpower.codegraph.search.EntityRelationships;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatResponse {

    private boolean success;
    private String sessionId;
    private String answer;
    private RetrievalScenario scenario;
    private String message;
    private List<EntityRelationships> entities;
    private List<ChunkMatch> chunks;
    private List<String> warnings;
    private long durationMs;
}
