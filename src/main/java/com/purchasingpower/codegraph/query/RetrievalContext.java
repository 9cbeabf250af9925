package com.purchasingpower.codegraph.query;

import com.purchasingpower.codegraph.knowledge.ChunkMatch;
import com.purchasingpower.codegraph.model.conversation.ConversationTurnView;
import com.purchasingpower.codegraph.search.EntityRelationships;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Everything gathered for one query. Lives until the answer is synthesized.
 */
@Value
@Builder(toBuilder = true)
public class RetrievalContext {
    String query;
    RetrievalScenario scenario;
    boolean success;
    String message;
    @Singular List<EntityRelationships> entities;
    @Singular List<ChunkMatch> chunks;
    @Singular List<ConversationTurnView> conversationTurns;

    /**
     * Per-branch failures, kept for diagnostics.
     */
    @Singular List<String> warnings;

    public boolean isEmpty() {
        return entities.isEmpty() && chunks.isEmpty() && conversationTurns.isEmpty();
    }
}
