package com.purchasingpower.codegraph.service;

import com.purchasingpower.codegraph.model.conversation.ConversationTurnView;

import java.util.List;

/**
 * Chat history per session.
 */
public interface ConversationStore {

    /**
     * The last {@code limit} turns of the session in chronological order.
     * An unknown or blank session has no turns.
     */
    List<ConversationTurnView> getRecentTurns(String sessionId, int limit);

    void appendTurn(String sessionId, String role, String content);
}
