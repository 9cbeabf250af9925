package com.purchasingpower.codegraph.service.impl;

import com.purchasingpower.codegraph.model.conversation.ConversationTurn;
import com.purchasingpower.codegraph.model.conversation.ConversationTurnView;
import com.purchasingpower.codegraph.repository.ConversationTurnRepository;
import com.purchasingpower.codegraph.service.ConversationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaConversationStore implements ConversationStore {

    private final ConversationTurnRepository turnRepository;

    @Override
    @Transactional(readOnly = true)
    public List<ConversationTurnView> getRecentTurns(String sessionId, int limit) {
        if (sessionId == null || sessionId.isBlank() || limit <= 0) {
            return List.of();
        }
        List<ConversationTurnView> turns = new ArrayList<>();
        for (ConversationTurn turn : turnRepository.findBySessionIdOrderByIdDesc(sessionId, PageRequest.of(0, limit))) {
            turns.add(turn.toView());
        }
        Collections.reverse(turns);
        return turns;
    }

    @Override
    @Transactional
    public void appendTurn(String sessionId, String role, String content) {
        if (sessionId == null || sessionId.isBlank()) {
            return;
        }
        turnRepository.save(new ConversationTurn(sessionId, role, content == null ? "" : content));
        log.debug("💬 Stored {} turn for session {}", role, sessionId);
    }
}
