package com.purchasingpower.codegraph.repository;

import com.purchasingpower.codegraph.model.conversation.ConversationTurn;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ConversationTurnRepository extends JpaRepository<ConversationTurn, Long> {

    /**
     * Newest first; pass a page size to cap the result.
     */
    List<ConversationTurn> findBySessionIdOrderByIdDesc(String sessionId, Pageable pageable);

    long countBySessionId(String sessionId);
}
