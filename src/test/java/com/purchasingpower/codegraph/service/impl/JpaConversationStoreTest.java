package com.purchasingpower.codegraph.service.impl;

import com.purchasingpower.codegraph.model.conversation.ConversationTurnView;
import com.purchasingpower.codegraph.repository.ConversationTurnRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(JpaConversationStore.class)
@DisplayName("JPA conversation store")
class JpaConversationStoreTest {

    @Autowired
    private JpaConversationStore conversationStore;

    @Autowired
    private ConversationTurnRepository turnRepository;

    @Test
    @DisplayName("Should return the most recent turns in chronological order")
    void shouldReturnRecentTurnsInOrder() {
        // Given
        conversationStore.appendTurn("s1", "user", "first question");
        conversationStore.appendTurn("s1", "assistant", "first answer");
        conversationStore.appendTurn("s1", "user", "second question");
        conversationStore.appendTurn("s1", "assistant", "second answer");
        conversationStore.appendTurn("s2", "user", "other session");

        // When
        List<ConversationTurnView> turns = conversationStore.getRecentTurns("s1", 3);

        // Then
        assertThat(turns).extracting(ConversationTurnView::content)
                .containsExactly("first answer", "second question", "second answer");
        assertThat(turns).extracting(ConversationTurnView::role)
                .containsExactly("assistant", "user", "assistant");
        assertThat(turnRepository.countBySessionId("s1")).isEqualTo(4);
    }

    @Test
    @DisplayName("Should have no turns for blank or unknown sessions")
    void shouldHandleUnknownSessions() {
        // Given
        conversationStore.appendTurn(" ", "user", "ignored");

        // Then
        assertThat(conversationStore.getRecentTurns("nobody", 5)).isEmpty();
        assertThat(conversationStore.getRecentTurns(null, 5)).isEmpty();
        assertThat(conversationStore.getRecentTurns("s1", 0)).isEmpty();
        assertThat(turnRepository.count()).isZero();
    }
}
