package com.purchasingpower.codegraph.model.conversation;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One message of a chat session, stored so later queries can fall back on it.
 */
@Data
@Entity
@Table(name = "CONVERSATION_TURNS", indexes = @Index(name = "idx_turn_session", columnList = "session_id"))
@NoArgsConstructor
public class ConversationTurn {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false, length = 128)
    private String sessionId;

    @Column(nullable = false, length = 16)
    private String role; // "user" or "assistant"

    @Column(columnDefinition = "TEXT", nullable = false)
    private String content;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime timestamp;

    public ConversationTurn(String sessionId, String role, String content) {
        this.sessionId = sessionId;
        this.role = role;
        this.content = content;
        this.timestamp = LocalDateTime.now();
    }

    public ConversationTurnView toView() {
        return new ConversationTurnView(role, content, timestamp);
    }
}
