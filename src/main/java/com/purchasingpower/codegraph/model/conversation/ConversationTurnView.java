package com.purchasingpower.codegraph.model.conversation;

import java.time.LocalDateTime;

/**
 * Read-only copy of a stored turn, detached from persistence.
 */
public record ConversationTurnView(String role, String content, LocalDateTime timestamp) {
}
