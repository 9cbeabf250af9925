package com.purchasingpower.codegraph.api;

import com.purchasingpower.codegraph.query.RetrievalContext;
import com.purchasingpower.codegraph.query.RetrievalOrchestrator;
import com.purchasingpower.codegraph.query.Synthesizer;
import com.purchasingpower.codegraph.service.ConversationStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Question answering over the indexed code.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/chat")
@RequiredArgsConstructor
public class ChatController {

    private final RetrievalOrchestrator retrievalOrchestrator;
    private final Synthesizer synthesizer;
    private final ConversationStore conversationStore;

    /**
     * POST /api/v1/chat
     */
    @PostMapping
    public ResponseEntity<ChatResponse> chat(@Valid @RequestBody ChatRequest request) {
        long startTime = System.currentTimeMillis();
        String sessionId = request.getSessionId() != null && !request.getSessionId().isBlank()
                ? request.getSessionId()
                : UUID.randomUUID().toString();

        RetrievalContext context = retrievalOrchestrator.retrieve(
                request.getQuery(), request.getEntityName(), sessionId, request.getRepoId());
        String answer = synthesizer.synthesize(request.getQuery(), context);

        storeTurns(sessionId, request.getQuery(), answer);

        return ResponseEntity.ok(ChatResponse.builder()
                .success(context.isSuccess())
                .sessionId(sessionId)
                .answer(answer)
                .scenario(context.getScenario())
                .message(context.getMessage())
                .entities(context.getEntities())
                .chunks(context.getChunks())
                .warnings(context.getWarnings())
                .durationMs(System.currentTimeMillis() - startTime)
                .build());
    }

    private void storeTurns(String sessionId, String query, String answer) {
        try {
            conversationStore.appendTurn(sessionId, "user", query);
            conversationStore.appendTurn(sessionId, "assistant", answer);
        } catch (RuntimeException e) {
            log.warn("⚠️ Could not store conversation turns for {}: {}", sessionId, e.getMessage());
        }
    }
}
