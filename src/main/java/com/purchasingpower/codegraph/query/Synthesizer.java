package com.purchasingpower.codegraph.query;

import com.purchasingpower.codegraph.client.ReasoningService;
import com.purchasingpower.codegraph.knowledge.ChunkMatch;
import com.purchasingpower.codegraph.model.conversation.ConversationTurnView;
import com.purchasingpower.codegraph.search.EntityRelationships;
import com.purchasingpower.codegraph.service.PromptLibraryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Turns a {@link RetrievalContext} into an answer.
 *
 * <p>The formatted context is always a usable answer on its own: it is returned
 * as-is when the reasoning call fails or comes back blank.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class Synthesizer {

    static final String EMPTY_CONTEXT_ANSWER = "I could not find anything relevant in the indexed code. "
            + "Try naming a specific class, function or module, or index the repository first.";

    static final String ISOLATED_LABEL = "no relationships found - entity may be isolated";

    private static final String PROMPT = "synthesis";
    private static final int MAX_CHUNKS = 5;
    private static final int MAX_ENTITIES = 5;
    private static final int MAX_NAMES = 3;
    private static final int PREVIEW_CHARS = 300;
    private static final int DOCSTRING_CHARS = 200;

    private final ReasoningService reasoningService;
    private final PromptLibraryService promptLibrary;

    public String synthesize(String query, RetrievalContext context) {
        if (context == null || context.isEmpty()) {
            log.info("📭 Empty retrieval context, returning guidance");
            return EMPTY_CONTEXT_ANSWER;
        }

        String formatted = formatContext(context);
        try {
            Map<String, Object> variables = Map.of(
                    "query", query,
                    "context", formatted,
                    "source", sourceOf(context));
            String answer = reasoningService.complete(
                    promptLibrary.renderSystem(PROMPT, variables),
                    promptLibrary.renderUser(PROMPT, variables),
                    promptLibrary.temperatureOf(PROMPT));
            if (answer == null || answer.isBlank()) {
                log.warn("⚠️ Reasoning service returned a blank answer, using formatted context");
                return formatted;
            }
            return answer;
        } catch (RuntimeException e) {
            log.warn("⚠️ Synthesis failed, using formatted context: {}", e.getMessage());
            return formatted;
        }
    }

    public String formatContext(RetrievalContext context) {
        StringBuilder out = new StringBuilder();

        List<ChunkMatch> chunks = context.getChunks();
        if (!chunks.isEmpty()) {
            out.append("CODE CHUNKS (semantic search - WHAT the code does):\n");
            int i = 1;
            for (ChunkMatch chunk : chunks.subList(0, Math.min(MAX_CHUNKS, chunks.size()))) {
                out.append('\n').append(i++).append(". File: ").append(chunk.getFilePath()).append('\n');
                out.append("   Lines: ").append(chunk.getStartLine()).append('-').append(chunk.getEndLine()).append('\n');
                out.append("   Relevance: ").append(chunk.getRelevancePercent()).append("%\n");
                out.append("   Preview: ").append(truncate(chunk.getContentPreview(), PREVIEW_CHARS)).append('\n');
            }
        }

        List<EntityRelationships> entities = context.getEntities();
        if (!entities.isEmpty()) {
            if (out.length() > 0) {
                out.append('\n');
            }
            out.append("CODE RELATIONSHIPS (graph - WHERE/HOW code is used):\n");
            int i = 1;
            for (EntityRelationships entity : entities.subList(0, Math.min(MAX_ENTITIES, entities.size()))) {
                out.append('\n').append(i++).append(". ")
                        .append(entity.getType() == null ? "Entity" : entity.getType())
                        .append(": ").append(entity.getName()).append('\n');
                if (entity.isIsolated()) {
                    out.append("   (").append(ISOLATED_LABEL).append(")\n");
                } else {
                    appendNames(out, "Dependencies", entity.getDependencies(), entity.getDependencyCount());
                    appendNames(out, "Used by", entity.getDependents(), entity.getDependentCount());
                    appendNames(out, "Parents", entity.getParents(), entity.getParentCount());
                }
                if (entity.getDocstring() != null && !entity.getDocstring().isBlank()) {
                    out.append("   Documentation: ").append(truncate(entity.getDocstring(), DOCSTRING_CHARS)).append('\n');
                }
            }
        }

        List<ConversationTurnView> turns = context.getConversationTurns();
        if (!turns.isEmpty()) {
            if (out.length() > 0) {
                out.append('\n');
            }
            out.append("CONVERSATION (earlier turns):\n");
            for (ConversationTurnView turn : turns) {
                out.append("- ").append(turn.role()).append(": ").append(turn.content()).append('\n');
            }
        }
        return out.toString().trim();
    }

    private static void appendNames(StringBuilder out, String label, List<String> names, int count) {
        if (count == 0 && names.isEmpty()) {
            return;
        }
        out.append("   ").append(label).append(": ")
                .append(String.join(", ", names.subList(0, Math.min(MAX_NAMES, names.size()))))
                .append(" (").append(Math.max(count, names.size())).append(" total)\n");
    }

    private static String sourceOf(RetrievalContext context) {
        if (!context.getEntities().isEmpty() && !context.getChunks().isEmpty()) {
            return "Embeddings + Graph";
        }
        if (!context.getEntities().isEmpty()) {
            return "Graph";
        }
        if (!context.getChunks().isEmpty()) {
            return "Embeddings";
        }
        return "Conversation memory";
    }

    private static String truncate(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() <= max ? text : text.substring(0, max) + "...";
    }
}
