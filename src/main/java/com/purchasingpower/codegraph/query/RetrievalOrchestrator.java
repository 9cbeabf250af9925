package com.purchasingpower.codegraph.query;

import com.purchasingpower.codegraph.configuration.AppProperties;
import com.purchasingpower.codegraph.configuration.RetrievalProperties;
import com.purchasingpower.codegraph.exception.AllSourcesFailedException;
import com.purchasingpower.codegraph.knowledge.ChunkMatch;
import com.purchasingpower.codegraph.knowledge.VectorStore;
import com.purchasingpower.codegraph.model.conversation.ConversationTurnView;
import com.purchasingpower.codegraph.search.EntityRelationships;
import com.purchasingpower.codegraph.search.EntityResolver;
import com.purchasingpower.codegraph.search.RankedEntity;
import com.purchasingpower.codegraph.search.ResolutionResult;
import com.purchasingpower.codegraph.service.ConversationStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Runs the structural and semantic lookups for a query in parallel, waits for all
 * of them, then picks the scenario from what came back.
 *
 * <p>Priority: multi-entity analysis, then direct entity, then semantic-only, then
 * conversation memory. Every outcome is a successful {@link RetrievalContext}.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class RetrievalOrchestrator {

    static final String MEMORY_MESSAGE = "No search results, using conversation memory as context";
    static final String NO_MEMORY_MESSAGE = "No search results and no memory context available";

    private static final String UNKNOWN_ENTITY = "unknown";

    private final EntityResolver entityResolver;
    private final VectorStore vectorStore;
    private final ConversationStore conversationStore;
    private final RetrievalProperties retrieval;
    private final Executor retrievalExecutor;

    public RetrievalOrchestrator(EntityResolver entityResolver,
                                 VectorStore vectorStore,
                                 ConversationStore conversationStore,
                                 AppProperties props,
                                 @Qualifier("retrievalExecutor") Executor retrievalExecutor) {
        this.entityResolver = entityResolver;
        this.vectorStore = vectorStore;
        this.conversationStore = conversationStore;
        this.retrieval = props.getRetrieval();
        this.retrievalExecutor = retrievalExecutor;
    }

    public RetrievalContext retrieve(String query, String entityName, String sessionId, String repoId) {
        log.info("🔎 Retrieving context for '{}' (entity: {}, session: {}, repo: {})", query, entityName, sessionId, repoId);
        long startTime = System.currentTimeMillis();

        CompletableFuture<BranchResult<ResolutionResult>> multi = dispatch("Multi-entity lookup",
                () -> entityResolver.findTopEntities(query, retrieval.getEntityLimit()));

        CompletableFuture<BranchResult<List<ChunkMatch>>> semantic = dispatch("Semantic search",
                () -> rerank(vectorStore.search(query, namespaceOf(repoId), retrieval.getTopK())));

        CompletableFuture<BranchResult<EntityRelationships>> direct = isDirectLookup(entityName)
                ? dispatch("Direct lookup", () -> entityResolver.findEntity(entityName.trim()))
                : CompletableFuture.completedFuture(BranchResult.<EntityRelationships>skipped());

        CompletableFuture.allOf(multi, semantic, direct).join();

        RetrievalContext context;
        try {
            context = classify(query, multi.join(), semantic.join(), direct.join());
        } catch (AllSourcesFailedException e) {
            log.info("⚠️ {}", e.getMessage());
            context = memoryFallback(query, sessionId, multi.join(), semantic.join(), direct.join());
        }

        log.info("✅ Retrieval finished in {}ms: scenario={}, entities={}, chunks={}, turns={}",
                System.currentTimeMillis() - startTime, context.getScenario().getTag(),
                context.getEntities().size(), context.getChunks().size(), context.getConversationTurns().size());
        return context;
    }

    /**
     * Runs one branch on the retrieval executor. A failure, including a rejected
     * submission, becomes a failed branch rather than an exception.
     */
    private <T> CompletableFuture<BranchResult<T>> dispatch(String branch, Supplier<T> lookup) {
        try {
            return CompletableFuture
                    .supplyAsync(() -> BranchResult.of(lookup.get()), retrievalExecutor)
                    .exceptionally(e -> BranchResult.failed(branch + " failed: " + causeOf(e)));
        } catch (RejectedExecutionException e) {
            log.warn("⚠️ {} rejected by retrieval executor: {}", branch, e.getMessage());
            return CompletableFuture.completedFuture(BranchResult.failed(branch + " failed: " + e.getMessage()));
        }
    }

    private RetrievalContext classify(String query,
                                      BranchResult<ResolutionResult> multi,
                                      BranchResult<List<ChunkMatch>> semantic,
                                      BranchResult<EntityRelationships> direct) {
        List<ChunkMatch> chunks = semantic.isPresent() ? semantic.value() : List.of();

        if (multi.isPresent() && multi.value().hasFoundEntities()) {
            Map<String, EntityRelationships> entities = new LinkedHashMap<>();
            for (RankedEntity ranked : multi.value().getFoundEntities()) {
                EntityRelationships relationships = ranked.getRelationships() != null
                        ? ranked.getRelationships()
                        : EntityRelationships.isolated(ranked.getName(), ranked.getType());
                entities.putIfAbsent(ranked.getName(), relationships);
            }
            if (direct.isPresent()) {
                entities.putIfAbsent(direct.value().getName(), direct.value());
            }
            return base(query, RetrievalScenario.MULTI_ENTITY_ANALYSIS, multi, semantic, direct)
                    .message("Found " + entities.size() + " relevant entities")
                    .entities(entities.values())
                    .chunks(chunks)
                    .build();
        }

        if (direct.isPresent()) {
            return base(query, RetrievalScenario.DIRECT_ENTITY, multi, semantic, direct)
                    .message("Found entity " + direct.value().getName())
                    .entity(direct.value())
                    .chunks(chunks)
                    .build();
        }

        if (!chunks.isEmpty()) {
            return base(query, RetrievalScenario.PINECONE_ONLY, multi, semantic, direct)
                    .message("Found " + chunks.size() + " code chunks via semantic search")
                    .chunks(chunks)
                    .build();
        }

        throw new AllSourcesFailedException(query);
    }

    private RetrievalContext memoryFallback(String query,
                                            String sessionId,
                                            BranchResult<ResolutionResult> multi,
                                            BranchResult<List<ChunkMatch>> semantic,
                                            BranchResult<EntityRelationships> direct) {
        List<ConversationTurnView> turns;
        try {
            turns = conversationStore.getRecentTurns(sessionId, retrieval.getMemoryTurns());
        } catch (RuntimeException e) {
            log.warn("⚠️ Could not load conversation memory for {}: {}", sessionId, e.getMessage());
            turns = List.of();
        }
        return base(query, RetrievalScenario.MEMORY_FALLBACK, multi, semantic, direct)
                .message(turns.isEmpty() ? NO_MEMORY_MESSAGE : MEMORY_MESSAGE)
                .conversationTurns(turns)
                .build();
    }

    private RetrievalContext.RetrievalContextBuilder base(String query,
                                                          RetrievalScenario scenario,
                                                          BranchResult<?>... branches) {
        RetrievalContext.RetrievalContextBuilder builder = RetrievalContext.builder()
                .query(query)
                .scenario(scenario)
                .success(true);
        for (BranchResult<?> branch : branches) {
            if (branch.error() != null) {
                builder.warning(branch.error());
            } else if (branch.value() instanceof ResolutionResult ranking
                    && !ranking.hasFoundEntities() && ranking.getMessage() != null) {
                builder.warning(ranking.getMessage());
            }
        }
        return builder;
    }

    /**
     * Drops hits below the configured minimum score and orders the rest best first.
     */
    List<ChunkMatch> rerank(List<ChunkMatch> matches) {
        return matches.stream()
                .filter(m -> m.getScore() >= retrieval.getMinScore())
                .sorted(Comparator.comparingDouble(ChunkMatch::getScore).reversed())
                .toList();
    }

    static boolean isDirectLookup(String entityName) {
        return entityName != null && !entityName.isBlank() && !UNKNOWN_ENTITY.equalsIgnoreCase(entityName.trim());
    }

    private static String namespaceOf(String repoId) {
        return repoId == null ? "" : repoId;
    }

    private static String causeOf(Throwable e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        return cause.getMessage();
    }

    private record BranchResult<T>(T value, String error) {

        static <T> BranchResult<T> of(T value) {
            return new BranchResult<>(value, null);
        }

        static <T> BranchResult<T> failed(String error) {
            return new BranchResult<>(null, error);
        }

        static <T> BranchResult<T> skipped() {
            return new BranchResult<>(null, null);
        }

        boolean isPresent() {
            return value != null;
        }
    }
}
