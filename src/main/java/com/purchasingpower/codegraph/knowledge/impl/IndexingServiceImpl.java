package com.purchasingpower.codegraph.knowledge.impl;

import com.purchasingpower.codegraph.configuration.AppProperties;
import com.purchasingpower.codegraph.configuration.IndexingProperties;
import com.purchasingpower.codegraph.core.CodeChunk;
import com.purchasingpower.codegraph.exception.FileParsingException;
import com.purchasingpower.codegraph.exception.RepositoryDownloadException;
import com.purchasingpower.codegraph.knowledge.CodeChunker;
import com.purchasingpower.codegraph.knowledge.EmbeddingIndexer;
import com.purchasingpower.codegraph.knowledge.EmbeddingRun;
import com.purchasingpower.codegraph.knowledge.GraphStatistics;
import com.purchasingpower.codegraph.knowledge.GraphStore;
import com.purchasingpower.codegraph.knowledge.GraphUpsertEngine;
import com.purchasingpower.codegraph.knowledge.IndexingResult;
import com.purchasingpower.codegraph.knowledge.IndexingRunContext;
import com.purchasingpower.codegraph.knowledge.IndexingService;
import com.purchasingpower.codegraph.knowledge.IndexingState;
import com.purchasingpower.codegraph.knowledge.IndexingStatus;
import com.purchasingpower.codegraph.knowledge.VectorStore;
import com.purchasingpower.codegraph.parser.ParsedBatch;
import com.purchasingpower.codegraph.parser.SourceFile;
import com.purchasingpower.codegraph.parser.SourceParserRegistry;
import com.purchasingpower.codegraph.service.RepositorySource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Orchestrates repository indexing: download, parse, graph upsert, chunk and embed.
 *
 * <p>Runs file by file on one thread. Per-file and per-write failures are counted;
 * a run fails only when the repository cannot be downloaded or has no parseable files.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class IndexingServiceImpl implements IndexingService {

    private final RepositorySource repositorySource;
    private final SourceParserRegistry parserRegistry;
    private final GraphUpsertEngine upsertEngine;
    private final CodeChunker chunker;
    private final EmbeddingIndexer embeddingIndexer;
    private final GraphStore graphStore;
    private final VectorStore vectorStore;
    private final IndexingProperties indexing;

    private final Map<String, IndexingStatus> statuses = new ConcurrentHashMap<>();

    public IndexingServiceImpl(RepositorySource repositorySource,
                               SourceParserRegistry parserRegistry,
                               GraphUpsertEngine upsertEngine,
                               CodeChunker chunker,
                               EmbeddingIndexer embeddingIndexer,
                               GraphStore graphStore,
                               VectorStore vectorStore,
                               AppProperties props) {
        this.repositorySource = repositorySource;
        this.parserRegistry = parserRegistry;
        this.upsertEngine = upsertEngine;
        this.chunker = chunker;
        this.embeddingIndexer = embeddingIndexer;
        this.graphStore = graphStore;
        this.vectorStore = vectorStore;
        this.indexing = props.getIndexing();
    }

    @Override
    public IndexingStatus accept(String repoUrl, String repoId) {
        IndexingStatus status = IndexingStatus.builder()
                .repositoryId(repoId)
                .state(IndexingState.PENDING)
                .currentStep("Queued " + repoUrl)
                .startedAt(System.currentTimeMillis())
                .build();
        statuses.put(repoId, status);
        return status;
    }

    @Override
    @Async("indexingExecutor")
    public CompletableFuture<IndexingResult> indexRepositoryAsync(String repoUrl, String repoId) {
        return CompletableFuture.completedFuture(indexRepository(repoUrl, repoId));
    }

    @Override
    public IndexingResult indexRepository(String repoUrl, String repoId) {
        long startTime = System.currentTimeMillis();
        log.info("🚀 Starting indexing for repository: {} ({})", repoId, repoUrl);
        updateStatus(repoId, IndexingState.RUNNING, "Downloading repository", null);

        Path root = null;
        try {
            root = repositorySource.download(repoUrl);

            updateStatus(repoId, IndexingState.RUNNING, "Parsing source files", null);
            List<SourceFile> sourceFiles = new ArrayList<>();
            List<FileParsingException> readFailures = new ArrayList<>();
            int skipped = collectSourceFiles(root, sourceFiles, readFailures);

            ParsedBatch batch = parserRegistry.parseAll(sourceFiles);
            int parsingErrors = batch.getParsingErrorCount() + readFailures.size();

            if (batch.getExtractions().isEmpty()) {
                String error = "No parseable source files found in " + repoUrl;
                log.error("❌ {}", error);
                IndexingResult failed = IndexingResult.builder()
                        .repositoryId(repoId)
                        .success(false)
                        .filesSkipped(skipped)
                        .parsingErrors(parsingErrors)
                        .graphStatistics(GraphStatistics.empty())
                        .durationMs(System.currentTimeMillis() - startTime)
                        .error(error)
                        .build();
                updateStatus(repoId, IndexingState.FAILED, error, failed);
                return failed;
            }

            updateStatus(repoId, IndexingState.RUNNING, "Writing graph", null);
            IndexingRunContext context = new IndexingRunContext(repoId, batch.getExtractions());
            upsertEngine.upsert(context);

            IndexingResult.IndexingResultBuilder result = IndexingResult.builder()
                    .repositoryId(repoId)
                    .success(true)
                    .filesProcessed(batch.getExtractions().size())
                    .filesSkipped(skipped)
                    .parsingErrors(parsingErrors)
                    .packagesCreated(context.getPackagesCreated())
                    .entitiesCreated(context.getEntitiesCreated())
                    .relationshipsCreated(context.getRelationshipsCreated())
                    .entityErrors(context.getEntityErrors())
                    .relationshipErrors(context.getRelationshipErrors())
                    .errors(context.getErrors());
            batch.getFailures().forEach(f -> result.error(f.getMessage()));
            readFailures.forEach(f -> result.error(f.getMessage()));

            updateStatus(repoId, IndexingState.RUNNING, "Indexing embeddings", null);
            EmbeddingRun embeddingRun = indexEmbeddings(repoId, context, result);
            result.chunksIndexed(embeddingRun.getVectorsWritten())
                    .embeddingBatchErrors(embeddingRun.getFailedBatches());
            result.graphStatistics(readStatistics());

            IndexingResult finished = result.durationMs(System.currentTimeMillis() - startTime).build();
            updateStatus(repoId, IndexingState.COMPLETED, "Indexing completed", finished);
            log.info("✅ Indexing completed for {}: {} files, {} entities, {} relationships, {} chunks in {}ms",
                    repoId, finished.getFilesProcessed(), finished.getEntitiesCreated(),
                    finished.getRelationshipsCreated(), finished.getChunksIndexed(), finished.getDurationMs());
            return finished;

        } catch (RepositoryDownloadException e) {
            log.error("❌ Indexing failed for repository {}: {}", repoId, e.getMessage(), e);
            IndexingResult failed = IndexingResult.failure(repoId, e.getMessage(), System.currentTimeMillis() - startTime);
            updateStatus(repoId, IndexingState.FAILED, "Failed: " + e.getMessage(), failed);
            return failed;
        } catch (RuntimeException e) {
            // unreadable workspace or a store outage outside the per-item guards
            log.error("❌ Unexpected indexing failure for {}: {}", repoId, e.getMessage(), e);
            IndexingResult failed = IndexingResult.failure(repoId, e.getMessage(), System.currentTimeMillis() - startTime);
            updateStatus(repoId, IndexingState.FAILED, "Failed: " + e.getMessage(), failed);
            return failed;
        } finally {
            repositorySource.cleanup(root);
        }
    }

    private int collectSourceFiles(Path root, List<SourceFile> sourceFiles, List<FileParsingException> readFailures) {
        int skipped = 0;
        for (Path path : repositorySource.listSourceFiles(root)) {
            String relative = root.relativize(path).toString().replace('\\', '/');
            if (isTestFile(relative) || !parserRegistry.isSupported(relative)) {
                skipped++;
                continue;
            }
            try {
                sourceFiles.add(new SourceFile(relative, repositorySource.read(path)));
            } catch (RuntimeException e) {
                log.warn("⚠️ Could not read {}: {}", relative, e.getMessage());
                readFailures.add(new FileParsingException(relative, e));
            }
        }
        log.info("📁 Found {} source files ({} skipped)", sourceFiles.size() + readFailures.size(), skipped);
        return skipped;
    }

    boolean isTestFile(String relativePath) {
        String path = "/" + relativePath;
        return indexing.getTestPathMarkers().stream().anyMatch(path::contains);
    }

    private EmbeddingRun indexEmbeddings(String repoId, IndexingRunContext context, IndexingResult.IndexingResultBuilder result) {
        try {
            List<CodeChunk> chunks = chunker.chunkAll(repoId, context.getExtractions());
            return embeddingIndexer.index(chunks, repoId);
        } catch (RuntimeException e) {
            log.error("❌ Embedding indexing failed for {}: {}", repoId, e.getMessage(), e);
            result.error("Embedding indexing failed: " + e.getMessage());
            return EmbeddingRun.empty();
        }
    }

    private GraphStatistics readStatistics() {
        try {
            return graphStore.getStatistics();
        } catch (RuntimeException e) {
            log.warn("⚠️ Could not read graph statistics: {}", e.getMessage());
            return GraphStatistics.empty();
        }
    }

    @Override
    public IndexingStatus getStatus(String repoId) {
        return statuses.getOrDefault(repoId, IndexingStatus.notStarted(repoId));
    }

    @Override
    public void clearIndex(String repoId) {
        log.info("🧹 Clearing graph and vector namespace '{}'", repoId);
        graphStore.clearAll();
        vectorStore.delete(repoId);
        statuses.remove(repoId);
    }

    @Override
    public GraphStatistics getStatistics() {
        return graphStore.getStatistics();
    }

    private void updateStatus(String repoId, IndexingState state, String step, IndexingResult result) {
        IndexingStatus previous = statuses.get(repoId);
        boolean inFlight = previous != null
                && (previous.getState() == IndexingState.PENDING || previous.getState() == IndexingState.RUNNING);
        long startedAt = inFlight ? previous.getStartedAt() : System.currentTimeMillis();
        boolean finished = state == IndexingState.COMPLETED || state == IndexingState.FAILED;

        statuses.put(repoId, IndexingStatus.builder()
                .repositoryId(repoId)
                .state(state)
                .currentStep(step)
                .startedAt(startedAt)
                .finishedAt(finished ? System.currentTimeMillis() : 0)
                .result(result)
                .build());
        log.debug("Indexing status: {} - {} ({})", repoId, step, state);
    }
}
