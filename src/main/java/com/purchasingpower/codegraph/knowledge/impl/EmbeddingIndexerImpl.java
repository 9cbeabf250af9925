package com.purchasingpower.codegraph.knowledge.impl;

import com.purchasingpower.codegraph.configuration.AppProperties;
import com.purchasingpower.codegraph.configuration.IndexingProperties;
import com.purchasingpower.codegraph.core.CodeChunk;
import com.purchasingpower.codegraph.knowledge.ChunkVector;
import com.purchasingpower.codegraph.knowledge.EmbeddingIndexer;
import com.purchasingpower.codegraph.knowledge.EmbeddingRun;
import com.purchasingpower.codegraph.knowledge.EmbeddingService;
import com.purchasingpower.codegraph.knowledge.VectorStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Embeds chunks in batches and upserts each batch's vectors before embedding the next.
 *
 * <p>Chunk text is truncated before embedding and blank chunks are skipped.
 * A failed embed or upsert is counted and skipped; the remaining batches continue.
 */
@Slf4j
@Service
public class EmbeddingIndexerImpl implements EmbeddingIndexer {

    private final EmbeddingService embeddingService;
    private final VectorStore vectorStore;
    private final IndexingProperties indexing;

    public EmbeddingIndexerImpl(EmbeddingService embeddingService, VectorStore vectorStore, AppProperties props) {
        this.embeddingService = embeddingService;
        this.vectorStore = vectorStore;
        this.indexing = props.getIndexing();
    }

    @Override
    public EmbeddingRun index(List<CodeChunk> chunks, String namespace) {
        log.info("🧬 Generating embeddings for {} chunks...", chunks.size());
        int batchSize = indexing.getEmbedBatchSize();
        int upserted = 0;
        int failedBatches = 0;

        for (int i = 0; i < chunks.size(); i += batchSize) {
            int batchNumber = i / batchSize + 1;
            List<CodeChunk> batch = chunks.subList(i, Math.min(i + batchSize, chunks.size()));

            List<CodeChunk> embeddable = new ArrayList<>();
            List<String> texts = new ArrayList<>();
            for (CodeChunk chunk : batch) {
                String text = truncate(chunk.getContent()).strip();
                if (!text.isEmpty()) {
                    embeddable.add(chunk);
                    texts.add(text);
                }
            }
            if (texts.isEmpty()) {
                log.warn("⚠️ Batch {}: all chunks empty, skipping", batchNumber);
                continue;
            }

            List<List<Float>> embeddings;
            try {
                embeddings = embeddingService.embedAll(texts);
            } catch (RuntimeException e) {
                log.error("❌ Failed to generate embeddings for batch {}: {}", batchNumber, e.getMessage());
                failedBatches++;
                continue;
            }
            if (embeddings.size() != embeddable.size()) {
                log.error("❌ Batch {}: expected {} embeddings, got {}", batchNumber, embeddable.size(), embeddings.size());
                failedBatches++;
                continue;
            }

            List<ChunkVector> vectors = new ArrayList<>(embeddable.size());
            for (int j = 0; j < embeddable.size(); j++) {
                CodeChunk chunk = embeddable.get(j);
                vectors.add(ChunkVector.builder()
                        .id(chunk.getChunkId())
                        .values(embeddings.get(j))
                        .metadata(chunk.toMetadata(indexing.getPreviewChars()))
                        .build());
            }

            int upsertBatch = indexing.getUpsertBatchSize();
            for (int k = 0; k < vectors.size(); k += upsertBatch) {
                List<ChunkVector> slice = vectors.subList(k, Math.min(k + upsertBatch, vectors.size()));
                try {
                    vectorStore.upsert(slice, namespace);
                    upserted += slice.size();
                } catch (RuntimeException e) {
                    log.error("❌ Failed to upsert {} vectors from batch {}: {}", slice.size(), batchNumber, e.getMessage());
                    failedBatches++;
                }
            }
            log.debug("  ✓ Batch {}: {} embeddings generated", batchNumber, embeddings.size());
        }

        log.info("✅ Indexed {} of {} chunks into namespace '{}' ({} failed batches)",
                upserted, chunks.size(), namespace, failedBatches);
        return new EmbeddingRun(upserted, failedBatches);
    }

    private String truncate(String content) {
        if (content == null) {
            return "";
        }
        int max = indexing.getMaxEmbedChars();
        return content.length() <= max ? content : content.substring(0, max);
    }
}
