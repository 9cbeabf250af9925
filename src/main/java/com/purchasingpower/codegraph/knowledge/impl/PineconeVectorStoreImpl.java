package com.purchasingpower.codegraph.knowledge.impl;

import com.google.common.base.Strings;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.protobuf.Struct;
import com.google.protobuf.Value;
import com.purchasingpower.codegraph.configuration.AppProperties;
import com.purchasingpower.codegraph.exception.CodeGraphException;
import com.purchasingpower.codegraph.knowledge.ChunkMatch;
import com.purchasingpower.codegraph.knowledge.ChunkVector;
import com.purchasingpower.codegraph.knowledge.EmbeddingService;
import com.purchasingpower.codegraph.knowledge.VectorStore;
import com.purchasingpower.codegraph.model.CallContext;
import com.purchasingpower.codegraph.model.ServiceType;
import com.purchasingpower.codegraph.util.ExternalCallLogger;
import io.pinecone.clients.Pinecone;
import io.pinecone.unsigned_indices_model.QueryResponseWithUnsignedIndices;
import io.pinecone.unsigned_indices_model.ScoredVectorWithUnsignedIndices;
import io.pinecone.unsigned_indices_model.VectorWithUnsignedIndices;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Pinecone-backed vector store. One namespace per repository.
 *
 * <p>The client is created on first use so the application starts without an API key.
 */
@Slf4j
@Service
public class PineconeVectorStoreImpl implements VectorStore {

    private final EmbeddingService embeddingService;
    private final String indexName;
    private final Supplier<Pinecone> client;

    public PineconeVectorStoreImpl(EmbeddingService embeddingService, AppProperties props) {
        this.embeddingService = embeddingService;
        this.indexName = props.getPinecone().getIndexName();
        String apiKey = props.getPinecone().getApiKey();
        this.client = Suppliers.memoize(() -> {
            if (Strings.isNullOrEmpty(apiKey)) {
                throw new CodeGraphException("Pinecone API key is not configured (app.pinecone.api-key)");
            }
            return new Pinecone.Builder(apiKey).build();
        });
    }

    @Override
    public List<ChunkMatch> search(String queryText, String namespace, int topK) {
        List<Float> vector = embeddingService.embed(queryText);

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.PINECONE, "query", log);
        ctx.logRequest(ExternalCallLogger.truncate(queryText, 100), "Namespace", namespace, "TopK", topK);
        try {
            QueryResponseWithUnsignedIndices response = client.get().getIndexConnection(indexName)
                    .query(topK, vector, null, null, null, namespace, null, false, true);

            if (response.getMatchesList() == null || response.getMatchesList().isEmpty()) {
                ctx.logResponse("No matches");
                return List.of();
            }

            List<ChunkMatch> matches = response.getMatchesList().stream()
                    .map(this::toChunkMatch)
                    .collect(Collectors.toList());
            ctx.logResponse(matches.size() + " matches");
            return matches;
        } catch (Exception e) {
            ctx.logError(e.getMessage(), e);
            throw new CodeGraphException("Pinecone query failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void upsert(List<ChunkVector> vectors, String namespace) {
        if (vectors.isEmpty()) {
            return;
        }
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.PINECONE, "upsert", log);
        ctx.logRequest(vectors.size() + " vectors", "Namespace", namespace);
        try {
            List<VectorWithUnsignedIndices> batch = vectors.stream()
                    .map(this::toPineconeVector)
                    .collect(Collectors.toList());
            client.get().getIndexConnection(indexName).upsert(batch, namespace);
            ctx.logResponse("Upserted " + batch.size());
        } catch (Exception e) {
            ctx.logError(e.getMessage(), e);
            throw new CodeGraphException("Pinecone upsert failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void delete(String namespace) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.PINECONE, "deleteAll", log);
        ctx.logRequest("Delete namespace", "Namespace", namespace);
        try {
            client.get().getIndexConnection(indexName).deleteAll(namespace);
            ctx.logResponse("Namespace cleared");
        } catch (Exception e) {
            ctx.logError(e.getMessage(), e);
            throw new CodeGraphException("Pinecone delete failed: " + e.getMessage(), e);
        }
    }

    private VectorWithUnsignedIndices toPineconeVector(ChunkVector vector) {
        Struct.Builder metadata = Struct.newBuilder();
        for (Map.Entry<String, String> entry : vector.getMetadata().entrySet()) {
            if (entry.getValue() != null) {
                metadata.putFields(entry.getKey(), Value.newBuilder().setStringValue(entry.getValue()).build());
            }
        }
        return new VectorWithUnsignedIndices(vector.getId(), vector.getValues(), metadata.build(), null);
    }

    private ChunkMatch toChunkMatch(ScoredVectorWithUnsignedIndices match) {
        Map<String, Value> fields = match.getMetadata() != null ? match.getMetadata().getFieldsMap() : Map.of();
        return ChunkMatch.builder()
                .chunkId(match.getId())
                .score(match.getScore())
                .filePath(stringField(fields, "file_path"))
                .fileName(stringField(fields, "file_name"))
                .language(stringField(fields, "language"))
                .startLine(intField(fields, "start_line"))
                .endLine(intField(fields, "end_line"))
                .contentPreview(stringField(fields, "content_preview"))
                .build();
    }

    private static String stringField(Map<String, Value> fields, String key) {
        Value value = fields.get(key);
        return value == null ? "" : value.getStringValue();
    }

    private static int intField(Map<String, Value> fields, String key) {
        Value value = fields.get(key);
        if (value == null) {
            return 0;
        }
        if (value.hasNumberValue()) {
            return (int) value.getNumberValue();
        }
        try {
            return Integer.parseInt(value.getStringValue());
        } catch (NumberFormatException e) {
            log.debug("Non-numeric {} in vector metadata: {}", key, value.getStringValue());
            return 0;
        }
    }
}
