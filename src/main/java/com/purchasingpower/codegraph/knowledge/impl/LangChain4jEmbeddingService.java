package com.purchasingpower.codegraph.knowledge.impl;

import com.purchasingpower.codegraph.configuration.AppProperties;
import com.purchasingpower.codegraph.configuration.OllamaProperties;
import com.purchasingpower.codegraph.exception.CodeGraphException;
import com.purchasingpower.codegraph.knowledge.EmbeddingService;
import com.purchasingpower.codegraph.model.CallContext;
import com.purchasingpower.codegraph.model.ServiceType;
import com.purchasingpower.codegraph.util.ExternalCallLogger;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * LangChain4j-based embedding service backed by a local Ollama model.
 *
 * <p>Retries and timeouts are handled by {@link OllamaEmbeddingModel}.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class LangChain4jEmbeddingService implements EmbeddingService {

    private final EmbeddingModel embeddingModel;

    @Autowired
    public LangChain4jEmbeddingService(AppProperties props) {
        OllamaProperties ollama = props.getOllama();

        log.info("🔷 Initializing LangChain4j Embedding Service");
        log.info("   - Ollama URL: {}", ollama.getBaseUrl());
        log.info("   - Model: {}", ollama.getEmbeddingModel());
        log.info("   - Timeout: {}s", ollama.getTimeoutSeconds());
        log.info("   - Max Retries: {}", ollama.getMaxRetries());

        this.embeddingModel = OllamaEmbeddingModel.builder()
                .baseUrl(ollama.getBaseUrl())
                .modelName(ollama.getEmbeddingModel())
                .timeout(Duration.ofSeconds(ollama.getTimeoutSeconds()))
                .maxRetries(ollama.getMaxRetries())
                .logRequests(false)
                .logResponses(false)
                .build();

        log.info("✅ LangChain4j Embedding Service initialized");
    }

    LangChain4jEmbeddingService(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    @Override
    public List<Float> embed(String text) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("Text cannot be empty");
        }

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.OLLAMA, "embed", log);
        ctx.logRequest("Embedding text", "Length", text.length());
        try {
            Response<Embedding> response = embeddingModel.embed(text);
            List<Float> vector = response.content().vectorAsList();
            ctx.logResponse(vector.size() + " dimensions");
            return vector;
        } catch (Exception e) {
            ctx.logError("Embedding failed after retries: " + e.getMessage(), e);
            throw new CodeGraphException("Text embedding generation failed", e);
        }
    }

    @Override
    public List<List<Float>> embedAll(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.OLLAMA, "embedAll", log);
        ctx.logRequest("Embedding batch", "Texts", texts.size());
        try {
            List<TextSegment> segments = texts.stream()
                    .map(TextSegment::from)
                    .collect(Collectors.toList());
            Response<List<Embedding>> response = embeddingModel.embedAll(segments);
            List<List<Float>> vectors = response.content().stream()
                    .map(Embedding::vectorAsList)
                    .collect(Collectors.toList());
            ctx.logResponse(vectors.size() + " embeddings");
            return vectors;
        } catch (Exception e) {
            ctx.logError("Batch embedding failed after retries: " + e.getMessage(), e);
            throw new CodeGraphException("Batch embedding generation failed", e);
        }
    }
}
