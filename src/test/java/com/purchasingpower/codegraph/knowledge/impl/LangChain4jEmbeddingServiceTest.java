package com.purchasingpower.codegraph.knowledge.impl;

import com.purchasingpower.codegraph.exception.CodeGraphException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("LangChain4j embedding service")
class LangChain4jEmbeddingServiceTest {

    private EmbeddingModel embeddingModel;
    private LangChain4jEmbeddingService embeddingService;

    @BeforeEach
    void setUp() {
        embeddingModel = mock(EmbeddingModel.class);
        embeddingService = new LangChain4jEmbeddingService(embeddingModel);
    }

    @Test
    @DisplayName("Should embed a batch in input order")
    void shouldEmbedBatch() {
        // Given
        when(embeddingModel.embedAll(anyList())).thenReturn(Response.from(List.of(
                Embedding.from(new float[]{0.1f, 0.2f}),
                Embedding.from(new float[]{0.3f, 0.4f}))));

        // When
        List<List<Float>> vectors = embeddingService.embedAll(List.of("def a(): pass", "def b(): pass"));

        // Then
        assertThat(vectors).containsExactly(List.of(0.1f, 0.2f), List.of(0.3f, 0.4f));
    }

    @Test
    @DisplayName("Should skip the model for an empty batch")
    void shouldSkipEmptyBatch() {
        assertThat(embeddingService.embedAll(List.of())).isEmpty();
        verifyNoInteractions(embeddingModel);
    }

    @Test
    @DisplayName("Should wrap model failures")
    void shouldWrapFailures() {
        // Given
        when(embeddingModel.embed(anyString())).thenThrow(new RuntimeException("connection refused"));

        // When / Then
        assertThatThrownBy(() -> embeddingService.embed("query"))
                .isInstanceOf(CodeGraphException.class)
                .hasMessage("Text embedding generation failed")
                .hasRootCauseMessage("connection refused");
    }

    @Test
    @DisplayName("Should reject empty text")
    void shouldRejectEmptyText() {
        assertThatThrownBy(() -> embeddingService.embed(""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
