package com.purchasingpower.codegraph.search.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.codegraph.client.ReasoningService;
import com.purchasingpower.codegraph.config.GeminiConfig;
import com.purchasingpower.codegraph.configuration.AppProperties;
import com.purchasingpower.codegraph.exception.CodeGraphException;
import com.purchasingpower.codegraph.exception.EntityNotFoundException;
import com.purchasingpower.codegraph.knowledge.GraphStore;
import com.purchasingpower.codegraph.knowledge.RelationshipMappings;
import com.purchasingpower.codegraph.search.EntityRelationships;
import com.purchasingpower.codegraph.search.RankedEntity;
import com.purchasingpower.codegraph.search.ResolutionResult;
import com.purchasingpower.codegraph.service.PromptLibraryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("Entity resolver")
class EntityResolverImplTest {

    private static final List<Map<String, Object>> INVENTORY = List.of(
            Map.of("name", "UserService", "type", "Class"),
            Map.of("name", "save", "type", "Method"),
            Map.of("name", "helper", "type", "Function"));

    private GraphStore graphStore;
    private ReasoningService reasoningService;
    private EntityResolverImpl resolver;

    @BeforeEach
    void setUp() {
        graphStore = mock(GraphStore.class);
        reasoningService = mock(ReasoningService.class);
        PromptLibraryService promptLibrary = new PromptLibraryService();
        promptLibrary.loadPrompts();
        resolver = new EntityResolverImpl(graphStore, reasoningService, promptLibrary,
                new GeminiConfig(), new ObjectMapper(), new AppProperties());
    }

    @Test
    @DisplayName("Should verify ranked picks against the graph and expand the found ones")
    void shouldRankVerifyAndExpand() {
        // Given
        givenInventory(INVENTORY);
        givenRanking("""
                ```json
                [
                  {"entity_name": "UserService", "entity_type": "Class", "confidence": 0.92, "reason": "named in query"},
                  {"entity_name": "Ghost", "entity_type": "Class", "confidence": 0.4, "reason": "guess"}
                ]
                ```
                """);
        givenNode("UserService", "Class");
        when(graphStore.execute(eq(RelationshipMappings.EXPANSION_QUERY), eq(Map.of("name", "UserService"))))
                .thenReturn(List.of(Map.of(
                        "name", "UserService",
                        "type", "Class",
                        "dependents", List.of("UserController"),
                        "dependentCount", 1L,
                        "dependencies", List.of(),
                        "dependencyCount", 0L,
                        "parents", List.of("service.py"),
                        "parentCount", 1L)));

        // When
        ResolutionResult result = resolver.findTopEntities("How does UserService work?", 5);

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getEntities()).extracting(RankedEntity::getName).containsExactly("UserService", "Ghost");

        RankedEntity found = result.getFoundEntities().get(0);
        assertThat(found.getConfidence()).isEqualTo(0.92);
        assertThat(found.getRelationships().getDependents()).containsExactly("UserController");
        assertThat(found.getRelationships().getParentCount()).isEqualTo(1);

        RankedEntity missing = result.getEntities().get(1);
        assertThat(missing.isFound()).isFalse();
        assertThat(missing.getMessage()).isEqualTo(EntityResolverImpl.NOT_FOUND_MESSAGE);
    }

    @Test
    @DisplayName("Should rank with the JSON temperature and list the inventory in the prompt")
    void shouldUseJsonTemperature() {
        // Given
        givenInventory(INVENTORY);
        givenRanking("{\"entity_name\": \"helper\", \"entity_type\": \"Function\", \"confidence\": 0.8}");
        givenNode("helper", "Function");

        // When
        ResolutionResult result = resolver.findBestEntity("what does helper do");

        // Then
        ArgumentCaptor<String> userPrompt = ArgumentCaptor.forClass(String.class);
        verify(reasoningService).complete(anyString(), userPrompt.capture(), eq(0.1));
        assertThat(userPrompt.getValue()).contains("what does helper do").contains("UserService (Type: Class)");
        assertThat(result.getFoundEntities()).extracting(RankedEntity::getName).containsExactly("helper");
        assertThat(result.getFoundEntities().get(0).getRelationships().isIsolated()).isTrue();
    }

    @Test
    @DisplayName("Should degrade to an empty successful result when the reasoning service fails")
    void shouldDegradeWhenReasoningFails() {
        // Given
        givenInventory(INVENTORY);
        when(reasoningService.complete(anyString(), anyString(), anyDouble()))
                .thenThrow(new CodeGraphException("Gemini API error: 503"));

        // When
        ResolutionResult result = resolver.findTopEntities("anything", 5);

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getEntities()).isEmpty();
        assertThat(result.getMessage()).isEqualTo(EntityResolverImpl.UNAVAILABLE_MESSAGE);
    }

    @Test
    @DisplayName("Should report unparseable ranking output")
    void shouldReportUnparseableOutput() {
        // Given
        givenInventory(INVENTORY);
        givenRanking("I think the answer is UserService");

        // When
        ResolutionResult result = resolver.findTopEntities("anything", 5);

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.hasFoundEntities()).isFalse();
        assertThat(result.getMessage()).isEqualTo("Could not parse LLM response");
    }

    @Test
    @DisplayName("Should skip ranking when nothing is indexed")
    void shouldSkipRankingWithoutInventory() {
        // When
        ResolutionResult result = resolver.findTopEntities("anything", 5);

        // Then
        assertThat(result.getMessage()).isEqualTo("No entities indexed");
        verify(reasoningService, never()).complete(anyString(), anyString(), anyDouble());
    }

    @Test
    @DisplayName("Should drop duplicate picks and cap them at the limit")
    void shouldDedupeAndCap() {
        // Given
        givenInventory(INVENTORY);
        givenRanking("""
                [{"entity_name": "save"}, {"entity_name": "save"}, {"entity_name": "helper"}, {"entity_name": "UserService"}]
                """);

        // When
        ResolutionResult result = resolver.findTopEntities("anything", 2);

        // Then
        assertThat(result.getEntities()).extracting(RankedEntity::getName).containsExactly("save", "helper");
        assertThat(result.getMessage()).isEqualTo("None of the ranked entities exist in the graph");
    }

    @Test
    @DisplayName("Should expand a named entity directly")
    void shouldFindEntityByName() {
        // Given
        when(graphStore.execute(eq(RelationshipMappings.EXPANSION_QUERY), eq(Map.of("name", "save"))))
                .thenReturn(List.of(Map.of(
                        "name", "save",
                        "type", "Method",
                        "dependencies", List.of("validate", "flush"),
                        "dependencyCount", 2L)));

        // When
        EntityRelationships relationships = resolver.findEntity("save");

        // Then
        assertThat(relationships.getType()).isEqualTo("Method");
        assertThat(relationships.getDependencies()).containsExactly("validate", "flush");
        assertThat(relationships.getDependentCount()).isZero();
    }

    @Test
    @DisplayName("Should suggest similar names when a named entity does not exist")
    void shouldSuggestWhenNotFound() {
        // Given
        when(graphStore.execute(eq(EntityResolverImpl.SUGGESTION_QUERY), eq(Map.of("name", "UserServ"))))
                .thenReturn(List.of(Map.of("name", "UserService"), Map.of("name", "UserServiceTest")));

        // When / Then
        assertThatThrownBy(() -> resolver.findEntity("UserServ"))
                .isInstanceOf(EntityNotFoundException.class)
                .hasMessageContaining("UserServ")
                .satisfies(e -> assertThat(((EntityNotFoundException) e).getSuggestions())
                        .containsExactly("UserService", "UserServiceTest"));
    }

    private void givenInventory(List<Map<String, Object>> rows) {
        when(graphStore.execute(eq(EntityResolverImpl.INVENTORY_QUERY), anyMap())).thenReturn(rows);
    }

    private void givenRanking(String response) {
        when(reasoningService.complete(anyString(), anyString(), anyDouble())).thenReturn(response);
    }

    private void givenNode(String name, String type) {
        when(graphStore.execute(eq(EntityResolverImpl.VERIFY_QUERY), eq(Map.of("name", name))))
                .thenReturn(List.of(Map.of("type", type)));
    }
}
