package com.purchasingpower.codegraph.service;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Prompt library")
class PromptLibraryServiceTest {

    private static PromptLibraryService promptLibrary;

    @BeforeAll
    static void loadPrompts() {
        promptLibrary = new PromptLibraryService();
        promptLibrary.loadPrompts();
    }

    @Test
    @DisplayName("Should load every bundled template")
    void shouldLoadTemplates() {
        assertThat(promptLibrary.getTemplate("synthesis").getTemperature()).isEqualTo(0.2);
        assertThat(promptLibrary.getTemplate("entity-ranking")).isNotNull();
        assertThat(promptLibrary.getTemplate("entity-ranking-top-k")).isNotNull();
    }

    @Test
    @DisplayName("Should render code without HTML escaping")
    void shouldRenderUnescaped() {
        // When
        String user = promptLibrary.renderUser("synthesis", Map.of(
                "query", "Why does List<String> fail?",
                "context", "if (a && b) { return \"x\"; }",
                "source", "Graph"));

        // Then
        assertThat(user)
                .contains("Why does List<String> fail?")
                .contains("if (a && b) { return \"x\"; }");
    }

    @Test
    @DisplayName("Should render the entity inventory as a list")
    void shouldRenderInventory() {
        // When
        String user = promptLibrary.renderUser("entity-ranking-top-k", Map.of(
                "query", "saving",
                "limit", 3,
                "entities", List.of(
                        Map.of("name", "Repository", "type", "Class"),
                        Map.of("name", "save", "type", "Method"))));

        // Then
        assertThat(user)
                .contains("- Repository (Type: Class)")
                .contains("- save (Type: Method)")
                .contains("3");
    }

    @Test
    @DisplayName("Should reject unknown templates")
    void shouldRejectUnknownTemplate() {
        assertThatThrownBy(() -> promptLibrary.getTemplate("missing"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("missing");
    }
}
