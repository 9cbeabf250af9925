package com.purchasingpower.codegraph.knowledge;

import com.purchasingpower.codegraph.knowledge.DependencyAnalyzer.DependencyEdge;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("Dependency analysis")
class DependencyAnalyzerTest {

    private final GraphStore graphStore = mock(GraphStore.class);
    private final DependencyAnalyzer analyzer = new DependencyAnalyzer(graphStore);

    @Test
    @DisplayName("Should report strongly connected components and self-loops as cycles")
    void shouldFindCycles() {
        // Given
        List<DependencyEdge> edges = List.of(
                calls("a", "b"), calls("b", "c"), calls("c", "a"),
                calls("c", "d"),
                calls("e", "e"));

        // When
        List<List<String>> cycles = analyzer.findCycles(edges);

        // Then
        assertThat(cycles).containsExactlyInAnyOrder(List.of("a", "b", "c"), List.of("e"));
    }

    @Test
    @DisplayName("Should report no cycles for an acyclic graph")
    void shouldFindNoCycles() {
        assertThat(analyzer.findCycles(List.of(calls("a", "b"), calls("b", "c")))).isEmpty();
    }

    @Test
    @DisplayName("Should measure the longest outgoing chain without revisiting nodes")
    void shouldMeasureDepth() {
        // Given
        List<DependencyEdge> edges = List.of(
                calls("a", "b"), calls("b", "c"), calls("c", "a"),
                calls("a", "x"));

        // Then
        assertThat(analyzer.dependencyDepth(edges, "a")).isEqualTo(2);
        assertThat(analyzer.dependencyDepth(edges, "x")).isZero();
        assertThat(analyzer.dependencyDepth(edges, "missing")).isZero();
    }

    @Test
    @DisplayName("Should load edges from the graph store")
    void shouldLoadEdgesFromGraph() {
        // Given
        when(graphStore.execute(eq(DependencyAnalyzer.EDGE_QUERY), anyMap())).thenReturn(List.of(
                Map.of("source", "Sub", "target", "Base", "type", "INHERITS_FROM"),
                Map.of("source", "Base", "target", "Sub", "type", "CALLS")));

        // When
        List<List<String>> cycles = analyzer.findCycles();

        // Then
        assertThat(cycles).containsExactly(List.of("Base", "Sub"));
        assertThat(analyzer.dependencyDepth("Sub")).isEqualTo(1);
    }

    private static DependencyEdge calls(String source, String target) {
        return new DependencyEdge(source, target, "CALLS");
    }
}
