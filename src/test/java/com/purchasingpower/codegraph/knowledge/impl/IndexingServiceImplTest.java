package com.purchasingpower.codegraph.knowledge.impl;

import com.purchasingpower.codegraph.configuration.AppProperties;
import com.purchasingpower.codegraph.core.RelationshipKind;
import com.purchasingpower.codegraph.knowledge.CodeChunker;
import com.purchasingpower.codegraph.knowledge.EmbeddingIndexer;
import com.purchasingpower.codegraph.knowledge.EmbeddingRun;
import com.purchasingpower.codegraph.knowledge.GraphUpsertEngine;
import com.purchasingpower.codegraph.knowledge.InMemoryGraphStore;
import com.purchasingpower.codegraph.knowledge.IndexingResult;
import com.purchasingpower.codegraph.knowledge.IndexingState;
import com.purchasingpower.codegraph.knowledge.IndexingStatus;
import com.purchasingpower.codegraph.knowledge.RelationshipInferencer;
import com.purchasingpower.codegraph.knowledge.VectorStore;
import com.purchasingpower.codegraph.parser.JavaSourceParser;
import com.purchasingpower.codegraph.parser.PythonSourceParser;
import com.purchasingpower.codegraph.parser.SourceParserRegistry;
import com.purchasingpower.codegraph.service.impl.GitRepositorySource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("Indexing service")
class IndexingServiceImplTest {

    @TempDir
    Path repo;

    @TempDir
    Path workspace;

    private InMemoryGraphStore graphStore;
    private EmbeddingIndexer embeddingIndexer;
    private VectorStore vectorStore;
    private IndexingServiceImpl indexingService;

    @BeforeEach
    void setUp() {
        AppProperties props = new AppProperties();
        props.getIndexing().setWorkspaceDir(workspace.toString());

        graphStore = new InMemoryGraphStore();
        embeddingIndexer = mock(EmbeddingIndexer.class);
        when(embeddingIndexer.index(anyList(), anyString())).thenReturn(EmbeddingRun.empty());
        vectorStore = mock(VectorStore.class);
        indexingService = new IndexingServiceImpl(
                new GitRepositorySource(props),
                new SourceParserRegistry(List.of(new PythonSourceParser(), new JavaSourceParser())),
                new GraphUpsertEngine(graphStore, new RelationshipInferencer()),
                new CodeChunker(props),
                embeddingIndexer,
                graphStore,
                vectorStore,
                props);
    }

    @Test
    @DisplayName("Should index a local repository end to end")
    void shouldIndexLocalRepository() throws IOException {
        // Given
        write("pkg/base.py", "class Base:\n    def save(self):\n        return True\n");
        write("pkg/sub.py", "from pkg.base import Base\n\n\nclass Sub(Base):\n    pass\n");
        write("tests/test_base.py", "def test_save():\n    assert True\n");
        write("README.md", "# demo\n");
        when(embeddingIndexer.index(anyList(), eq("demo"))).thenAnswer(inv -> new EmbeddingRun(((List<?>) inv.getArgument(0)).size(), 0));

        // When
        IndexingResult result = indexingService.indexRepository(repo.toString(), "demo");

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getFilesProcessed()).isEqualTo(2);
        assertThat(result.getFilesSkipped()).isEqualTo(1);
        assertThat(result.getParsingErrors()).isZero();
        assertThat(result.getPackagesCreated()).isEqualTo(1);
        assertThat(result.getChunksIndexed()).isEqualTo(2);
        assertThat(result.getEmbeddingBatchErrors()).isZero();
        assertThat(result.getGraphStatistics().getNodesByLabel()).containsEntry("Package", 1L);
        assertThat(graphStore.hasEdge("pkg.sub.Sub", RelationshipKind.INHERITS_FROM, "pkg.base.Base")).isTrue();
        assertThat(Files.exists(repo.resolve("pkg/base.py"))).as("local repositories are left in place").isTrue();

        IndexingStatus status = indexingService.getStatus("demo");
        assertThat(status.getState()).isEqualTo(IndexingState.COMPLETED);
        assertThat(status.getResult()).isSameAs(result);
    }

    @Test
    @DisplayName("Should count files with syntax errors without failing the run")
    void shouldCountParsingErrors() throws IOException {
        // Given
        write("pkg/good.py", "def ok():\n    return 1\n");
        write("pkg/bad.py", "def broken(:\n");

        // When
        IndexingResult result = indexingService.indexRepository(repo.toString(), "demo");

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getFilesProcessed()).isEqualTo(1);
        assertThat(result.getParsingErrors()).isEqualTo(1);
        assertThat(result.getErrors()).anyMatch(e -> e.contains("pkg/bad.py"));
    }

    @Test
    @DisplayName("Should fail when the repository cannot be downloaded")
    void shouldFailOnMissingRepository() {
        // When
        IndexingResult result = indexingService.indexRepository(repo.resolve("missing").toString(), "demo");

        // Then
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrors()).anyMatch(e -> e.contains("does not exist"));
        assertThat(indexingService.getStatus("demo").getState()).isEqualTo(IndexingState.FAILED);
    }

    @Test
    @DisplayName("Should fail when no file can be parsed")
    void shouldFailWithoutParseableFiles() throws IOException {
        // Given
        write("pkg/bad.py", "class (:\n");

        // When
        IndexingResult result = indexingService.indexRepository(repo.toString(), "demo");

        // Then
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getParsingErrors()).isEqualTo(1);
        assertThat(graphStore.nodeCount()).isZero();
    }

    @Test
    @DisplayName("Should keep graph results when embedding fails")
    void shouldSurviveEmbeddingFailure() throws IOException {
        // Given
        write("app.py", "def main():\n    return 1\n");
        when(embeddingIndexer.index(anyList(), eq("demo"))).thenThrow(new RuntimeException("Pinecone down"));

        // When
        IndexingResult result = indexingService.indexRepository(repo.toString(), "demo");

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getChunksIndexed()).isZero();
        assertThat(result.getErrors()).anyMatch(e -> e.contains("Pinecone down"));
    }

    @Test
    @DisplayName("Should report failed embedding batches alongside the vectors written")
    void shouldReportFailedEmbeddingBatches() throws IOException {
        // Given
        write("app.py", "def main():\n    return 1\n");
        when(embeddingIndexer.index(anyList(), eq("demo"))).thenReturn(new EmbeddingRun(4, 2));

        // When
        IndexingResult result = indexingService.indexRepository(repo.toString(), "demo");

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getChunksIndexed()).isEqualTo(4);
        assertThat(result.getEmbeddingBatchErrors()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should track PENDING, report NOT_STARTED for unknown runs and clear both stores")
    void shouldTrackStatusAndClear() {
        // When
        IndexingStatus pending = indexingService.accept("https://github.com/acme/demo.git", "demo");

        // Then
        assertThat(pending.getState()).isEqualTo(IndexingState.PENDING);
        assertThat(indexingService.getStatus("other").getState()).isEqualTo(IndexingState.NOT_STARTED);

        indexingService.clearIndex("demo");
        verify(vectorStore).delete("demo");
        assertThat(indexingService.getStatus("demo").getState()).isEqualTo(IndexingState.NOT_STARTED);
    }

    @Test
    @DisplayName("Should recognise test files by path marker")
    void shouldDetectTestFiles() {
        assertThat(indexingService.isTestFile("tests/test_api.py")).isTrue();
        assertThat(indexingService.isTestFile("test_api.py")).isTrue();
        assertThat(indexingService.isTestFile("pkg/api_test.py")).isTrue();
        assertThat(indexingService.isTestFile("src/test/java/com/acme/FooTest.java")).isTrue();
        assertThat(indexingService.isTestFile("pkg/contest.py")).isFalse();
    }

    private void write(String relative, String content) throws IOException {
        Path file = repo.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
