package com.purchasingpower.codegraph.knowledge;

import com.purchasingpower.codegraph.core.CodeChunk;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Code chunker")
class CodeChunkerTest {

    private final CodeChunker chunker = new CodeChunker(650, 50);

    @Test
    @DisplayName("Should split 1300 lines into three overlapping windows")
    void shouldSplitWithOverlap() {
        // Given
        String content = lines(1300);

        // When
        List<CodeChunk> chunks = chunker.chunk("demo", "pkg/big.py", "python", content);

        // Then
        assertThat(chunks).extracting(CodeChunk::getStartLine).containsExactly(1, 601, 1201);
        assertThat(chunks).extracting(CodeChunk::getEndLine).containsExactly(650, 1250, 1300);
        assertThat(chunks).extracting(CodeChunk::getChunkId)
                .containsExactly("demo#pkg/big.py#1", "demo#pkg/big.py#2", "demo#pkg/big.py#3");
        assertThat(chunks.get(1).getContent()).startsWith("line 601\n");
        assertThat(chunks.get(0).getFileName()).isEqualTo("big.py");
    }

    @Test
    @DisplayName("Should produce one chunk for a short file and none for an empty one")
    void shouldHandleSmallFiles() {
        assertThat(chunker.chunk("demo", "a.py", "python", lines(10))).singleElement()
                .satisfies(chunk -> {
                    assertThat(chunk.getStartLine()).isEqualTo(1);
                    assertThat(chunk.getEndLine()).isEqualTo(10);
                });
        assertThat(chunker.chunk("demo", "a.py", "python", "")).isEmpty();
    }

    @Test
    @DisplayName("Should expose flat metadata with a bounded preview")
    void shouldBuildMetadata() {
        // Given
        CodeChunk chunk = chunker.chunk("demo", "pkg/a.py", "python", lines(3)).get(0);

        // When
        Map<String, String> metadata = chunk.toMetadata(6);

        // Then
        assertThat(metadata)
                .containsEntry("repo_id", "demo")
                .containsEntry("file_path", "pkg/a.py")
                .containsEntry("file_name", "a.py")
                .containsEntry("start_line", "1")
                .containsEntry("end_line", "3")
                .containsEntry("content_preview", "line 1")
                .containsEntry("chunk_size_lines", "3");
    }

    @Test
    @DisplayName("Should reject an overlap that is not smaller than the chunk size")
    void shouldRejectBadOverlap() {
        assertThatThrownBy(() -> new CodeChunker(10, 10)).isInstanceOf(IllegalArgumentException.class);
    }

    private static String lines(int count) {
        return IntStream.rangeClosed(1, count).mapToObj(i -> "line " + i).collect(Collectors.joining("\n"));
    }
}
