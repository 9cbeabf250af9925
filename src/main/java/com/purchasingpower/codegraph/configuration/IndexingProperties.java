package com.purchasingpower.codegraph.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;

/**
 * Settings for repository download, file selection, chunking and embedding batches.
 */
@Data
public class IndexingProperties {

    @NotBlank(message = "Workspace directory path is required")
    private String workspaceDir = System.getProperty("java.io.tmpdir") + "/code-graph-repos";

    @NotEmpty
    private List<String> sourceExtensions = List.of(".py", ".java");

    private List<String> excludedDirectories = List.of(
            ".git", "__pycache__", ".tox", "venv", ".venv", "build", "dist", "target", "node_modules");

    /**
     * Path substrings that mark a file as a test file. Matching files are skipped.
     */
    private List<String> testPathMarkers = List.of("/test/", "/tests/", "/test_", "_test.", "Test.java");

    @Min(1)
    private int chunkSize = 650;

    @Min(0)
    private int chunkOverlap = 50;

    @Min(1)
    private int embedBatchSize = 32;

    @Min(1)
    private int upsertBatchSize = 100;

    @Min(1)
    private int maxEmbedChars = 2000;

    @Min(1)
    private int previewChars = 500;
}
