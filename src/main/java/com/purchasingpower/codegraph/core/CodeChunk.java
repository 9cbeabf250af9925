package com.purchasingpower.codegraph.core;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fixed-size, overlapping line range of a source file.
 *
 * <p>Lines are 1-indexed and inclusive. Chunk boundaries do not follow entity boundaries.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class CodeChunk {
    String chunkId;
    String repoId;
    String filePath;
    String fileName;
    String language;
    int startLine;
    int endLine;
    String content;

    public static String chunkId(String repoId, String filePath, int sequence) {
        return repoId + "#" + filePath + "#" + sequence;
    }

    public String preview(int maxChars) {
        if (content == null) {
            return "";
        }
        return content.length() <= maxChars ? content : content.substring(0, maxChars);
    }

    /**
     * Flat metadata stored next to the vector.
     */
    public Map<String, String> toMetadata(int previewChars) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("repo_id", repoId);
        metadata.put("file_path", filePath);
        metadata.put("file_name", fileName);
        metadata.put("language", language);
        metadata.put("start_line", String.valueOf(startLine));
        metadata.put("end_line", String.valueOf(endLine));
        metadata.put("content_preview", preview(previewChars));
        metadata.put("chunk_size_lines", String.valueOf(endLine - startLine + 1));
        return metadata;
    }
}
