package com.purchasingpower.codegraph.knowledge;

import lombok.Builder;
import lombok.Value;

/**
 * One semantic search hit. {@code score} is the similarity in [0, 1].
 */
@Value
@Builder
public class ChunkMatch {
    String chunkId;
    double score;
    String filePath;
    String fileName;
    String language;
    int startLine;
    int endLine;
    String contentPreview;

    public int getRelevancePercent() {
        return (int) Math.round(score * 100);
    }
}
