package com.purchasingpower.codegraph.knowledge;

import com.google.common.base.Preconditions;
import com.purchasingpower.codegraph.configuration.AppProperties;
import com.purchasingpower.codegraph.core.CodeChunk;
import com.purchasingpower.codegraph.core.FileExtraction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Splits files into fixed-size line windows that overlap by a fixed number of lines.
 *
 * <p>With the defaults (650 lines, 50 overlap) a 1300-line file gives chunks
 * 1-650, 601-1250 and 1201-1300, numbered from 1.
 */
@Slf4j
@Component
public class CodeChunker {

    private final int chunkSize;
    private final int overlap;

    @Autowired
    public CodeChunker(AppProperties props) {
        this(props.getIndexing().getChunkSize(), props.getIndexing().getChunkOverlap());
    }

    public CodeChunker(int chunkSize, int overlap) {
        Preconditions.checkArgument(chunkSize > 0, "Chunk size must be positive");
        Preconditions.checkArgument(overlap >= 0 && overlap < chunkSize, "Overlap must be in [0, chunkSize)");
        this.chunkSize = chunkSize;
        this.overlap = overlap;
    }

    public List<CodeChunk> chunk(String repoId, String filePath, String language, String content) {
        List<CodeChunk> chunks = new ArrayList<>();
        if (content == null || content.isEmpty()) {
            return chunks;
        }

        String[] lines = content.split("\n", -1);
        String fileName = filePath.substring(filePath.lastIndexOf('/') + 1);
        int step = chunkSize - overlap;
        int sequence = 1;

        for (int start = 0; start < lines.length; start += step) {
            int end = Math.min(start + chunkSize, lines.length);
            chunks.add(CodeChunk.builder()
                    .chunkId(CodeChunk.chunkId(repoId, filePath, sequence++))
                    .repoId(repoId)
                    .filePath(filePath)
                    .fileName(fileName)
                    .language(language)
                    .startLine(start + 1)
                    .endLine(end)
                    .content(String.join("\n", Arrays.copyOfRange(lines, start, end)))
                    .build());
            if (end >= lines.length) {
                break;
            }
        }
        return chunks;
    }

    public List<CodeChunk> chunkAll(String repoId, List<FileExtraction> files) {
        List<CodeChunk> chunks = new ArrayList<>();
        for (FileExtraction file : files) {
            chunks.addAll(chunk(repoId, file.getFilePath(), file.getLanguage(), file.getContent()));
        }
        log.info("✂️ Chunked {} files into {} chunks", files.size(), chunks.size());
        return chunks;
    }
}
