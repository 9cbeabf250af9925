package com.purchasingpower.codegraph.parser;

import com.purchasingpower.codegraph.core.FileExtraction;
import com.purchasingpower.codegraph.exception.FileParsingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Picks the parser for a file and runs batch extraction with per-file isolation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SourceParserRegistry {

    private final List<SourceParser> parsers;

    public Optional<SourceParser> parserFor(String relativePath) {
        return parsers.stream()
                .filter(parser -> parser.supports(relativePath))
                .findFirst();
    }

    public boolean isSupported(String relativePath) {
        return parserFor(relativePath).isPresent();
    }

    public FileExtraction parse(SourceFile file) {
        SourceParser parser = parserFor(file.relativePath())
                .orElseThrow(() -> new FileParsingException(file.relativePath(), "no parser for file type"));
        return parser.parse(file);
    }

    /**
     * Parse every file. A file with syntax errors is recorded as a failure and
     * never stops the remaining files.
     */
    public ParsedBatch parseAll(List<SourceFile> files) {
        log.info("📂 Parsing {} source files", files.size());
        ParsedBatch.ParsedBatchBuilder batch = ParsedBatch.builder();
        int parsed = 0;

        for (SourceFile file : files) {
            try {
                batch.extraction(parse(file));
                parsed++;
            } catch (FileParsingException e) {
                log.warn("⚠️ Skipping {}: {}", file.relativePath(), e.getMessage());
                batch.failure(e);
            } catch (RuntimeException e) {
                log.error("❌ Unexpected parser failure for {}: {}", file.relativePath(), e.getMessage(), e);
                batch.failure(new FileParsingException(file.relativePath(), e));
            }
        }

        log.info("✅ Successfully parsed {}/{} files", parsed, files.size());
        return batch.build();
    }
}
