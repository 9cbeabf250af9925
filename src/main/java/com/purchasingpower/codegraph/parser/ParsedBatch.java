package com.purchasingpower.codegraph.parser;

import com.purchasingpower.codegraph.core.FileExtraction;
import com.purchasingpower.codegraph.exception.FileParsingException;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Result of extracting a batch of files: one extraction per parseable file
 * and one failure per file that could not be parsed.
 */
@Value
@Builder
public class ParsedBatch {
    @Singular
    List<FileExtraction> extractions;
    @Singular
    List<FileParsingException> failures;

    public int getParsingErrorCount() {
        return failures.size();
    }
}
