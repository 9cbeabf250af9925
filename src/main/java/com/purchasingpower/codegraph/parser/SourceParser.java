package com.purchasingpower.codegraph.parser;

import com.purchasingpower.codegraph.core.FileExtraction;
import com.purchasingpower.codegraph.exception.FileParsingException;

/**
 * Extracts typed entities from one source file.
 *
 * <p>Implementations are stateless between calls: the class-name stack and any
 * per-file maps live only for the duration of {@link #parse(SourceFile)}.
 *
 * @since 1.0.0
 */
public interface SourceParser {

    /**
     * Language tag stored on extractions and chunks, e.g. "python".
     */
    String getLanguage();

    /**
     * @param relativePath path relative to the repository root, forward slashes
     * @return true if this parser handles the file
     */
    boolean supports(String relativePath);

    /**
     * Parse one file.
     *
     * @throws FileParsingException if the file has syntax errors
     */
    FileExtraction parse(SourceFile file);
}
