package com.purchasingpower.codegraph.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Everything extracted from a single source file.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class FileExtraction {
    String filePath;
    String qualifiedModule;
    String packageName; // empty for a top-level module
    String language;
    String content;
    @Singular
    List<CodeEntity> entities;
    @Singular("importName")
    Set<String> imports;
}
