package com.purchasingpower.codegraph.parser;

/**
 * Raw source text of one repository file, addressed by its repository-relative path.
 */
public record SourceFile(String relativePath, String content) {

    public String fileName() {
        int idx = relativePath.lastIndexOf('/');
        return idx < 0 ? relativePath : relativePath.substring(idx + 1);
    }
}
