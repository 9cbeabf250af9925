package com.purchasingpower.codegraph.exception;

import lombok.Getter;

/**
 * A single source file could not be parsed. Fatal to that file only.
 */
@Getter
public class FileParsingException extends CodeGraphException {

    private final String filePath;

    public FileParsingException(String filePath, String detail) {
        super("Failed to parse " + filePath + ": " + detail);
        this.filePath = filePath;
    }

    public FileParsingException(String filePath, Throwable cause) {
        super("Failed to parse " + filePath + ": " + cause.getMessage(), cause);
        this.filePath = filePath;
    }
}
