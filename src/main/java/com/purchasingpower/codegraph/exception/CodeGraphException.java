package com.purchasingpower.codegraph.exception;

/**
 * Base class for code graph failures. All subclasses are recovered locally
 * and surfaced as counters, messages or a scenario tag.
 */
public class CodeGraphException extends RuntimeException {

    public CodeGraphException(String message) {
        super(message);
    }

    public CodeGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
