package com.purchasingpower.codegraph.exception;

/**
 * The repository could not be cloned or located. Fails the whole indexing run.
 */
public class RepositoryDownloadException extends CodeGraphException {

    public RepositoryDownloadException(String message, Throwable cause) {
        super(message, cause);
    }

    public RepositoryDownloadException(String message) {
        super(message);
    }
}
