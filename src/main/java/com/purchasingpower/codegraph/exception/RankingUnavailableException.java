package com.purchasingpower.codegraph.exception;

/**
 * The ranking call failed or returned output that is not the expected JSON.
 */
public class RankingUnavailableException extends CodeGraphException {

    public RankingUnavailableException(String message) {
        super(message);
    }

    public RankingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
